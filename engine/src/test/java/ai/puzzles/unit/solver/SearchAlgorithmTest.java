package ai.puzzles.unit.solver;

import static org.junit.jupiter.api.Assertions.*;

import ai.puzzles.solver.SearchAlgorithm;
import org.junit.jupiter.api.Test;

class SearchAlgorithmTest {

    @Test
    void resolvesWireLabels() {
        assertEquals(SearchAlgorithm.BFS, SearchAlgorithm.fromLabel("BFS"));
        assertEquals(SearchAlgorithm.DFS, SearchAlgorithm.fromLabel("dfs"));
        assertEquals(SearchAlgorithm.ASTAR, SearchAlgorithm.fromLabel("A*"));
    }

    @Test
    void resolvesConstantNameSpellings() {
        assertEquals(SearchAlgorithm.ASTAR, SearchAlgorithm.fromLabel("astar"));
        assertEquals(SearchAlgorithm.ASTAR, SearchAlgorithm.fromLabel("A_STAR"));
        assertEquals(SearchAlgorithm.ASTAR, SearchAlgorithm.fromLabel(" a-star "));
    }

    @Test
    void rejectsUnknownLabels() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SearchAlgorithm.fromLabel("IDA*"));
        assertEquals("Unknown algorithm: IDA*", e.getMessage());
        assertThrows(IllegalArgumentException.class, () -> SearchAlgorithm.fromLabel(null));
        assertThrows(IllegalArgumentException.class, () -> SearchAlgorithm.fromLabel(" "));
    }

    @Test
    void onlyDepthFirstIsNonOptimal() {
        assertTrue(SearchAlgorithm.BFS.isOptimal());
        assertTrue(SearchAlgorithm.ASTAR.isOptimal());
        assertFalse(SearchAlgorithm.DFS.isOptimal());
    }
}
