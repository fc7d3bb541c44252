package ai.puzzles.solver;

import static org.junit.jupiter.api.Assertions.*;

import ai.puzzles.game.Board;
import ai.puzzles.unit.helpers.BoardFactory;
import ai.puzzles.unit.helpers.PathAssertions;
import org.junit.jupiter.api.Test;

/**
 * Behaviour tests for {@link AStarSolver}.
 */
class AStarSolverTest {

    private final Solver solver = new AStarSolver();

    @Test
    void goalStartReturnsDepthZero() {
        SearchResult result = solver.solve(BoardFactory.goal3());

        assertTrue(result.isSuccess());
        assertEquals(0, result.getSolutionDepth());
        assertEquals(1, result.getSolutionPath().size());
        assertEquals(1, result.getNodesExpanded());
    }

    @Test
    void followsTheHeuristicStraightToTheGoal() {
        // Root, then the DOWN child (f = 2), then the goal (f = 2); every other node has f >= 4.
        Board start = BoardFactory.twoMovesFromGoal();
        SearchResult result = solver.solve(start);

        PathAssertions.assertValidSolution(start, result);
        assertEquals(2, result.getSolutionDepth());
        assertEquals(3, result.getNodesExpanded());
        assertEquals(SearchAlgorithm.ASTAR, result.getAlgorithm());
    }

    @Test
    void findsOptimalSolutionForHardestBoard() {
        Board start = BoardFactory.hardest();
        SearchResult result = solver.solve(start);

        PathAssertions.assertValidSolution(start, result);
        assertEquals(31, result.getSolutionDepth());
    }

    @Test
    void expandsFewerNodesThanBreadthFirstOnHardestBoard() {
        Board start = BoardFactory.hardest();
        long astar = solver.solve(start).getNodesExpanded();
        long bfs = new BreadthFirstSolver().solve(start).getNodesExpanded();

        assertTrue(astar < bfs, "A* expanded " + astar + " nodes, BFS " + bfs);
    }

    @Test
    void unsolvableTwoByTwoExhausts() {
        Board start = Board.of(new int[][] {{2, 1}, {3, 0}});
        SearchResult result = solver.solve(start);

        assertEquals(SearchOutcome.EXHAUSTED, result.getOutcome());
        assertEquals(12, result.getNodesExpanded());
        assertTrue(result.getSolutionPath().isEmpty());
    }

    @Test
    void repeatedRunsAreDeterministic() {
        Board start = BoardFactory.shuffled(3, 40, 11L);
        SearchResult first = solver.solve(start);
        SearchResult second = solver.solve(start);

        assertEquals(first.getSolutionPath(), second.getSolutionPath());
        assertEquals(first.getNodesExpanded(), second.getNodesExpanded());
        assertEquals(first.getMaxFrontierSize(), second.getMaxFrontierSize());
    }
}
