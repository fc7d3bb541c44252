package ai.puzzles.unit.solver;

import static org.junit.jupiter.api.Assertions.*;

import ai.puzzles.game.Board;
import ai.puzzles.game.Move;
import ai.puzzles.solver.SearchNode;
import ai.puzzles.solver.Successor;
import ai.puzzles.unit.helpers.BoardFactory;
import java.util.List;
import java.util.PriorityQueue;
import org.junit.jupiter.api.Test;

class SearchNodeTest {

    @Test
    void childIsOneDeeperThanParent() {
        SearchNode root = SearchNode.root(BoardFactory.goal3());
        Board up = root.getBoard().move(Move.UP);
        SearchNode child = root.child(new Successor(Move.UP, up), 1, 1L);

        assertEquals(0, root.getPathCost());
        assertEquals(1, child.getPathCost());
        assertSame(root, child.getParent());
        assertEquals(Move.UP, child.getMove());
        assertEquals(2, child.getEstimatedTotalCost());
    }

    @Test
    void pathFromRootRunsStartToNode() {
        Board start = BoardFactory.goal3();
        Board first = start.move(Move.UP);
        Board second = first.move(Move.LEFT);

        SearchNode root = SearchNode.root(start);
        SearchNode leaf = root
                .child(new Successor(Move.UP, first), 0, 1L)
                .child(new Successor(Move.LEFT, second), 0, 2L);

        assertEquals(List.of(start, first, second), leaf.pathFromRoot());
        assertEquals(List.of(Move.UP, Move.LEFT), leaf.movesFromRoot());
        assertEquals(List.of(start), root.pathFromRoot());
        assertTrue(root.movesFromRoot().isEmpty());
    }

    @Test
    void equalCostNodesLeaveQueueInInsertionOrder() {
        SearchNode root = SearchNode.root(BoardFactory.twoMovesFromGoal(), 2);
        PriorityQueue<SearchNode> open = new PriorityQueue<>();
        SearchNode later = root.child(new Successor(Move.DOWN, root.getBoard().move(Move.DOWN)), 2, 5L);
        SearchNode earlier = root.child(new Successor(Move.UP, root.getBoard().move(Move.UP)), 2, 3L);
        SearchNode cheaper = root.child(new Successor(Move.LEFT, root.getBoard().move(Move.LEFT)), 1, 9L);
        open.add(later);
        open.add(earlier);
        open.add(cheaper);

        assertSame(cheaper, open.poll());
        assertSame(earlier, open.poll());
        assertSame(later, open.poll());
    }
}
