package ai.puzzles.solver;

import ai.puzzles.game.Board;
import ai.puzzles.game.Move;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates the boards reachable from a board by one blank slide.
 * <p>
 * Successors are emitted in the canonical {@link Move} order (UP, DOWN, LEFT, RIGHT), skipping
 * directions that would take the blank off the grid. There is no wraparound. A corner blank
 * yields 2 successors, an edge blank 3 and the centre of a 3×3 board 4.
 */
public final class SuccessorGenerator {
    private SuccessorGenerator() {
    }

    public static List<Successor> successors(Board board) {
        List<Successor> successors = new ArrayList<>(4);
        for (Move move : Move.values()) {
            if (board.canMove(move)) {
                successors.add(new Successor(move, board.move(move)));
            }
        }
        return successors;
    }
}
