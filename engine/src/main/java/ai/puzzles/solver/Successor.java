package ai.puzzles.solver;

import ai.puzzles.game.Board;
import ai.puzzles.game.Move;

/**
 * A board reachable in one slide, tagged with the slide that produced it.
 */
public final class Successor {
    private final Move move;
    private final Board board;

    public Successor(Move move, Board board) {
        this.move = move;
        this.board = board;
    }

    public Move getMove() {
        return move;
    }

    public Board getBoard() {
        return board;
    }

    @Override
    public String toString() {
        return move + " -> " + board;
    }
}
