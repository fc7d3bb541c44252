package ai.puzzles.web;

import ai.puzzles.game.Board;
import java.util.List;

/**
 * JSON body returned by {@code GET /shuffle} and {@code GET /goal}.
 */
public class BoardResponse {
    private final List<List<Integer>> board;
    private final int size;

    public BoardResponse(Board board) {
        this.board = board.toRows();
        this.size = board.getSize();
    }

    public List<List<Integer>> getBoard() {
        return board;
    }

    public int getSize() {
        return size;
    }
}
