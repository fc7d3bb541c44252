package ai.puzzles.game;

import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link Board} as a bordered grid for console output.
 * <p>
 * Each tile is centred in a fixed-width cell; the blank is drawn as an empty cell. Output for a
 * 3×3 goal board looks like:
 * <pre>
 * +----+----+----+
 * | 1  | 2  | 3  |
 * +----+----+----+
 * ...
 * </pre>
 */
public class BoardFormatter {
    /** Cell width in characters, excluding the border. */
    private static final int CELL_WIDTH = 4;

    private final Board board;

    /**
     * @param board the board to render; must not be null
     */
    public BoardFormatter(Board board) {
        this.board = board;
    }

    /**
     * Renders the full grid, one text line per border and per row, each ending in a newline.
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        String border = buildBorder(board.getSize());
        sb.append(border).append('\n');
        for (int r = 0; r < board.getSize(); r++) {
            List<String> cells = new ArrayList<>();
            for (int c = 0; c < board.getSize(); c++) {
                int tile = board.get(r, c);
                cells.add(tile == 0 ? "" : Integer.toString(tile));
            }
            sb.append(buildRow(cells)).append('\n');
            sb.append(border).append('\n');
        }
        return sb.toString();
    }

    /**
     * Renders the board on a single line, e.g. {@code 1 2 3 | 4 _ 6 | 7 5 8}, for log messages.
     */
    public String formatInline() {
        StringBuilder sb = new StringBuilder();
        for (int r = 0; r < board.getSize(); r++) {
            if (r > 0) {
                sb.append(" | ");
            }
            for (int c = 0; c < board.getSize(); c++) {
                if (c > 0) {
                    sb.append(' ');
                }
                int tile = board.get(r, c);
                sb.append(tile == 0 ? "_" : Integer.toString(tile));
            }
        }
        return sb.toString();
    }

    private String buildBorder(int columns) {
        StringBuilder line = new StringBuilder("+");
        for (int i = 0; i < columns; i++) {
            line.append("-".repeat(CELL_WIDTH)).append('+');
        }
        return line.toString();
    }

    private String buildRow(List<String> cells) {
        StringBuilder line = new StringBuilder("|");
        for (String cell : cells) {
            line.append(padCell(cell, CELL_WIDTH)).append('|');
        }
        return line.toString();
    }

    /**
     * Centres a value within the given width, putting the odd space on the right.
     */
    private String padCell(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        int totalPad = width - value.length();
        int left = totalPad / 2;
        int right = totalPad - left;
        return " ".repeat(left) + value + " ".repeat(right);
    }
}
