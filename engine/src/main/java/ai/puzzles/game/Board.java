package ai.puzzles.game;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Immutable sliding-tile board: an N×N grid holding each label {@code 0..N²-1} exactly once,
 * where {@code 0} is the blank.
 *
 * <p>Only 2×2 and 3×3 boards are supported. Every slide produces a fresh board; instances are
 * never mutated after construction, so they can be shared freely between search nodes and threads.
 *
 * <p>Two boards are equal iff their cells match. {@link #getStateKey()} packs the row-major cells
 * 4 bits apiece into a {@code long}, which is the canonical key used by the visited sets.
 */
public final class Board {

    /** Smallest supported grid dimension. */
    public static final int MIN_SIZE = 2;
    /** Largest supported grid dimension. */
    public static final int MAX_SIZE = 3;

    private static final Board GOAL_2 = goalFor(2);
    private static final Board GOAL_3 = goalFor(3);

    private final int size;
    /** Row-major cell values. */
    private final int[] cells;
    private final int blankIndex;
    private final long stateKey;

    private Board(int size, int[] cells) {
        this.size = size;
        this.cells = cells;
        int blank = -1;
        long key = 0L;
        for (int i = 0; i < cells.length; i++) {
            if (cells[i] == 0) {
                blank = i;
            }
            key = (key << 4) | cells[i];
        }
        this.blankIndex = blank;
        this.stateKey = key;
    }

    /**
     * Builds a board from rows, validating shape and labels.
     *
     * @param rows N rows of N cell values each
     * @return the validated board
     * @throws InvalidBoardException if the dimension is unsupported or the board is malformed
     */
    public static Board of(int[][] rows) {
        if (rows == null || rows.length == 0) {
            throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                    "Invalid puzzle: board is empty.");
        }
        int size = rows.length;
        requireSupportedSize(size);
        int[] cells = new int[size * size];
        for (int r = 0; r < size; r++) {
            if (rows[r] == null || rows[r].length != size) {
                throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                        "Invalid puzzle: All rows must have the same size (" + size + ").");
            }
            System.arraycopy(rows[r], 0, cells, r * size, size);
        }
        return fromCells(size, cells);
    }

    /**
     * Builds a board from nested lists, as decoded from a JSON request body.
     *
     * @throws InvalidBoardException on null cells, ragged rows or invalid labels
     */
    public static Board of(List<List<Integer>> rows) {
        if (rows == null || rows.isEmpty()) {
            throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                    "Invalid puzzle: board is empty.");
        }
        int[][] grid = new int[rows.size()][];
        for (int r = 0; r < rows.size(); r++) {
            List<Integer> row = rows.get(r);
            if (row == null) {
                throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                        "Invalid puzzle: row " + r + " is missing.");
            }
            grid[r] = new int[row.size()];
            for (int c = 0; c < row.size(); c++) {
                Integer value = row.get(c);
                if (value == null) {
                    throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                            "Invalid puzzle: cell (" + r + "," + c + ") is empty.");
                }
                grid[r][c] = value;
            }
        }
        return of(grid);
    }

    /**
     * Parses a comma-separated, row-major list of labels such as {@code "1,2,3,4,0,6,7,5,8"}.
     * The dimension is inferred from the number of labels.
     *
     * @throws InvalidBoardException if the text is not a square board of a supported size
     */
    public static Board parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                    "Invalid puzzle: board is empty.");
        }
        String[] parts = text.trim().split("\\s*,\\s*");
        int size = (int) Math.round(Math.sqrt(parts.length));
        if (size * size != parts.length) {
            throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                    "Invalid puzzle: " + parts.length + " cells do not form a square board.");
        }
        requireSupportedSize(size);
        int[] cells = new int[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                cells[i] = Integer.parseInt(parts[i]);
            } catch (NumberFormatException e) {
                throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                        "Invalid puzzle: '" + parts[i] + "' is not a tile label.");
            }
        }
        return fromCells(size, cells);
    }

    /**
     * Returns the fixed goal board for a dimension: labels {@code 1..N²-1} in row-major order
     * followed by the blank in the bottom-right corner.
     *
     * @throws InvalidBoardException if {@code size} is not 2 or 3
     */
    public static Board goal(int size) {
        requireSupportedSize(size);
        return size == 2 ? GOAL_2 : GOAL_3;
    }

    private static Board goalFor(int size) {
        int[] cells = new int[size * size];
        for (int i = 0; i < cells.length - 1; i++) {
            cells[i] = i + 1;
        }
        return new Board(size, cells);
    }

    private static void requireSupportedSize(int size) {
        if (size < MIN_SIZE || size > MAX_SIZE) {
            throw new InvalidBoardException(InvalidBoardException.Kind.UNSUPPORTED_SIZE,
                    "Invalid puzzle size. Only 2x2 and 3x3 puzzles are supported. Got "
                            + size + "x" + size + ".");
        }
    }

    private static Board fromCells(int size, int[] cells) {
        boolean[] seen = new boolean[cells.length];
        for (int value : cells) {
            if (value < 0 || value >= cells.length) {
                throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                        "Invalid puzzle: tile " + value + " is outside 0.." + (cells.length - 1) + ".");
            }
            if (seen[value]) {
                throw new InvalidBoardException(InvalidBoardException.Kind.MALFORMED_BOARD,
                        value == 0
                                ? "Invalid puzzle: more than one blank tile."
                                : "Invalid puzzle: tile " + value + " appears more than once.");
            }
            seen[value] = true;
        }
        return new Board(size, cells);
    }

    public int getSize() {
        return size;
    }

    /**
     * Returns the label at the given position ({@code 0} for the blank).
     */
    public int get(int row, int col) {
        return cells[row * size + col];
    }

    public int getBlankRow() {
        return blankIndex / size;
    }

    public int getBlankCol() {
        return blankIndex % size;
    }

    /**
     * Canonical key used for visited-set membership; equal boards have equal keys.
     */
    public long getStateKey() {
        return stateKey;
    }

    /**
     * Returns whether the blank can slide in the given direction without leaving the grid.
     */
    public boolean canMove(Move move) {
        int row = getBlankRow() + move.getRowDelta();
        int col = getBlankCol() + move.getColDelta();
        return row >= 0 && row < size && col >= 0 && col < size;
    }

    /**
     * Returns the board produced by sliding the blank in the given direction.
     *
     * @throws IllegalStateException if the move would take the blank off the grid
     */
    public Board move(Move move) {
        if (!canMove(move)) {
            throw new IllegalStateException("Blank at (" + getBlankRow() + "," + getBlankCol()
                    + ") cannot move " + move);
        }
        int target = (getBlankRow() + move.getRowDelta()) * size + getBlankCol() + move.getColDelta();
        int[] next = cells.clone();
        next[blankIndex] = next[target];
        next[target] = 0;
        return new Board(size, next);
    }

    /**
     * Returns whether this board is the goal board for its dimension.
     */
    public boolean isGoal() {
        return equals(goal(size));
    }

    /**
     * Manhattan distance from this board to its own goal board.
     */
    public int manhattanDistance() {
        return manhattanDistance(goal(size));
    }

    /**
     * Sum over every non-blank tile of its row plus column displacement from where the same
     * tile sits in {@code goal}. The blank contributes nothing, which keeps the estimate
     * admissible and consistent.
     *
     * @throws IllegalArgumentException if the boards differ in dimension
     */
    public int manhattanDistance(Board goal) {
        if (goal.size != size) {
            throw new IllegalArgumentException("Cannot compare a " + size + "x" + size
                    + " board with a " + goal.size + "x" + goal.size + " goal");
        }
        int[] goalIndex = new int[cells.length];
        for (int i = 0; i < goal.cells.length; i++) {
            goalIndex[goal.cells[i]] = i;
        }
        int distance = 0;
        for (int i = 0; i < cells.length; i++) {
            int tile = cells[i];
            if (tile == 0) {
                continue;
            }
            int target = goalIndex[tile];
            distance += Math.abs(i / size - target / size) + Math.abs(i % size - target % size);
        }
        return distance;
    }

    /**
     * Returns the non-blank labels in row-major order.
     */
    public int[] tilesWithoutBlank() {
        int[] tiles = new int[cells.length - 1];
        int n = 0;
        for (int value : cells) {
            if (value != 0) {
                tiles[n++] = value;
            }
        }
        return tiles;
    }

    /**
     * Returns a fresh copy of the grid as rows.
     */
    public int[][] toArray() {
        int[][] rows = new int[size][size];
        for (int r = 0; r < size; r++) {
            System.arraycopy(cells, r * size, rows[r], 0, size);
        }
        return rows;
    }

    /**
     * Returns the grid as nested lists, the shape used in JSON responses.
     */
    public List<List<Integer>> toRows() {
        List<List<Integer>> rows = new ArrayList<>(size);
        for (int r = 0; r < size; r++) {
            List<Integer> row = new ArrayList<>(size);
            for (int c = 0; c < size; c++) {
                row.add(get(r, c));
            }
            rows.add(row);
        }
        return rows;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Board)) {
            return false;
        }
        Board other = (Board) o;
        return size == other.size && stateKey == other.stateKey;
    }

    @Override
    public int hashCode() {
        return Long.hashCode(stateKey);
    }

    @Override
    public String toString() {
        return Arrays.deepToString(toArray());
    }
}
