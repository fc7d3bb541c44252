package ai.puzzles.game;

/**
 * Direction the blank travels in a single slide.
 *
 * <p>Declaration order is the canonical successor order (UP, DOWN, LEFT, RIGHT). Search engines
 * and tests rely on it, so do not reorder the constants.
 */
public enum Move {
    UP(-1, 0),
    DOWN(1, 0),
    LEFT(0, -1),
    RIGHT(0, 1);

    private final int rowDelta;
    private final int colDelta;

    Move(int rowDelta, int colDelta) {
        this.rowDelta = rowDelta;
        this.colDelta = colDelta;
    }

    public int getRowDelta() {
        return rowDelta;
    }

    public int getColDelta() {
        return colDelta;
    }

    /**
     * Returns the move that undoes this one.
     */
    public Move inverse() {
        switch (this) {
            case UP:
                return DOWN;
            case DOWN:
                return UP;
            case LEFT:
                return RIGHT;
            default:
                return LEFT;
        }
    }
}
