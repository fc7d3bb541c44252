package ai.puzzles.game;

/**
 * Feasibility verdict for a board, with the parity diagnostics that produced it.
 */
public final class Solvability {
    private final boolean solvable;
    private final int inversions;
    private final int blankRowFromBottom;
    private final int size;

    Solvability(boolean solvable, int inversions, int blankRowFromBottom, int size) {
        this.solvable = solvable;
        this.inversions = inversions;
        this.blankRowFromBottom = blankRowFromBottom;
        this.size = size;
    }

    public boolean isSolvable() {
        return solvable;
    }

    public int getInversions() {
        return inversions;
    }

    /**
     * Row of the blank counted from the bottom, 1-indexed.
     */
    public int getBlankRowFromBottom() {
        return blankRowFromBottom;
    }

    public int getSize() {
        return size;
    }

    /**
     * User-facing explanation when the board cannot be solved, otherwise {@code null}.
     */
    public String getReason() {
        if (solvable) {
            return null;
        }
        return "This puzzle has " + inversions + " inversion(s) and is not solvable. "
                + "Try a different configuration.";
    }

    @Override
    public String toString() {
        return "Solvability{solvable=" + solvable + ", inversions=" + inversions
                + ", blankRowFromBottom=" + blankRowFromBottom + ", size=" + size + "}";
    }
}
