package ai.puzzles.game;

/**
 * Parity test that decides whether a board can reach the goal at all.
 *
 * <p>Counts inversions over the row-major tiles with the blank removed. For odd widths a slide
 * never changes inversion parity, so the board is solvable iff the count is even. For even widths
 * a vertical slide flips inversion parity and moves the blank one row, so the invariant is the
 * parity of {@code inversions + blankRowFromBottom}; the goal has 0 inversions with the blank on
 * row 1, so a board is solvable iff that sum is odd.
 */
public final class SolvabilityChecker {
    private SolvabilityChecker() {
    }

    public static Solvability check(Board board) {
        int inversions = countInversions(board.tilesWithoutBlank());
        int size = board.getSize();
        int blankRowFromBottom = size - board.getBlankRow();
        boolean solvable;
        if (size % 2 == 1) {
            solvable = inversions % 2 == 0;
        } else {
            solvable = (inversions + blankRowFromBottom) % 2 == 1;
        }
        return new Solvability(solvable, inversions, blankRowFromBottom, size);
    }

    public static boolean isSolvable(Board board) {
        return check(board).isSolvable();
    }

    static int countInversions(int[] tiles) {
        int inversions = 0;
        for (int i = 0; i < tiles.length; i++) {
            for (int j = i + 1; j < tiles.length; j++) {
                if (tiles[i] > tiles[j]) {
                    inversions++;
                }
            }
        }
        return inversions;
    }
}
