package ai.puzzles.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.puzzles.game.Board;
import ai.puzzles.game.Solvability;
import ai.puzzles.game.SolvabilityChecker;
import ai.puzzles.solver.BreadthFirstSolver;
import ai.puzzles.solver.SearchResult;
import ai.puzzles.unit.helpers.BoardFactory;
import org.junit.jupiter.api.Test;

/**
 * Parity checks for 3×3 and 2×2 boards, cross-checked against exhaustive search where the state
 * space is small enough.
 */
class SolvabilityCheckerTest {

    @Test
    void goalHasNoInversionsAndIsSolvable() {
        Solvability verdict = SolvabilityChecker.check(BoardFactory.goal3());
        assertTrue(verdict.isSolvable());
        assertEquals(0, verdict.getInversions());
        assertNull(verdict.getReason());
    }

    @Test
    void adjacentSwapHasOneInversionAndIsUnsolvable() {
        Solvability verdict = SolvabilityChecker.check(BoardFactory.adjacentSwap());
        assertFalse(verdict.isSolvable());
        assertEquals(1, verdict.getInversions());
        assertTrue(verdict.getReason().contains("1 inversion"), verdict.getReason());
    }

    @Test
    void hardestBoardIsSolvable() {
        Solvability verdict = SolvabilityChecker.check(BoardFactory.hardest());
        assertTrue(verdict.isSolvable());
        assertEquals(24, verdict.getInversions());
    }

    @Test
    void shuffledBoardsAreAlwaysSolvable() {
        for (long seed = 1; seed <= 50; seed++) {
            Board board = BoardFactory.shuffled(3, 60, seed);
            assertTrue(SolvabilityChecker.isSolvable(board), "Shuffled board should be solvable: " + board);
        }
    }

    @Test
    void twoByTwoGoalIsSolvable() {
        Solvability verdict = SolvabilityChecker.check(BoardFactory.goal2());
        assertTrue(verdict.isSolvable());
        assertEquals(0, verdict.getInversions());
        assertEquals(1, verdict.getBlankRowFromBottom());
    }

    @Test
    void twoByTwoBlankOnTopRowMatchesSearch() {
        Board board = Board.of(new int[][] {{1, 0}, {3, 2}});
        Solvability verdict = SolvabilityChecker.check(board);

        assertEquals(1, verdict.getInversions());
        assertEquals(2, verdict.getBlankRowFromBottom());
        assertTrue(verdict.isSolvable(), "Odd (inversions + blank row from bottom) means solvable on even widths");

        SearchResult result = new BreadthFirstSolver().solve(board);
        assertTrue(result.isSuccess());
        assertEquals(1, result.getSolutionDepth());
    }

    @Test
    void twoByTwoVerdictMatchesBreadthFirstSearchForEveryArrangement() {
        int solvable = 0;
        for (Board board : BoardFactory.allTwoByTwo()) {
            boolean reachable = new BreadthFirstSolver().solve(board).isSuccess();
            assertEquals(reachable, SolvabilityChecker.isSolvable(board), "Parity disagrees with search for " + board);
            if (reachable) {
                solvable++;
            }
        }
        assertEquals(12, solvable, "Exactly half of the 24 arrangements are reachable");
    }
}
