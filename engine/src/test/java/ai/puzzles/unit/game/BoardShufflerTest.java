package ai.puzzles.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.puzzles.game.Board;
import ai.puzzles.game.BoardShuffler;
import ai.puzzles.game.InvalidBoardException;
import java.util.Random;
import org.junit.jupiter.api.Test;

class BoardShufflerTest {

    @Test
    void zeroMovesReturnsGoal() {
        assertEquals(Board.goal(3), new BoardShuffler().shuffle(3, 0));
    }

    @Test
    void oneMoveDisplacesExactlyOneTile() {
        Board board = new BoardShuffler(new Random(7)).shuffle(3, 1);
        assertEquals(1, board.manhattanDistance());
    }

    @Test
    void sameSeedGivesSameBoard() {
        Board first = new BoardShuffler(new Random(42)).shuffle(3, 50);
        Board second = new BoardShuffler(new Random(42)).shuffle(3, 50);
        assertEquals(first, second);
    }

    @Test
    void shufflesTwoByTwo() {
        Board board = new BoardShuffler(new Random(3)).shuffle(2, 25);
        assertEquals(2, board.getSize());
    }

    @Test
    void negativeMoveCountIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> new BoardShuffler().shuffle(3, -1));
    }

    @Test
    void unsupportedSizeIsRejected() {
        assertThrows(InvalidBoardException.class, () -> new BoardShuffler().shuffle(4, 10));
    }
}
