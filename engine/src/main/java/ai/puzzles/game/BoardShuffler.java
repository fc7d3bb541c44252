package ai.puzzles.game;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Produces scrambled boards by walking the blank randomly away from the goal.
 *
 * <p>Every board it returns is reachable from the goal, so it always passes the
 * {@link SolvabilityChecker}. The walk may revisit earlier positions; a larger move count gives
 * a more scrambled board on average but no particular solution depth is guaranteed.
 */
public class BoardShuffler {
    private final Random random;

    public BoardShuffler() {
        this(new Random());
    }

    public BoardShuffler(Random random) {
        this.random = random;
    }

    /**
     * Applies {@code moves} uniformly random legal slides starting from the goal of {@code size}.
     *
     * @throws InvalidBoardException if the size is unsupported
     * @throws IllegalArgumentException if {@code moves} is negative
     */
    public Board shuffle(int size, int moves) {
        if (moves < 0) {
            throw new IllegalArgumentException("Shuffle move count must be >= 0, got " + moves);
        }
        Board board = Board.goal(size);
        List<Move> legal = new ArrayList<>(4);
        for (int i = 0; i < moves; i++) {
            legal.clear();
            for (Move move : Move.values()) {
                if (board.canMove(move)) {
                    legal.add(move);
                }
            }
            board = board.move(legal.get(random.nextInt(legal.size())));
        }
        return board;
    }
}
