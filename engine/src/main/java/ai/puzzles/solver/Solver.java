package ai.puzzles.solver;

import ai.puzzles.game.Board;

/**
 * A search strategy that drives a start board to a goal board.
 *
 * <p>Implementations are stateless between calls: every {@link #solve(Board, Board)} builds its own
 * frontier and visited set, so one instance may serve concurrent callers. A call runs to completion
 * on the calling thread and always terminates with either {@link SearchOutcome#FOUND} or
 * {@link SearchOutcome#EXHAUSTED}.
 */
public interface Solver {

    /**
     * The strategy this solver implements.
     */
    SearchAlgorithm algorithm();

    /**
     * Searches from {@code start} to {@code goal}.
     *
     * @param start validated start board
     * @param goal goal board of the same dimension
     * @return the outcome with path and metrics; never null
     */
    SearchResult solve(Board start, Board goal);

    /**
     * Searches from {@code start} to the standard goal for its dimension.
     */
    default SearchResult solve(Board start) {
        return solve(start, Board.goal(start.getSize()));
    }
}
