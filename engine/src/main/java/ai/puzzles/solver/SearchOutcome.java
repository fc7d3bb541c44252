package ai.puzzles.solver;

/**
 * Terminal state of a search run.
 */
public enum SearchOutcome {
    /** The goal was reached and a path reconstructed. */
    FOUND,
    /**
     * The frontier emptied without reaching the goal: the board is unreachable, or for DFS every
     * branch hit the depth limit.
     */
    EXHAUSTED
}
