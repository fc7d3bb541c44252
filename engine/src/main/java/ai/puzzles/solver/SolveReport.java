package ai.puzzles.solver;

import ai.puzzles.game.Solvability;

/**
 * Result of a full solve request: boundary validation, solvability check and search.
 *
 * <p>Every failure path produces a report rather than an exception, carrying the attempted
 * algorithm label, the board dimension and the inversion count where they are known.
 */
public final class SolveReport {

    /** How a request ended. */
    public enum Status {
        /** A search found the goal. */
        SOLVED(false),
        /** The board failed structural validation. */
        MALFORMED_BOARD(true),
        /** The board dimension is not 2 or 3. */
        UNSUPPORTED_SIZE(true),
        /** The algorithm label is not recognised. */
        UNKNOWN_ALGORITHM(true),
        /** The board is well-formed but fails the parity check; no search was run. */
        UNSOLVABLE(false),
        /** The search ran to exhaustion without reaching the goal. */
        EXHAUSTED(false);

        private final boolean rejected;

        Status(boolean rejected) {
            this.rejected = rejected;
        }

        /**
         * Whether the request was refused at the boundary before any check ran.
         */
        public boolean isRejected() {
            return rejected;
        }
    }

    private final Status status;
    private final String algorithmLabel;
    private final Integer size;
    private final Solvability solvability;
    private final SearchResult searchResult;
    private final String message;

    private SolveReport(Status status, String algorithmLabel, Integer size, Solvability solvability,
                        SearchResult searchResult, String message) {
        this.status = status;
        this.algorithmLabel = algorithmLabel;
        this.size = size;
        this.solvability = solvability;
        this.searchResult = searchResult;
        this.message = message;
    }

    static SolveReport rejected(Status status, String algorithmLabel, Integer size, String message) {
        return new SolveReport(status, algorithmLabel, size, null, null, message);
    }

    static SolveReport unsolvable(String algorithmLabel, Solvability solvability) {
        return new SolveReport(Status.UNSOLVABLE, algorithmLabel, solvability.getSize(), solvability, null,
                solvability.getReason());
    }

    static SolveReport searched(Solvability solvability, SearchResult result) {
        Status status = result.isSuccess() ? Status.SOLVED : Status.EXHAUSTED;
        return new SolveReport(status, result.getAlgorithm().getLabel(), solvability.getSize(), solvability,
                result, result.getMessage());
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SOLVED;
    }

    /**
     * Algorithm label as requested or resolved; may be null if the request named none.
     */
    public String getAlgorithmLabel() {
        return algorithmLabel;
    }

    /**
     * Board dimension, or null if the board was too malformed to tell.
     */
    public Integer getSize() {
        return size;
    }

    /**
     * Parity verdict; null when the request was rejected before the check.
     */
    public Solvability getSolvability() {
        return solvability;
    }

    /**
     * Search outcome; null unless a search actually ran.
     */
    public SearchResult getSearchResult() {
        return searchResult;
    }

    /**
     * Human-readable explanation of a failure; null on success.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "SolveReport{status=" + status + ", algorithm=" + algorithmLabel + ", size=" + size
                + ", message=" + message + "}";
    }
}
