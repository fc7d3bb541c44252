package ai.puzzles.solver;

import ai.puzzles.game.Board;
import java.util.Collections;
import java.util.List;

/**
 * Immutable outcome of one search run: the solution path (if any) and performance metrics.
 */
public final class SearchResult {
    private final SearchAlgorithm algorithm;
    private final SearchOutcome outcome;
    private final List<Board> solutionPath;
    private final long nodesExpanded;
    private final int maxFrontierSize;
    private final long elapsedNanos;
    private final Integer depthLimit;
    private final String message;

    private SearchResult(
            SearchAlgorithm algorithm,
            SearchOutcome outcome,
            List<Board> solutionPath,
            long nodesExpanded,
            int maxFrontierSize,
            long elapsedNanos,
            Integer depthLimit,
            String message) {
        this.algorithm = algorithm;
        this.outcome = outcome;
        this.solutionPath = Collections.unmodifiableList(solutionPath);
        this.nodesExpanded = nodesExpanded;
        this.maxFrontierSize = maxFrontierSize;
        this.elapsedNanos = elapsedNanos;
        this.depthLimit = depthLimit;
        this.message = message;
    }

    static SearchResult found(SearchAlgorithm algorithm, SearchNode goalNode, SearchStats stats, Integer depthLimit) {
        return new SearchResult(algorithm, SearchOutcome.FOUND, goalNode.pathFromRoot(),
                stats.getNodesExpanded(), stats.getMaxFrontierSize(), stats.elapsedNanos(), depthLimit, null);
    }

    static SearchResult exhausted(SearchAlgorithm algorithm, SearchStats stats, Integer depthLimit, String message) {
        return new SearchResult(algorithm, SearchOutcome.EXHAUSTED, Collections.emptyList(),
                stats.getNodesExpanded(), stats.getMaxFrontierSize(), stats.elapsedNanos(), depthLimit, message);
    }

    public SearchAlgorithm getAlgorithm() {
        return algorithm;
    }

    public SearchOutcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == SearchOutcome.FOUND;
    }

    /**
     * Boards from start to goal inclusive; empty when no solution was found.
     */
    public List<Board> getSolutionPath() {
        return solutionPath;
    }

    /**
     * Number of moves in the solution, or -1 when no solution was found.
     */
    public int getSolutionDepth() {
        return solutionPath.size() - 1;
    }

    /**
     * Nodes popped from the frontier and goal-tested; A* does not count stale entries it discards.
     */
    public long getNodesExpanded() {
        return nodesExpanded;
    }

    /**
     * High-water mark of the frontier (queue, stack or priority queue) size.
     */
    public int getMaxFrontierSize() {
        return maxFrontierSize;
    }

    public long getElapsedNanos() {
        return elapsedNanos;
    }

    public double getElapsedSeconds() {
        return elapsedNanos / 1_000_000_000.0;
    }

    /**
     * Depth limit applied by DFS, null for the other strategies.
     */
    public Integer getDepthLimit() {
        return depthLimit;
    }

    /**
     * Explanation when the search was exhausted, otherwise null.
     */
    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return "SearchResult{algorithm=" + algorithm.getLabel()
                + ", outcome=" + outcome
                + ", depth=" + getSolutionDepth()
                + ", nodesExpanded=" + nodesExpanded
                + ", maxFrontierSize=" + maxFrontierSize
                + ", elapsedNanos=" + elapsedNanos + "}";
    }
}
