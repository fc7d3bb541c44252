package ai.puzzles.solver;

/**
 * Per-run metric counters. Each search creates its own instance; nothing is shared between runs.
 */
final class SearchStats {
    private final long startNanos = System.nanoTime();
    private long nodesExpanded;
    private int maxFrontierSize;

    void recordExpansion() {
        nodesExpanded++;
    }

    void observeFrontier(int size) {
        if (size > maxFrontierSize) {
            maxFrontierSize = size;
        }
    }

    long getNodesExpanded() {
        return nodesExpanded;
    }

    int getMaxFrontierSize() {
        return maxFrontierSize;
    }

    long elapsedNanos() {
        return System.nanoTime() - startNanos;
    }
}
