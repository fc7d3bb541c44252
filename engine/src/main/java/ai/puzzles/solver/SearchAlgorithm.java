package ai.puzzles.solver;

import java.util.Locale;

/**
 * Search strategies offered by the solver, with the labels used on the wire.
 */
public enum SearchAlgorithm {
    /** Breadth-first search; optimal. */
    BFS("BFS", true),
    /** Depth-limited depth-first search; finds some solution within the limit, not necessarily the shortest. */
    DFS("DFS", false),
    /** A* with the Manhattan-distance heuristic; optimal. */
    ASTAR("A*", true);

    private final String label;
    private final boolean optimal;

    SearchAlgorithm(String label, boolean optimal) {
        this.label = label;
        this.optimal = optimal;
    }

    /**
     * Wire label, e.g. {@code "A*"}.
     */
    public String getLabel() {
        return label;
    }

    /**
     * Whether the strategy always returns a shortest solution.
     */
    public boolean isOptimal() {
        return optimal;
    }

    /**
     * Resolves a label case-insensitively. Accepts the wire label ({@code BFS}, {@code DFS},
     * {@code A*}) or the constant name ({@code ASTAR}); {@code A_STAR} and {@code ASTAR} both map
     * to A*.
     *
     * @throws IllegalArgumentException if the label names no known algorithm
     */
    public static SearchAlgorithm fromLabel(String label) {
        if (label == null || label.isBlank()) {
            throw new IllegalArgumentException("Unknown algorithm: " + label);
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace("_", "").replace("-", "");
        for (SearchAlgorithm algorithm : values()) {
            if (algorithm.label.equals(normalized) || algorithm.name().equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unknown algorithm: " + label);
    }
}
