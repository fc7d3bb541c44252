package ai.puzzles.solver;

import ai.puzzles.game.Board;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Depth-limited depth-first search.
 *
 * <p>The frontier is a LIFO stack. Nodes whose path cost equals the depth limit are goal-tested but
 * never expanded. A single visited set shared by all branches prevents cycles and re-expansion, at
 * the price of completeness: a board first reached on a deep branch is not revisited from a
 * shallower one, so this solver may miss solutions that exist within the limit and does not return
 * the shortest one in general.
 *
 * <p>Successors are pushed in reverse canonical order so that UP is popped first.
 */
public class DepthLimitedSolver implements Solver {

    /** Depth limit used when none is configured. */
    public static final int DEFAULT_DEPTH_LIMIT = 50;

    private static final Logger log = LoggerFactory.getLogger(DepthLimitedSolver.class);

    private final int depthLimit;

    public DepthLimitedSolver() {
        this(DEFAULT_DEPTH_LIMIT);
    }

    /**
     * @param depthLimit maximum path cost explored; must be non-negative
     */
    public DepthLimitedSolver(int depthLimit) {
        if (depthLimit < 0) {
            throw new IllegalArgumentException("Depth limit must be >= 0, got " + depthLimit);
        }
        this.depthLimit = depthLimit;
    }

    public int getDepthLimit() {
        return depthLimit;
    }

    @Override
    public SearchAlgorithm algorithm() {
        return SearchAlgorithm.DFS;
    }

    @Override
    public SearchResult solve(Board start, Board goal) {
        SolverPreconditions.requireSameSize(start, goal);
        SearchStats stats = new SearchStats();
        Deque<SearchNode> stack = new ArrayDeque<>();
        Set<Long> visited = new HashSet<>();

        stack.push(SearchNode.root(start));
        visited.add(start.getStateKey());
        stats.observeFrontier(stack.size());

        while (!stack.isEmpty()) {
            SearchNode current = stack.pop();
            stats.recordExpansion();

            if (current.getBoard().equals(goal)) {
                SearchResult result = SearchResult.found(algorithm(), current, stats, depthLimit);
                log.debug("DFS found depth {} after {} expansions (limit {}, max stack {})",
                        result.getSolutionDepth(), result.getNodesExpanded(), depthLimit,
                        result.getMaxFrontierSize());
                return result;
            }

            if (current.getPathCost() >= depthLimit) {
                continue;
            }

            List<Successor> successors = SuccessorGenerator.successors(current.getBoard());
            for (int i = successors.size() - 1; i >= 0; i--) {
                Successor successor = successors.get(i);
                if (visited.add(successor.getBoard().getStateKey())) {
                    stack.push(current.child(successor, 0, 0L));
                }
            }
            stats.observeFrontier(stack.size());
        }

        log.debug("DFS exhausted after {} expansions within depth limit {}", stats.getNodesExpanded(), depthLimit);
        return SearchResult.exhausted(algorithm(), stats, depthLimit,
                "No solution found within depth limit of " + depthLimit);
    }
}
