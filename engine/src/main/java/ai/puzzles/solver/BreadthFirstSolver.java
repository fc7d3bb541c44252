package ai.puzzles.solver;

import ai.puzzles.game.Board;
import java.util.ArrayDeque;
import java.util.HashSet;
import java.util.Queue;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Breadth-first search over blank slides.
 *
 * <p>The frontier is a FIFO queue and every slide costs 1, so nodes leave the queue in
 * non-decreasing path cost and the first goal dequeued is a shortest solution. A board is marked
 * visited when it is enqueued, so each reachable board enters the queue at most once.
 *
 * <p>{@code maxFrontierSize} is sampled after the start node is seeded and after each batch of
 * successors is enqueued.
 */
public class BreadthFirstSolver implements Solver {

    private static final Logger log = LoggerFactory.getLogger(BreadthFirstSolver.class);

    @Override
    public SearchAlgorithm algorithm() {
        return SearchAlgorithm.BFS;
    }

    @Override
    public SearchResult solve(Board start, Board goal) {
        SolverPreconditions.requireSameSize(start, goal);
        SearchStats stats = new SearchStats();
        Queue<SearchNode> frontier = new ArrayDeque<>();
        Set<Long> visited = new HashSet<>();

        frontier.add(SearchNode.root(start));
        visited.add(start.getStateKey());
        stats.observeFrontier(frontier.size());

        while (!frontier.isEmpty()) {
            SearchNode current = frontier.poll();
            stats.recordExpansion();

            if (current.getBoard().equals(goal)) {
                SearchResult result = SearchResult.found(algorithm(), current, stats, null);
                log.debug("BFS found depth {} after {} expansions (max queue {})",
                        result.getSolutionDepth(), result.getNodesExpanded(), result.getMaxFrontierSize());
                return result;
            }

            for (Successor successor : SuccessorGenerator.successors(current.getBoard())) {
                if (visited.add(successor.getBoard().getStateKey())) {
                    frontier.add(current.child(successor, 0, 0L));
                }
            }
            stats.observeFrontier(frontier.size());
        }

        log.debug("BFS exhausted {} reachable boards from {} without reaching the goal",
                stats.getNodesExpanded(), start);
        return SearchResult.exhausted(algorithm(), stats, null,
                "No solution found: all " + stats.getNodesExpanded() + " reachable boards explored");
    }
}
