package ai.puzzles.solver;

import ai.puzzles.game.Board;
import java.util.HashMap;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Queue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A* search guided by the Manhattan-distance heuristic.
 *
 * <p>Cost model:
 * <ul>
 *     <li>g(n): number of slides from the start board.</li>
 *     <li>h(n): sum of tile displacements to the goal, blank excluded. Admissible and consistent,
 *     so the first time the goal is popped its g is the true shortest distance.</li>
 *     <li>f(n) = g(n) + h(n). The open list is ordered by ascending f, ties broken by insertion
 *     order so runs are deterministic.</li>
 * </ul>
 *
 * <p>{@code bestCost} maps each board key to the cheapest g seen so far. A successor is pushed only
 * when it improves that cost; older, costlier entries for the same board stay in the queue and are
 * discarded when popped (lazy deletion). Discarded entries do not count as expansions.
 */
public class AStarSolver implements Solver {

    private static final Logger log = LoggerFactory.getLogger(AStarSolver.class);

    @Override
    public SearchAlgorithm algorithm() {
        return SearchAlgorithm.ASTAR;
    }

    @Override
    public SearchResult solve(Board start, Board goal) {
        SolverPreconditions.requireSameSize(start, goal);
        SearchStats stats = new SearchStats();
        Queue<SearchNode> open = new PriorityQueue<>();
        Map<Long, Integer> bestCost = new HashMap<>();
        long sequence = 0L;

        open.add(SearchNode.root(start, start.manhattanDistance(goal)));
        bestCost.put(start.getStateKey(), 0);
        stats.observeFrontier(open.size());

        while (!open.isEmpty()) {
            SearchNode current = open.poll();
            Integer recorded = bestCost.get(current.getBoard().getStateKey());
            if (recorded != null && current.getPathCost() > recorded) {
                continue;
            }
            stats.recordExpansion();

            if (current.getBoard().equals(goal)) {
                SearchResult result = SearchResult.found(algorithm(), current, stats, null);
                log.debug("A* found depth {} after {} expansions (max open {})",
                        result.getSolutionDepth(), result.getNodesExpanded(), result.getMaxFrontierSize());
                return result;
            }

            int tentativePathCost = current.getPathCost() + 1;
            for (Successor successor : SuccessorGenerator.successors(current.getBoard())) {
                long key = successor.getBoard().getStateKey();
                int knownPathCost = bestCost.getOrDefault(key, Integer.MAX_VALUE);
                if (tentativePathCost >= knownPathCost) {
                    continue;
                }
                bestCost.put(key, tentativePathCost);
                int h = successor.getBoard().manhattanDistance(goal);
                open.add(current.child(successor, h, ++sequence));
            }
            stats.observeFrontier(open.size());
        }

        log.debug("A* exhausted {} boards from {} without reaching the goal", stats.getNodesExpanded(), start);
        return SearchResult.exhausted(algorithm(), stats, null,
                "No solution found: all " + stats.getNodesExpanded() + " reachable boards explored");
    }
}
