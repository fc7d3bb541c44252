package ai.puzzles.solver;

import ai.puzzles.config.SolverProperties;
import ai.puzzles.game.Board;
import ai.puzzles.game.BoardFormatter;
import ai.puzzles.game.InvalidBoardException;
import ai.puzzles.game.Solvability;
import ai.puzzles.game.SolvabilityChecker;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point for solving a board: validates input, checks parity and dispatches to the chosen
 * {@link Solver}.
 *
 * <p>The solvers held here keep no state between calls, so one service instance can serve
 * concurrent requests; each search builds its own frontier and visited set.
 */
@Service
public class SolverService {

    private static final Logger log = LoggerFactory.getLogger(SolverService.class);

    private final SolverProperties properties;
    private final Map<SearchAlgorithm, Solver> solvers = new EnumMap<>(SearchAlgorithm.class);

    public SolverService(SolverProperties properties) {
        this.properties = properties;
        register(new BreadthFirstSolver());
        register(new DepthLimitedSolver(properties.getDepthLimit()));
        register(new AStarSolver());
    }

    private void register(Solver solver) {
        solvers.put(solver.algorithm(), solver);
    }

    /**
     * Returns the solver configured for an algorithm.
     */
    public Solver solverFor(SearchAlgorithm algorithm) {
        return solvers.get(algorithm);
    }

    /**
     * Runs the chosen search directly, skipping the parity check. An unsolvable board is
     * reported as {@link SearchOutcome#EXHAUSTED} once the reachable space is used up.
     *
     * @param start validated start board
     * @param algorithm strategy to run
     * @return search outcome and metrics
     */
    public SearchResult search(Board start, SearchAlgorithm algorithm) {
        SearchResult result = solverFor(algorithm).solve(start);
        SearchLogger.logSearch(start, result);
        return result;
    }

    /**
     * Checks parity, then searches if the board can be solved.
     *
     * @param start validated start board
     * @param algorithm strategy to run
     * @return report with the verdict and, when a search ran, its result
     */
    public SolveReport solve(Board start, SearchAlgorithm algorithm) {
        Solvability solvability = SolvabilityChecker.check(start);
        if (!solvability.isSolvable()) {
            log.info("Rejected unsolvable {}x{} board [{}] with {} inversion(s)",
                    start.getSize(), start.getSize(), new BoardFormatter(start).formatInline(),
                    solvability.getInversions());
            return SolveReport.unsolvable(algorithm.getLabel(), solvability);
        }

        SearchResult result = search(start, algorithm);
        log.info("{} on {}x{} board [{}]: {} depth={} expanded={} maxFrontier={} in {} ms",
                algorithm.getLabel(), start.getSize(), start.getSize(),
                new BoardFormatter(start).formatInline(),
                result.getOutcome(), result.getSolutionDepth(), result.getNodesExpanded(),
                result.getMaxFrontierSize(), result.getElapsedNanos() / 1_000_000L);
        return SolveReport.searched(solvability, result);
    }

    /**
     * Full boundary pipeline for raw input such as a decoded JSON body. Never throws for bad
     * input; every failure is described by the returned report.
     *
     * @param rows board rows; may be null or malformed
     * @param algorithmLabel algorithm label; null or blank selects the configured default
     * @return report describing the outcome
     */
    public SolveReport solve(List<List<Integer>> rows, String algorithmLabel) {
        String label = algorithmLabel == null || algorithmLabel.isBlank()
                ? properties.getDefaultAlgorithm()
                : algorithmLabel;
        Integer size = rows == null ? null : rows.size();

        Board start;
        try {
            start = Board.of(rows);
        } catch (InvalidBoardException e) {
            log.info("Rejected board ({}): {}", e.getKind(), e.getMessage());
            SolveReport.Status status = e.getKind() == InvalidBoardException.Kind.UNSUPPORTED_SIZE
                    ? SolveReport.Status.UNSUPPORTED_SIZE
                    : SolveReport.Status.MALFORMED_BOARD;
            return SolveReport.rejected(status, label, size, e.getMessage());
        }

        SearchAlgorithm algorithm;
        try {
            algorithm = SearchAlgorithm.fromLabel(label);
        } catch (IllegalArgumentException e) {
            log.info("Rejected request: {}", e.getMessage());
            return SolveReport.rejected(SolveReport.Status.UNKNOWN_ALGORITHM, label, start.getSize(), e.getMessage());
        }

        return solve(start, algorithm);
    }
}
