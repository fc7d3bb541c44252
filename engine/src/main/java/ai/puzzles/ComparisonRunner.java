package ai.puzzles;

import ai.puzzles.game.Board;
import ai.puzzles.game.BoardFormatter;
import ai.puzzles.solver.SearchAlgorithm;
import ai.puzzles.solver.SearchResult;
import ai.puzzles.solver.SolveReport;
import ai.puzzles.solver.SolverService;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Command-line comparison of the three search strategies on a single board.
 *
 * <p>The board is the first non-option argument as a comma-separated row-major list
 * (e.g. {@code 1,2,3,4,0,6,7,5,8}), or that example board when none is given. Results are logged
 * as a table of depth, expansions, seconds and optimality.
 *
 * Usage:
 * {@code java -jar sliding-puzzle-engine.jar --spring.profiles.active=compare 8,1,3,4,0,2,7,6,5}
 */
@Component
@Profile("compare")
public class ComparisonRunner implements CommandLineRunner {

    private static final Logger log = LoggerFactory.getLogger(ComparisonRunner.class);

    static final String DEFAULT_BOARD = "1,2,3,4,0,6,7,5,8";

    private final SolverService solverService;

    public ComparisonRunner(SolverService solverService) {
        this.solverService = solverService;
    }

    @Override
    public void run(String... args) {
        Board start = Board.parse(firstBoardArgument(args));
        log.info("Comparing search algorithms on:\n{}", new BoardFormatter(start).format());
        List<SolveReport> reports = compare(start);
        log.info("\n{}", formatTable(reports));
    }

    /**
     * Solves {@code start} with every algorithm in declaration order.
     */
    List<SolveReport> compare(Board start) {
        List<SolveReport> reports = new ArrayList<>();
        for (SearchAlgorithm algorithm : SearchAlgorithm.values()) {
            SolveReport report = solverService.solve(start, algorithm);
            if (!report.isSuccess()) {
                log.info("{}: no solution ({})", algorithm.getLabel(), report.getMessage());
            }
            reports.add(report);
        }
        return reports;
    }

    static String formatTable(List<SolveReport> reports) {
        StringBuilder sb = new StringBuilder();
        sb.append("=".repeat(60)).append('\n');
        sb.append("COMPARISON TABLE\n");
        sb.append("=".repeat(60)).append('\n');
        sb.append(String.format("%-12s %-8s %-15s %-12s %-10s%n", "Algorithm", "Depth", "Nodes", "Time (s)", "Optimal"));
        sb.append("-".repeat(60)).append('\n');
        for (SolveReport report : reports) {
            SearchResult result = report.getSearchResult();
            if (result == null || !result.isSuccess()) {
                sb.append(String.format("%-12s %s%n", report.getAlgorithmLabel(), report.getStatus()));
                continue;
            }
            sb.append(String.format("%-12s %-8d %-15s %-12.4f %-10s%n",
                    result.getAlgorithm().getLabel(),
                    result.getSolutionDepth(),
                    String.format("%,d", result.getNodesExpanded()),
                    result.getElapsedSeconds(),
                    result.getAlgorithm().isOptimal() ? "Yes" : "No"));
        }
        return sb.toString();
    }

    private static String firstBoardArgument(String... args) {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return arg;
            }
        }
        return DEFAULT_BOARD;
    }
}
