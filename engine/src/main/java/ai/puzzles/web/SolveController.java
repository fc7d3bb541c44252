package ai.puzzles.web;

import ai.puzzles.config.SolverProperties;
import ai.puzzles.game.Board;
import ai.puzzles.game.BoardShuffler;
import ai.puzzles.solver.SolveReport;
import ai.puzzles.solver.SolverService;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP surface of the solver.
 *
 * <ul>
 *     <li>{@code POST /solve} validates, checks parity and searches; rejected input answers 400,
 *     every other outcome (including unsolvable and exhausted) answers 200 with {@code success}.</li>
 *     <li>{@code GET /health} reports liveness and the supported board sizes.</li>
 *     <li>{@code GET /shuffle} returns a random solvable board.</li>
 *     <li>{@code GET /goal} returns the goal board for a size.</li>
 * </ul>
 */
@RestController
public class SolveController {

    private static final Logger log = LoggerFactory.getLogger(SolveController.class);

    private final SolverService solverService;
    private final SolverProperties properties;

    public SolveController(SolverService solverService, SolverProperties properties) {
        this.solverService = solverService;
        this.properties = properties;
    }

    @PostMapping("/solve")
    public ResponseEntity<SolveResponse> solve(@RequestBody SolveRequest request) {
        log.debug("Received solve request: algorithm={} board={}", request.getAlgorithm(), request.getBoard());
        SolveReport report = solverService.solve(request.getBoard(), request.getAlgorithm());
        SolveResponse body = SolveResponse.from(report);
        if (report.getStatus().isRejected()) {
            return ResponseEntity.badRequest().body(body);
        }
        return ResponseEntity.ok(body);
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("supported_sizes", Arrays.asList("2x2", "3x3"));
        return body;
    }

    @GetMapping("/shuffle")
    public BoardResponse shuffle(
            @RequestParam(defaultValue = "3") int size,
            @RequestParam(required = false) Integer moves,
            @RequestParam(required = false) Long seed) {
        int length = moves != null ? moves : properties.getShuffleMoves();
        BoardShuffler shuffler = seed != null ? new BoardShuffler(new Random(seed)) : new BoardShuffler();
        Board board = shuffler.shuffle(size, length);
        log.debug("Shuffled {}x{} board with {} moves: {}", size, size, length, board);
        return new BoardResponse(board);
    }

    @GetMapping("/goal")
    public BoardResponse goal(@RequestParam(defaultValue = "3") int size) {
        return new BoardResponse(Board.goal(size));
    }
}
