package ai.puzzles.web;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps request-level failures to {@code 400 {"success": false, "error": ...}}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<SolveResponse> unreadableBody(HttpMessageNotReadableException e) {
        log.warn("Unreadable request body: {}", e.getMostSpecificCause().toString());
        return ResponseEntity.badRequest()
                .body(SolveResponse.error("Error processing request: " + e.getMostSpecificCause().getMessage()));
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<SolveResponse> badParameter(MethodArgumentTypeMismatchException e) {
        log.warn("Invalid request parameter {}: {}", e.getName(), e.getValue());
        return ResponseEntity.badRequest()
                .body(SolveResponse.error("Invalid value for parameter '" + e.getName() + "': " + e.getValue()));
    }

    /**
     * Covers {@link ai.puzzles.game.InvalidBoardException} from the shuffle and goal endpoints
     * as well as other argument checks.
     */
    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<SolveResponse> illegalArgument(IllegalArgumentException e) {
        log.warn("Rejected request: {}", e.getMessage());
        return ResponseEntity.badRequest().body(SolveResponse.error(e.getMessage()));
    }
}
