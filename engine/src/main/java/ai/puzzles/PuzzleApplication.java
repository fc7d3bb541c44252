package ai.puzzles;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Sliding puzzle solver service.
 *
 * <p>Starts the HTTP API by default. With {@code --spring.profiles.active=compare} the web server
 * is disabled and {@link ComparisonRunner} solves one board with every algorithm instead.
 */
@SpringBootApplication
public class PuzzleApplication {

    public static void main(String[] args) {
        SpringApplication.run(PuzzleApplication.class, args);
    }
}
