package ai.puzzles.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the solver.
 *
 * Usage:
 * {@code java -jar sliding-puzzle-engine.jar --solver.depth-limit=30 --solver.default-algorithm=A*}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "solver")
public class SolverProperties {
  private int depthLimit = 50;
  private int shuffleMoves = 50;
  private String defaultAlgorithm = "BFS";

  /**
   * Returns the depth limit applied by depth-limited DFS.
   * @return maximum number of moves DFS explores along any branch
   */
  public int getDepthLimit() {
    return depthLimit;
  }

  /**
   * Sets the DFS depth limit.
   * @param depthLimit maximum number of moves, must be non-negative
   */
  public void setDepthLimit(int depthLimit) {
    this.depthLimit = depthLimit;
  }

  /**
   * Returns the number of random slides used when shuffling a board.
   * @return shuffle length
   */
  public int getShuffleMoves() {
    return shuffleMoves;
  }

  public void setShuffleMoves(int shuffleMoves) {
    this.shuffleMoves = shuffleMoves;
  }

  /**
   * Returns the algorithm label used when a request does not name one.
   * @return an algorithm label such as {@code BFS}
   */
  public String getDefaultAlgorithm() {
    return defaultAlgorithm;
  }

  public void setDefaultAlgorithm(String defaultAlgorithm) {
    this.defaultAlgorithm = defaultAlgorithm;
  }
}
