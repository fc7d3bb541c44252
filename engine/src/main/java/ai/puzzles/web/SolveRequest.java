package ai.puzzles.web;

import java.util.List;

/**
 * JSON body accepted by {@code POST /solve}.
 *
 * <pre>{ "board": [[1,2,3],[4,0,6],[7,5,8]], "algorithm": "A*" }</pre>
 */
public class SolveRequest {

    /** Board rows; validated by the service, not here. */
    private List<List<Integer>> board;

    /** Algorithm label ({@code BFS}, {@code DFS} or {@code A*}); optional. */
    private String algorithm;

    /**
     * Default constructor for JSON binding.
     */
    public SolveRequest() {
    }

    public SolveRequest(List<List<Integer>> board, String algorithm) {
        this.board = board;
        this.algorithm = algorithm;
    }

    public List<List<Integer>> getBoard() {
        return board;
    }

    public void setBoard(List<List<Integer>> board) {
        this.board = board;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }
}
