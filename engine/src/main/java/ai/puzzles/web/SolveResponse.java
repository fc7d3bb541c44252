package ai.puzzles.web;

import ai.puzzles.game.Board;
import ai.puzzles.solver.SearchAlgorithm;
import ai.puzzles.solver.SearchResult;
import ai.puzzles.solver.SolveReport;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.ArrayList;
import java.util.List;

/**
 * JSON body returned by {@code POST /solve}.
 *
 * <p>Only fields that apply to the outcome are serialised: a solved board carries the path and
 * metrics, an exhausted search carries metrics and a message, an unsolvable board carries the
 * inversion count, and a rejected request carries only the error. DFS reports its frontier
 * high-water mark as {@code max_stack_size}; BFS and A* use {@code max_queue_size}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class SolveResponse {

    private boolean success;
    private String algorithm;
    private String status;

    @JsonProperty("solution_path")
    private List<List<List<Integer>>> solutionPath;

    @JsonProperty("solution_depth")
    private Integer solutionDepth;

    @JsonProperty("nodes_expanded")
    private Long nodesExpanded;

    /** Seconds, rounded to 4 decimal places. */
    @JsonProperty("time_taken")
    private Double timeTaken;

    @JsonProperty("max_queue_size")
    private Integer maxQueueSize;

    @JsonProperty("max_stack_size")
    private Integer maxStackSize;

    @JsonProperty("depth_limit")
    private Integer depthLimit;

    private Integer inversions;
    private Integer size;
    private String message;
    private String error;

    /**
     * Default constructor for JSON binding.
     */
    public SolveResponse() {
    }

    /**
     * Maps a solve report onto the wire shape.
     */
    public static SolveResponse from(SolveReport report) {
        SolveResponse response = new SolveResponse();
        response.success = report.isSuccess();
        response.algorithm = report.getAlgorithmLabel();
        response.status = report.getStatus().name();
        response.size = report.getSize();

        switch (report.getStatus()) {
            case SOLVED:
                response.applyMetrics(report.getSearchResult());
                response.solutionPath = toWire(report.getSearchResult().getSolutionPath());
                response.solutionDepth = report.getSearchResult().getSolutionDepth();
                break;
            case EXHAUSTED:
                response.applyMetrics(report.getSearchResult());
                response.message = report.getMessage();
                break;
            case UNSOLVABLE:
                response.inversions = report.getSolvability().getInversions();
                response.error = report.getMessage();
                break;
            default:
                response.error = report.getMessage();
                break;
        }
        return response;
    }

    /**
     * Builds a bare error response for failures that happen before the service is reached.
     */
    public static SolveResponse error(String error) {
        SolveResponse response = new SolveResponse();
        response.success = false;
        response.error = error;
        return response;
    }

    private void applyMetrics(SearchResult result) {
        nodesExpanded = result.getNodesExpanded();
        timeTaken = Math.round(result.getElapsedSeconds() * 10_000.0) / 10_000.0;
        depthLimit = result.getDepthLimit();
        if (result.getAlgorithm() == SearchAlgorithm.DFS) {
            maxStackSize = result.getMaxFrontierSize();
        } else {
            maxQueueSize = result.getMaxFrontierSize();
        }
    }

    private static List<List<List<Integer>>> toWire(List<Board> path) {
        List<List<List<Integer>>> boards = new ArrayList<>(path.size());
        for (Board board : path) {
            boards.add(board.toRows());
        }
        return boards;
    }

    public boolean isSuccess() {
        return success;
    }

    public void setSuccess(boolean success) {
        this.success = success;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }

    public String getStatus() {
        return status;
    }

    public void setStatus(String status) {
        this.status = status;
    }

    public List<List<List<Integer>>> getSolutionPath() {
        return solutionPath;
    }

    public void setSolutionPath(List<List<List<Integer>>> solutionPath) {
        this.solutionPath = solutionPath;
    }

    public Integer getSolutionDepth() {
        return solutionDepth;
    }

    public void setSolutionDepth(Integer solutionDepth) {
        this.solutionDepth = solutionDepth;
    }

    public Long getNodesExpanded() {
        return nodesExpanded;
    }

    public void setNodesExpanded(Long nodesExpanded) {
        this.nodesExpanded = nodesExpanded;
    }

    public Double getTimeTaken() {
        return timeTaken;
    }

    public void setTimeTaken(Double timeTaken) {
        this.timeTaken = timeTaken;
    }

    public Integer getMaxQueueSize() {
        return maxQueueSize;
    }

    public void setMaxQueueSize(Integer maxQueueSize) {
        this.maxQueueSize = maxQueueSize;
    }

    public Integer getMaxStackSize() {
        return maxStackSize;
    }

    public void setMaxStackSize(Integer maxStackSize) {
        this.maxStackSize = maxStackSize;
    }

    public Integer getDepthLimit() {
        return depthLimit;
    }

    public void setDepthLimit(Integer depthLimit) {
        this.depthLimit = depthLimit;
    }

    public Integer getInversions() {
        return inversions;
    }

    public void setInversions(Integer inversions) {
        this.inversions = inversions;
    }

    public Integer getSize() {
        return size;
    }

    public void setSize(Integer size) {
        this.size = size;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getError() {
        return error;
    }

    public void setError(String error) {
        this.error = error;
    }
}
