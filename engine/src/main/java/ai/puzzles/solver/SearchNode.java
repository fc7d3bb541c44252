package ai.puzzles.solver;

import ai.puzzles.game.Board;
import ai.puzzles.game.Move;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node in a search tree: a board plus the bookkeeping needed to rebuild the path to it.
 *
 * <p>Each node stores:
 * <ul>
 *   <li><b>board</b>: the position this node represents</li>
 *   <li><b>parent</b>: the node it was generated from (null at the root); followed only when
 *   reconstructing the solution path, never for cycle detection</li>
 *   <li><b>move</b>: the blank slide that produced this node from its parent</li>
 *   <li><b>pathCost</b>: number of moves from the start board</li>
 *   <li><b>heuristic</b>: Manhattan distance to the goal, filled in by A* only</li>
 *   <li><b>sequence</b>: insertion counter, used to order equal-f nodes first-in first-out</li>
 * </ul>
 *
 * <p>Nodes are never mutated after creation. A parent always exists before its children, so the
 * back-link cannot form a cycle.
 */
public final class SearchNode implements Comparable<SearchNode> {
    private final Board board;
    private final SearchNode parent;
    private final Move move;
    private final int pathCost;
    private final int heuristic;
    private final long sequence;

    private SearchNode(Board board, SearchNode parent, Move move, int pathCost, int heuristic, long sequence) {
        this.board = board;
        this.parent = parent;
        this.move = move;
        this.pathCost = pathCost;
        this.heuristic = heuristic;
        this.sequence = sequence;
    }

    /**
     * Creates the root node for a search with no heuristic estimate.
     */
    public static SearchNode root(Board board) {
        return new SearchNode(board, null, null, 0, 0, 0L);
    }

    /**
     * Creates the root node for a search with the given heuristic estimate.
     */
    public static SearchNode root(Board board, int heuristic) {
        return new SearchNode(board, null, null, 0, heuristic, 0L);
    }

    /**
     * Creates a child one move deeper than this node.
     *
     * @param successor the move and resulting board
     * @param heuristic estimate for the child board (0 when unused)
     * @param sequence insertion counter for tie-breaking
     */
    public SearchNode child(Successor successor, int heuristic, long sequence) {
        return new SearchNode(successor.getBoard(), this, successor.getMove(), pathCost + 1, heuristic, sequence);
    }

    public Board getBoard() {
        return board;
    }

    public SearchNode getParent() {
        return parent;
    }

    public Move getMove() {
        return move;
    }

    public int getPathCost() {
        return pathCost;
    }

    public int getHeuristic() {
        return heuristic;
    }

    /**
     * Total estimated cost f = g + h.
     */
    public int getEstimatedTotalCost() {
        return pathCost + heuristic;
    }

    public long getSequence() {
        return sequence;
    }

    /**
     * Walks the parent links back to the root and returns the boards from start to this node,
     * both ends inclusive.
     */
    public List<Board> pathFromRoot() {
        List<Board> path = new ArrayList<>(pathCost + 1);
        SearchNode current = this;
        while (current != null) {
            path.add(current.board);
            current = current.parent;
        }
        Collections.reverse(path);
        return path;
    }

    /**
     * Returns the moves from the root to this node in order.
     */
    public List<Move> movesFromRoot() {
        List<Move> moves = new ArrayList<>(pathCost);
        SearchNode current = this;
        while (current != null && current.move != null) {
            moves.add(current.move);
            current = current.parent;
        }
        Collections.reverse(moves);
        return moves;
    }

    /**
     * Orders by ascending f, then by insertion order.
     */
    @Override
    public int compareTo(SearchNode other) {
        int byCost = Integer.compare(getEstimatedTotalCost(), other.getEstimatedTotalCost());
        if (byCost != 0) {
            return byCost;
        }
        return Long.compare(sequence, other.sequence);
    }

    @Override
    public String toString() {
        return "SearchNode{board=" + board + ", g=" + pathCost + ", h=" + heuristic + ", move=" + move + "}";
    }
}
