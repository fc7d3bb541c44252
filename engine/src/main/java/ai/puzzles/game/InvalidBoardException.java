package ai.puzzles.game;

/**
 * Thrown when a board is rejected at the boundary, before any search engine sees it.
 *
 * <p>The {@link Kind} lets callers distinguish a structurally broken board from a well-formed
 * board of a dimension the solver does not support.
 */
public class InvalidBoardException extends IllegalArgumentException {

    /** Category of rejection. */
    public enum Kind {
        /** Wrong cell count, ragged rows, duplicate or missing labels, out-of-range values. */
        MALFORMED_BOARD,
        /** Any grid dimension other than 2 or 3. */
        UNSUPPORTED_SIZE
    }

    private final Kind kind;

    public InvalidBoardException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
