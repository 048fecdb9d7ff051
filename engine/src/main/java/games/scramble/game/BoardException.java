package games.scramble.game;

import java.util.Objects;

/**
 * Signals that a board operation could not be carried out for the calling actor.
 *
 * <p>The {@link BoardError} tells callers which rule refused the operation; the message is meant
 * for humans and logs.
 */
public class BoardException extends RuntimeException {
    private final BoardError error;

    public BoardException(BoardError error) {
        this(error, error.getDefaultMessage());
    }

    public BoardException(BoardError error, String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error");
    }

    public BoardException(BoardError error, String message, Throwable cause) {
        super(message, cause);
        this.error = Objects.requireNonNull(error, "error");
    }

    /**
     * Returns the rule that refused the operation.
     */
    public BoardError getError() {
        return error;
    }
}
