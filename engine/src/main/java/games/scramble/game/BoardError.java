package games.scramble.game;

/**
 * Expected, recoverable outcomes of contention on the board.
 *
 * <p>None of these indicate a corrupted board: every one is reported to the calling actor for
 * that single call, and the board stays consistent afterwards.
 */
public enum BoardError {
    /** Actor id is empty or contains characters outside {@code [A-Za-z0-9_]}. */
    INVALID_IDENTIFIER("Player id must be a nonempty string of alphanumeric or underscore characters"),
    /** The location holds no card (never had one, or it was removed by a match). */
    EMPTY_LOCATION("Nothing here!"),
    /** Second card is already controlled by some player. */
    LOCATION_UNDER_CONTROL("This card is already under control"),
    /** The actor waited for a card that was then removed from the board. */
    LOCATION_UNAVAILABLE("Card no longer available"),
    ALREADY_CONTROLLED("Player already controls this card"),
    CONTROL_LIMIT_EXCEEDED("Player cannot control any more cards"),
    NOT_CONTROLLING("Player is not controlling this card"),
    ALREADY_WAITING("Player already in queue for this card"),
    NOT_SEEN("Card was not previously seen by this player");

    private final String defaultMessage;

    BoardError(String defaultMessage) {
        this.defaultMessage = defaultMessage;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }
}
