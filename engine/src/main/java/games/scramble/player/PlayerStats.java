package games.scramble.player;

/**
 * Outcome of one simulated player's run.
 *
 * @param playerId the player's id on the board
 * @param totalMoves two-card attempts started
 * @param successfulMoves attempts where both flips went through
 * @param failedMoves attempts refused by a board rule
 * @param elapsedMillis wall-clock time spent playing
 * @param abandoned whether the player was interrupted before finishing its attempts
 */
public record PlayerStats(
        String playerId,
        int totalMoves,
        int successfulMoves,
        int failedMoves,
        long elapsedMillis,
        boolean abandoned) {

    /**
     * Percentage of attempts that succeeded, or 0 when nothing was attempted.
     */
    public double successRate() {
        return totalMoves == 0 ? 0.0 : 100.0 * successfulMoves / totalMoves;
    }

    public double failureRate() {
        return totalMoves == 0 ? 0.0 : 100.0 * failedMoves / totalMoves;
    }
}
