package games.scramble.player;

import games.scramble.game.Board;
import games.scramble.game.BoardException;
import games.scramble.game.Location;
import java.util.Objects;
import java.util.Random;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A player that flips random pairs of cards on a shared board.
 * <p>
 * Each attempt pauses for a random delay, flips a random first card (which may block while
 * another player holds it), pauses again and flips a random second card. An attempt refused by
 * a board rule counts as a failed move and play continues; interruption ends the run early and
 * marks the player as abandoned.
 * <p>
 * A matched pair stays under its holder's control until the holder flips again, so a player that
 * ends its run holding a pair would block everyone waiting on it. After its last attempt the
 * player therefore flips one of its matched cards once more, which removes the pair.
 */
public class SimulatedPlayer implements Callable<PlayerStats> {
    private static final Logger log = LoggerFactory.getLogger(SimulatedPlayer.class);

    private final String id;
    private final Board board;
    private final int tries;
    private final double minDelayMillis;
    private final double maxDelayMillis;
    private final Random random;

    public SimulatedPlayer(String id, Board board, int tries, double minDelayMillis, double maxDelayMillis, Random random) {
        if (tries < 0) {
            throw new IllegalArgumentException("tries must be non-negative: " + tries);
        }
        if (minDelayMillis < 0 || maxDelayMillis < minDelayMillis) {
            throw new IllegalArgumentException("Invalid delay range " + minDelayMillis + ".." + maxDelayMillis);
        }
        this.id = Objects.requireNonNull(id, "id");
        this.board = Objects.requireNonNull(board, "board");
        this.tries = tries;
        this.minDelayMillis = minDelayMillis;
        this.maxDelayMillis = maxDelayMillis;
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Returns the id this player flips under.
     */
    public String getId() {
        return id;
    }

    @Override
    public PlayerStats call() {
        board.look(id);
        long startNanos = System.nanoTime();
        int totalMoves = 0;
        int successfulMoves = 0;
        int failedMoves = 0;
        boolean abandoned = false;
        Location lastSecond = null;

        for (int i = 0; i < tries; i++) {
            totalMoves++;
            try {
                pause();
                board.flip(id, randomLocation());
                pause();
                Location second = randomLocation();
                board.flip(id, second);
                lastSecond = second;
                successfulMoves++;
            } catch (BoardException e) {
                failedMoves++;
                if (log.isDebugEnabled()) {
                    log.debug("{} move {} failed: {} ({})", id, i, e.getError(), e.getMessage());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                abandoned = true;
                // the interrupted attempt neither succeeded nor was refused
                totalMoves--;
                log.info("{} interrupted after {} move(s)", id, totalMoves);
                break;
            }
        }

        if (!abandoned && lastSecond != null) {
            abandoned = !releaseMatchedPair(lastSecond);
        }

        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
        return new PlayerStats(id, totalMoves, successfulMoves, failedMoves, elapsedMillis, abandoned);
    }

    /**
     * Removes the pair this player still holds, if any, by flipping one of its cards.
     *
     * @return {@code false} if interrupted
     */
    private boolean releaseMatchedPair(Location heldLocation) {
        if (!board.controllerOf(heldLocation).map(id::equals).orElse(false)) {
            return true;
        }
        try {
            board.flip(id, heldLocation);
        } catch (BoardException e) {
            // expected: the pair is removed and the location is now empty
            if (log.isDebugEnabled()) {
                log.debug("{} released its matched pair at {}: {}", id, heldLocation, e.getError());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return true;
    }

    private Location randomLocation() {
        return Location.of(random.nextInt(board.getRows()), random.nextInt(board.getCols()));
    }

    private void pause() throws InterruptedException {
        double millis = minDelayMillis + random.nextDouble() * (maxDelayMillis - minDelayMillis);
        long micros = Math.round(millis * 1000);
        if (micros > 0) {
            TimeUnit.MICROSECONDS.sleep(micros);
        }
    }
}
