package games.scramble.helpers;

import games.scramble.game.Board;
import games.scramble.game.Location;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

/**
 * Shared helpers for board tests: rendering lookups and running flips on their own threads.
 */
public final class BoardTestHelper {
    /** Upper bound for anything a test waits on, so a broken board fails instead of hanging. */
    public static final long TIMEOUT_SECONDS = 5;

    private BoardTestHelper() {
    }

    /**
     * Returns the rendering line for a location as seen by {@code actorId}.
     */
    public static String cell(Board board, String actorId, Location location) {
        String[] lines = board.look(actorId).split("\n");
        return lines[1 + location.row() * board.getCols() + location.col()];
    }

    /**
     * Counts locations rendered as {@code my ...} for {@code actorId}.
     */
    public static long controlledCount(Board board, String actorId) {
        return board.look(actorId).lines().filter(line -> line.startsWith("my ")).count();
    }

    /**
     * Runs a flip on a new daemon thread. The future fails with whatever the flip threw.
     */
    public static CompletableFuture<Void> flipAsync(Board board, String actorId, Location location) {
        CompletableFuture<Void> result = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                board.flip(actorId, location);
                result.complete(null);
            } catch (Throwable e) {
                result.completeExceptionally(e);
            }
        }, "flip-" + actorId + "-" + location);
        thread.setDaemon(true);
        thread.start();
        return result;
    }

    /**
     * Polls until the condition holds, failing after {@link #TIMEOUT_SECONDS}.
     */
    public static void awaitCondition(String description, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(TIMEOUT_SECONDS);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Timed out waiting for: " + description);
            }
            Thread.sleep(5);
        }
    }
}
