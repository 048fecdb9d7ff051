package games.scramble.game;

import static games.scramble.helpers.BoardTestHelper.TIMEOUT_SECONDS;
import static games.scramble.helpers.BoardTestHelper.awaitCondition;
import static games.scramble.helpers.BoardTestHelper.cell;
import static games.scramble.helpers.BoardTestHelper.flipAsync;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.scramble.helpers.BoardBuilder;
import games.scramble.player.PlayerStats;
import games.scramble.player.SimulatedPlayer;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-threaded coverage: blocking on a held card, racing released waiters, denial when the
 * awaited card is removed, interruption, and a randomized run with invariants checked on every
 * operation (assertions are enabled under Surefire).
 *
 * <p>Layout:
 * <pre>
 *   A B C
 *   C B A
 * </pre>
 */
class BoardConcurrencyTest {
    private static final Logger log = LoggerFactory.getLogger(BoardConcurrencyTest.class);

    private static final Location A1 = Location.of(0, 0);
    private static final Location B1 = Location.of(0, 1);
    private static final Location C1 = Location.of(0, 2);
    private static final Location C2 = Location.of(1, 0);
    private static final Location B2 = Location.of(1, 1);
    private static final Location A2 = Location.of(1, 2);

    private Board board;

    @BeforeEach
    void setUp() {
        board = BoardBuilder.of(
                "A B C",
                "C B A");
    }

    @Test
    void waiterGetsCardOnceHolderLetsGo() throws Exception {
        board.flip("p1", A1);
        CompletableFuture<Void> waiting = flipAsync(board, "p2", A1);
        awaitCondition("p2 waiting on 0x0", () -> board.isWaiting("p2", A1));

        assertFalse(waiting.isDone());
        assertEquals("my A", cell(board, "p1", A1));

        board.flip("p1", B1);

        waiting.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals("my A", cell(board, "p2", A1));
        assertEquals(Optional.of("p2"), board.controllerOf(A1));
        assertFalse(board.isWaiting("p2", A1));
    }

    @Test
    void lookNeverBlocksWhileOthersWait() throws Exception {
        board.flip("p1", A1);
        CompletableFuture<Void> waiting = flipAsync(board, "p2", A1);
        awaitCondition("p2 waiting on 0x0", () -> board.isWaiting("p2", A1));

        assertEquals("up A", cell(board, "p3", A1));
        board.flip("p3", B2);
        assertEquals("my B", cell(board, "p3", B2));

        board.flip("p1", C1);
        waiting.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    @Test
    void releasedWaitersRaceAndExactlyOneWins() throws Exception {
        board.flip("p1", A1);
        CompletableFuture<Void> p2 = flipAsync(board, "p2", A1);
        CompletableFuture<Void> p3 = flipAsync(board, "p3", A1);
        awaitCondition("both waiting on 0x0", () -> board.isWaiting("p2", A1) && board.isWaiting("p3", A1));

        board.flip("p1", B1);

        awaitCondition("one waiter wins", () -> p2.isDone() || p3.isDone());
        String winner = p2.isDone() ? "p2" : "p3";
        String loser = winner.equals("p2") ? "p3" : "p2";
        CompletableFuture<Void> loserFlip = winner.equals("p2") ? p3 : p2;

        assertEquals(Optional.of(winner), board.controllerOf(A1));
        awaitCondition("loser waits again", () -> board.isWaiting(loser, A1));
        assertFalse(loserFlip.isDone());
        log.debug("race on {} won by {}", A1, winner);

        // the winner gives up the card with a mismatch, and the loser gets it
        board.flip(winner, B2);
        loserFlip.get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        assertEquals(Optional.of(loser), board.controllerOf(A1));
    }

    @Test
    void waiterIsDeniedWhenAwaitedCardIsRemoved() throws Exception {
        board.flip("p1", A1);
        board.flip("p1", A2);
        CompletableFuture<Void> waiting = flipAsync(board, "p2", A1);
        awaitCondition("p2 waiting on 0x0", () -> board.isWaiting("p2", A1));

        board.flip("p1", C1);

        ExecutionException e = assertThrows(ExecutionException.class,
                () -> waiting.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        BoardException cause = assertInstanceOf(BoardException.class, e.getCause());
        assertEquals(BoardError.LOCATION_UNAVAILABLE, cause.getError());
        assertEquals("none", cell(board, "p2", A1));
        assertTrue(board.controlledBy("p2").isEmpty());
    }

    @Test
    void waiterDeniedOnRemovalOfEitherMatchedCard() throws Exception {
        board.flip("p1", A1);
        board.flip("p1", A2);
        CompletableFuture<Void> onFirst = flipAsync(board, "p2", A1);
        CompletableFuture<Void> onSecond = flipAsync(board, "p3", A2);
        awaitCondition("both waiting", () -> board.isWaiting("p2", A1) && board.isWaiting("p3", A2));

        assertThrows(BoardException.class, () -> board.flip("p1", A2));

        for (CompletableFuture<Void> future : List.of(onFirst, onSecond)) {
            ExecutionException e = assertThrows(ExecutionException.class,
                    () -> future.get(TIMEOUT_SECONDS, TimeUnit.SECONDS));
            assertEquals(BoardError.LOCATION_UNAVAILABLE, ((BoardException) e.getCause()).getError());
        }
    }

    @Test
    void interruptedWaiterWithdrawsFromQueue() throws Exception {
        board.flip("p1", A1);
        AtomicReference<Throwable> outcome = new AtomicReference<>();
        Thread waiter = new Thread(() -> {
            try {
                board.flip("p2", A1);
            } catch (Throwable e) {
                outcome.set(e);
            }
        }, "interrupted-waiter");
        waiter.setDaemon(true);
        waiter.start();
        awaitCondition("p2 waiting on 0x0", () -> board.isWaiting("p2", A1));

        waiter.interrupt();
        waiter.join(TimeUnit.SECONDS.toMillis(TIMEOUT_SECONDS));

        assertFalse(waiter.isAlive());
        assertInstanceOf(InterruptedException.class, outcome.get());
        assertFalse(board.isWaiting("p2", A1));
        assertEquals(Optional.of("p1"), board.controllerOf(A1));
        // the board is still usable by the interrupted player
        board.flip("p2", C2);
        assertEquals("my C", cell(board, "p2", C2));
    }

    @Test
    void watcherSeesChangeMadeByAnotherThread() throws Exception {
        CompletableFuture<String> watch = board.watch("observer");
        flipAsync(board, "p1", C2).get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
        String[] lines = watch.get(TIMEOUT_SECONDS, TimeUnit.SECONDS).split("\n");
        assertEquals("up C", lines[4]);
    }

    @Test
    void randomPlayersKeepBoardConsistent() throws Exception {
        Board large = BoardBuilder.of(
                "A B C D",
                "E F G H",
                "A B C D",
                "E F G H");
        int players = 6;
        ExecutorService executor = Executors.newFixedThreadPool(players);
        try {
            List<Future<PlayerStats>> futures = new ArrayList<>();
            Random seeds = new Random(7);
            for (int i = 0; i < players; i++) {
                futures.add(executor.submit(
                        new SimulatedPlayer("stress" + i, large, 150, 0.0, 0.05, new Random(seeds.nextLong()))));
            }
            int total = 0;
            for (Future<PlayerStats> future : futures) {
                PlayerStats stats = future.get(30, TimeUnit.SECONDS);
                assertFalse(stats.abandoned());
                assertEquals(stats.totalMoves(), stats.successfulMoves() + stats.failedMoves());
                total += stats.totalMoves();
            }
            assertEquals(players * 150, total);
        } finally {
            executor.shutdownNow();
        }

        // every player released its pair on the way out, so nobody controls anything
        Set<String> controllers = new HashSet<>();
        for (int r = 0; r < large.getRows(); r++) {
            for (int c = 0; c < large.getCols(); c++) {
                large.controllerOf(Location.of(r, c)).ifPresent(controllers::add);
            }
        }
        assertTrue(controllers.isEmpty(), "still controlled by " + controllers);
        assertEquals(0, large.cardCount() % 2);
    }
}
