package games.scramble;

import games.scramble.config.SimulationProperties;
import games.scramble.game.Board;
import games.scramble.game.Deck;
import games.scramble.player.PlayerStats;
import games.scramble.player.SimulatedPlayer;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Deals a board and lets a group of {@link SimulatedPlayer}s play on it concurrently.
 *
 * <p>Every player runs on its own thread. Once the configured timeout has passed the remaining
 * players are interrupted: a player can stay blocked forever on a card whose holder has finished
 * playing (a matched pair is only removed on its holder's next turn), so the timeout is what
 * guarantees the run ends.
 */
@Component
public class Simulation {
    private static final Logger log = LoggerFactory.getLogger(Simulation.class);
    /** Grace period for interrupted players to report back. */
    private static final long SHUTDOWN_GRACE_SECONDS = 5;

    private final SimulationProperties properties;

    public Simulation(SimulationProperties properties) {
        this.properties = properties;
    }

    /**
     * Summary of one simulation run.
     *
     * @param board the board as left by the players
     * @param players per-player statistics, in player order
     * @param elapsedMillis wall-clock duration of the run
     */
    public record SimulationResult(Board board, List<PlayerStats> players, long elapsedMillis) {
        public int totalMoves() {
            return players.stream().mapToInt(PlayerStats::totalMoves).sum();
        }

        public long abandonedPlayers() {
            return players.stream().filter(PlayerStats::abandoned).count();
        }
    }

    /**
     * Deals a fresh board from the configured deck and plays it.
     */
    public SimulationResult run() throws InterruptedException {
        Random random = properties.getSeed() == null ? new Random() : new Random(properties.getSeed());
        Deck deck = new Deck(properties.getRows(), properties.getCols(), properties.getSymbols(), random);
        return run(deck.deal(), random);
    }

    /**
     * Plays the configured number of simulated players on the given board.
     *
     * @param board the board to play on
     * @param random source for per-player seeds
     * @return statistics for every player
     * @throws InterruptedException if the calling thread is interrupted while waiting for players
     */
    public SimulationResult run(Board board, Random random) throws InterruptedException {
        int playerCount = properties.getPlayers();
        if (playerCount <= 0) {
            throw new IllegalArgumentException("simulation.players must be positive: " + playerCount);
        }
        log.info("Starting simulation: {} players, {} tries each, board {}x{}",
                playerCount, properties.getTries(), board.getRows(), board.getCols());

        List<SimulatedPlayer> players = new ArrayList<>();
        for (int i = 0; i < playerCount; i++) {
            players.add(new SimulatedPlayer("player" + i, board, properties.getTries(),
                    properties.getMinDelayMillis(), properties.getMaxDelayMillis(), new Random(random.nextLong())));
        }

        long startNanos = System.nanoTime();
        ExecutorService executor = Executors.newFixedThreadPool(playerCount);
        List<Future<PlayerStats>> futures = new ArrayList<>();
        try {
            for (SimulatedPlayer player : players) {
                futures.add(executor.submit(player));
            }
            executor.shutdown();
            if (!executor.awaitTermination(properties.getTimeoutSeconds(), TimeUnit.SECONDS)) {
                log.warn("Simulation timed out after {}s; interrupting remaining players", properties.getTimeoutSeconds());
                executor.shutdownNow();
                if (!executor.awaitTermination(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Some players did not stop within {}s of interruption", SHUTDOWN_GRACE_SECONDS);
                }
            }
        } finally {
            if (!executor.isTerminated()) {
                executor.shutdownNow();
            }
        }
        long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

        List<PlayerStats> stats = new ArrayList<>();
        for (int i = 0; i < futures.size(); i++) {
            stats.add(collect(players.get(i), futures.get(i)));
        }
        SimulationResult result = new SimulationResult(board, List.copyOf(stats), elapsedMillis);
        logSummary(result);
        return result;
    }

    private static PlayerStats collect(SimulatedPlayer player, Future<PlayerStats> future) throws InterruptedException {
        if (!future.isDone()) {
            future.cancel(true);
            return new PlayerStats(player.getId(), 0, 0, 0, 0, true);
        }
        try {
            return future.get();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Player " + player.getId() + " crashed", e.getCause());
        }
    }

    private static void logSummary(SimulationResult result) {
        log.info("=== Simulation Statistics ===");
        log.info("Total simulation time: {}ms ({}s)", result.elapsedMillis(),
                String.format("%.2f", result.elapsedMillis() / 1000.0));
        for (PlayerStats stats : result.players()) {
            log.info("{}: {} moves, {} successful ({}%), {} failed ({}%), {}ms{}",
                    stats.playerId(),
                    stats.totalMoves(),
                    stats.successfulMoves(), String.format("%.1f", stats.successRate()),
                    stats.failedMoves(), String.format("%.1f", stats.failureRate()),
                    stats.elapsedMillis(),
                    stats.abandoned() ? " (abandoned)" : "");
        }
        log.info("Cards left on board: {}", result.board().cardCount());
        if (log.isDebugEnabled()) {
            log.debug("Final board:\n{}", result.board());
        }
    }
}
