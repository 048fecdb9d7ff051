package games.scramble.player;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import games.scramble.game.Board;
import games.scramble.game.Location;
import games.scramble.helpers.BoardBuilder;
import java.util.Random;
import org.junit.jupiter.api.Test;

class SimulatedPlayerTest {

    @Test
    void statsAddUpForSinglePlayer() {
        Board board = BoardBuilder.of(
                "A B",
                "B A");
        PlayerStats stats = new SimulatedPlayer("solo", board, 40, 0.0, 0.0, new Random(11)).call();

        assertEquals("solo", stats.playerId());
        assertEquals(40, stats.totalMoves());
        assertEquals(stats.totalMoves(), stats.successfulMoves() + stats.failedMoves());
        assertFalse(stats.abandoned());
        assertEquals(100.0, stats.successRate() + stats.failureRate(), 1e-9);
    }

    @Test
    void playerLeavesNoCardUnderControl() {
        Board board = BoardBuilder.of(
                "A A",
                "B B");
        new SimulatedPlayer("solo", board, 25, 0.0, 0.0, new Random(2)).call();

        for (int r = 0; r < 2; r++) {
            for (int c = 0; c < 2; c++) {
                assertTrue(board.controllerOf(Location.of(r, c)).isEmpty());
            }
        }
    }

    @Test
    void zeroTriesOnlyLooks() {
        Board board = BoardBuilder.of("A A");
        PlayerStats stats = new SimulatedPlayer("idle", board, 0, 0.0, 0.0, new Random()).call();

        assertEquals(0, stats.totalMoves());
        assertEquals(0.0, stats.successRate());
        assertEquals(2, board.cardCount());
    }

    @Test
    void invalidSettingsAreRejected() {
        Board board = BoardBuilder.of("A A");
        assertThrows(IllegalArgumentException.class,
                () -> new SimulatedPlayer("p", board, -1, 0.0, 0.0, new Random()));
        assertThrows(IllegalArgumentException.class,
                () -> new SimulatedPlayer("p", board, 1, 2.0, 1.0, new Random()));
    }
}
