package games.scramble;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import games.scramble.config.SimulationProperties;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

@SpringBootTest(properties = {"simulation.enabled=false", "simulation.players=7"})
class MemoryScrambleApplicationTest {

    @Autowired
    private SimulationProperties properties;

    @Autowired
    private Simulation simulation;

    @Test
    void contextLoadsWithoutRunningSimulation() {
        assertFalse(properties.isEnabled());
        assertEquals(7, properties.getPlayers());
        assertEquals(5, properties.getRows());
        assertNotNull(simulation);
    }
}
