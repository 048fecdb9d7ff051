package games.scramble;

import games.scramble.config.SimulationProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Command-line entry point: runs one player simulation on a freshly dealt board.
 */
@SpringBootApplication
public class MemoryScramble implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(MemoryScramble.class);

    private final Simulation simulation;
    private final SimulationProperties properties;

    public MemoryScramble(Simulation simulation, SimulationProperties properties) {
        this.simulation = simulation;
        this.properties = properties;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(MemoryScramble.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) throws Exception {
        if (!properties.isEnabled()) {
            log.info("Simulation disabled (simulation.enabled=false)");
            return;
        }
        simulation.run();
    }
}
