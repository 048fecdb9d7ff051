package games.scramble.config;

import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the player simulation.
 *
 * Controls the board that is dealt, how many simulated players flip cards on it concurrently,
 * and how long the run may take before still-blocked players are interrupted.
 *
 * Usage:
 * {@code mvn -pl engine spring-boot:run -Dspring-boot.run.jvmArguments="-Dsimulation.players=8 -Dsimulation.seed=42"}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "simulation")
public class SimulationProperties {
  private boolean enabled = true;
  private int rows = 5;
  private int cols = 5;
  private int players = 4;
  private int tries = 100;
  private double minDelayMillis = 0.1;
  private double maxDelayMillis = 2.0;
  private long timeoutSeconds = 30;
  private Long seed;
  private List<String> symbols = new ArrayList<>(List.of(
      "🦄", "🌈", "🍎", "🐙", "🌵", "🎲", "🚀", "🍩", "🐝", "🎈", "🍄", "🌙", "🦊"));

  /**
   * Returns whether the simulation runs when the application starts.
   * @return true to run on startup
   */
  public boolean isEnabled() {
    return enabled;
  }

  /**
   * Sets whether the simulation runs on startup.
   * @param enabled true to run on startup, false to only load the context
   */
  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  /**
   * Returns the number of board rows.
   * @return rows, positive
   */
  public int getRows() {
    return rows;
  }

  /**
   * Sets the number of board rows.
   * @param rows rows, positive
   */
  public void setRows(int rows) {
    this.rows = rows;
  }

  /**
   * Returns the number of board columns.
   * @return columns, positive
   */
  public int getCols() {
    return cols;
  }

  /**
   * Sets the number of board columns.
   * @param cols columns, positive
   */
  public void setCols(int cols) {
    this.cols = cols;
  }

  /**
   * Returns how many simulated players run concurrently.
   * @return player count
   */
  public int getPlayers() {
    return players;
  }

  /**
   * Sets how many simulated players run concurrently.
   * @param players player count, positive
   */
  public void setPlayers(int players) {
    this.players = players;
  }

  /**
   * Returns how many two-card attempts each player makes.
   * @return attempts per player
   */
  public int getTries() {
    return tries;
  }

  /**
   * Sets how many two-card attempts each player makes.
   * @param tries attempts per player
   */
  public void setTries(int tries) {
    this.tries = tries;
  }

  /**
   * Returns the shortest pause before a flip.
   * @return pause in milliseconds
   */
  public double getMinDelayMillis() {
    return minDelayMillis;
  }

  /**
   * Sets the shortest pause before a flip.
   * @param minDelayMillis pause in milliseconds, fractions allowed
   */
  public void setMinDelayMillis(double minDelayMillis) {
    this.minDelayMillis = minDelayMillis;
  }

  /**
   * Returns the longest pause before a flip.
   * @return pause in milliseconds
   */
  public double getMaxDelayMillis() {
    return maxDelayMillis;
  }

  /**
   * Sets the longest pause before a flip.
   * @param maxDelayMillis pause in milliseconds, not below the minimum
   */
  public void setMaxDelayMillis(double maxDelayMillis) {
    this.maxDelayMillis = maxDelayMillis;
  }

  /**
   * Returns how long the whole run may take before blocked players are interrupted.
   * @return timeout in seconds
   */
  public long getTimeoutSeconds() {
    return timeoutSeconds;
  }

  /**
   * Sets how long the run may take before blocked players are interrupted.
   * @param timeoutSeconds timeout in seconds
   */
  public void setTimeoutSeconds(long timeoutSeconds) {
    this.timeoutSeconds = timeoutSeconds;
  }

  /**
   * Returns the random seed for dealing and player moves, or null for a random run.
   * @return the seed, may be null
   */
  public Long getSeed() {
    return seed;
  }

  /**
   * Sets the random seed.
   * @param seed the seed, or null for a random run
   */
  public void setSeed(Long seed) {
    this.seed = seed;
  }

  /**
   * Returns the display forms dealt onto the board.
   * @return the symbols, cycled when the board needs more pairs than there are symbols
   */
  public List<String> getSymbols() {
    return symbols;
  }

  /**
   * Sets the display forms dealt onto the board.
   * @param symbols non-empty display forms
   */
  public void setSymbols(List<String> symbols) {
    this.symbols = symbols;
  }
}
