package ai.boardgames.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the MCTS player.
 *
 * Usage:
 * {@code java -jar engine.jar --mcts.simulations=5000 --mcts.exploration-constant=1.0 --mcts.seed=42}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "mcts")
public class MctsProperties {
  private int simulations = 1000;
  private double explorationConstant = 1.4;
  private boolean verbose = false;
  private Long seed;

  /**
   * Number of simulations run per move.
   * @return the simulation budget
   */
  public int getSimulations() {
    return simulations;
  }

  public void setSimulations(int simulations) {
    this.simulations = simulations;
  }

  /**
   * Exploration weight C in the UCB score Q + C * sqrt(ln(total) / N).
   * @return the exploration constant
   */
  public double getExplorationConstant() {
    return explorationConstant;
  }

  public void setExplorationConstant(double explorationConstant) {
    this.explorationConstant = explorationConstant;
  }

  /**
   * Whether each search reports its progress.
   * @return true to log a progress bar during searches
   */
  public boolean isVerbose() {
    return verbose;
  }

  public void setVerbose(boolean verbose) {
    this.verbose = verbose;
  }

  /**
   * Seed for the rollout random source; unset means a fresh random seed per run.
   * @return the seed, or null
   */
  public Long getSeed() {
    return seed;
  }

  public void setSeed(Long seed) {
    this.seed = seed;
  }
}
