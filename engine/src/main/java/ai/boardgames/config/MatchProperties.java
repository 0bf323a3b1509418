package ai.boardgames.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the console match.
 *
 * Usage:
 * {@code java -jar engine.jar --spring.profiles.active=ai-human --match.mcts-first=false}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "match")
public class MatchProperties {
  private boolean mctsFirst = true;

  /**
   * Returns whether the MCTS player takes the first move.
   * @return true if MCTS plays X, false if the opponent does
   */
  public boolean isMctsFirst() {
    return mctsFirst;
  }

  public void setMctsFirst(boolean mctsFirst) {
    this.mctsFirst = mctsFirst;
  }
}
