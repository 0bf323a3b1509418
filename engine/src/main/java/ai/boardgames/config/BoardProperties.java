package ai.boardgames.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the board.
 *
 * The board is {@code size} x {@code size}; the action space has one action per cell.
 *
 * Usage:
 * {@code java -jar engine.jar --board.size=7 --board.win-length=4}
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "board")
public class BoardProperties {
  private int size = 3;
  private int winLength = 3;

  public int getSize() {
    return size;
  }

  public void setSize(int size) {
    this.size = size;
  }

  /**
   * Number of cells in a row needed to win.
   * @return the win length
   */
  public int getWinLength() {
    return winLength;
  }

  public void setWinLength(int winLength) {
    this.winLength = winLength;
  }

  /**
   * @return number of actions in the action space
   */
  public int getActionSpaceSize() {
    return size * size;
  }
}
