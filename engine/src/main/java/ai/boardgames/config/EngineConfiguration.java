package ai.boardgames.config;

import ai.boardgames.game.ConnectGameState;
import ai.boardgames.game.GridNeighbours;
import ai.boardgames.player.ai.mcts.LoggingProgressListener;
import ai.boardgames.player.ai.mcts.MctsClassic;
import ai.boardgames.player.ai.mcts.RandomRollout;
import java.util.Random;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the board geometry and the search engine from configuration properties.
 */
@Configuration
public class EngineConfiguration {

  @Bean
  public GridNeighbours gridNeighbours(BoardProperties board) {
    return GridNeighbours.of(board.getSize());
  }

  @Bean
  public ConnectGameState openingPosition(GridNeighbours grid, BoardProperties board) {
    return ConnectGameState.newGame(grid, board.getWinLength());
  }

  @Bean
  public MctsClassic mctsClassic(BoardProperties board, MctsProperties mcts) {
    Random random = mcts.getSeed() != null ? new Random(mcts.getSeed()) : new Random();
    return new MctsClassic(board.getActionSpaceSize(), new RandomRollout(random), new LoggingProgressListener());
  }
}
