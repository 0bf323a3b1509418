package ai.boardgames.player.ai;

import static org.junit.jupiter.api.Assertions.*;

import ai.boardgames.config.MctsProperties;
import ai.boardgames.game.ConnectGameState;
import ai.boardgames.player.Player;
import ai.boardgames.player.RandomPlayer;
import ai.boardgames.player.ai.mcts.MctsClassic;
import ai.boardgames.player.ai.mcts.MctsPlayer;
import ai.boardgames.player.ai.mcts.ProgressListener;
import ai.boardgames.player.ai.mcts.RandomRollout;
import ai.boardgames.unit.helpers.PositionFactory;
import java.util.Random;
import org.junit.jupiter.api.Test;

/**
 * Basic behaviour tests for {@link MctsPlayer}:
 * - takes immediate wins and blocks immediate losses
 * - exposes the distribution behind each decision
 * - reuses the search across consecutive turns.
 */
class MctsPlayerTest {

    private static MctsPlayer player(long seed, int simulations, double explorationConstant) {
        MctsProperties properties = new MctsProperties();
        properties.setSimulations(simulations);
        properties.setExplorationConstant(explorationConstant);
        MctsClassic engine = new MctsClassic(9, new RandomRollout(new Random(seed)), ProgressListener.NONE);
        return new MctsPlayer(engine, properties);
    }

    @Test
    void takesImmediateWin() {
        MctsPlayer ai = player(1, 1000, 1.0);

        assertEquals(2, ai.nextAction(PositionFactory.xWinsAtTwo()));
    }

    @Test
    void blocksImmediateLoss() {
        MctsPlayer ai = player(2, 3000, 1.0);

        assertEquals(2, ai.nextAction(PositionFactory.oMustBlockAtTwo()));
    }

    @Test
    void playsTheOnlyLegalAction() {
        MctsPlayer ai = player(3, 5, 1.4);

        assertEquals(8, ai.nextAction(PositionFactory.singleLegalAction()));
    }

    @Test
    void lastDistributionMatchesDecision() {
        MctsPlayer ai = player(4, 200, 1.4);
        assertNull(ai.getLastDistribution());

        int action = ai.nextAction(PositionFactory.emptyTicTacToe());

        double[] distribution = ai.getLastDistribution();
        assertNotNull(distribution);
        for (double p : distribution) {
            assertTrue(distribution[action] >= p);
        }
        distribution[action] = -1;
        assertNotEquals(-1, ai.getLastDistribution()[action], "Returned distribution must be a copy");
    }

    @Test
    void keepsPlayingLegalMovesThroughAWholeGame() {
        MctsPlayer ai = player(5, 1000, 1.4);
        Player opponent = new RandomPlayer(new Random(5));
        ConnectGameState state = PositionFactory.emptyTicTacToe();

        while (!state.isTerminal()) {
            Player mover = state.playerToMove() == ConnectGameState.PLAYER_ONE ? ai : opponent;
            int action = mover.nextAction(state);
            assertTrue(state.legalActions().contains(action), "Illegal action " + action);
            state = state.applyAction(action);
        }
        assertNotEquals(ConnectGameState.PLAYER_TWO, state.winner(), "MCTS should not lose tic-tac-toe to random play");
    }
}
