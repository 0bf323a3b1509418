package ai.boardgames.player.ai.mcts;

import ai.boardgames.config.MctsProperties;
import ai.boardgames.game.GameState;
import ai.boardgames.player.Player;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Player backed by {@link MctsClassic}.
 *
 * <p>Each decision runs the configured number of simulations from the current position and plays
 * the action with the highest visit share (lowest action id on ties). The engine keeps its search
 * graph between calls, so when the opponent answers with a move the engine already explored, the
 * next search starts from the statistics gathered so far.
 */
@Component
public class MctsPlayer implements Player {

    private static final Logger log = LoggerFactory.getLogger(MctsPlayer.class);

    private final MctsClassic engine;
    private final MctsProperties properties;

    /**
     * Distribution behind the most recent decision, for logging and inspection.
     */
    private double[] lastDistribution;

    public MctsPlayer(MctsClassic engine, MctsProperties properties) {
        this.engine = engine;
        this.properties = properties;
    }

    @Override
    public int nextAction(GameState state) {
        double[] distribution = engine.getDistribution(
                state,
                properties.getSimulations(),
                properties.getExplorationConstant(),
                properties.isVerbose());
        lastDistribution = distribution;

        int best = bestAction(distribution);
        if (log.isDebugEnabled()) {
            log.debug("MCTS selected action {} with probability {}", best, String.format("%.4f", distribution[best]));
        }
        return best;
    }

    /**
     * Index of the largest entry; the first one wins ties.
     */
    static int bestAction(double[] distribution) {
        int best = 0;
        for (int action = 1; action < distribution.length; action++) {
            if (distribution[action] > distribution[best]) {
                best = action;
            }
        }
        return best;
    }

    /**
     * @return a copy of the distribution behind the last decision, or null before the first one
     */
    public double[] getLastDistribution() {
        return lastDistribution == null ? null : lastDistribution.clone();
    }
}
