package ai.boardgames.player.ai.mcts;

import ai.boardgames.game.GameState;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Simulation (playout) phase of MCTS: plays uniformly random legal moves from a position until
 * the game ends.
 *
 * <p>The random source is injected so a fixed seed reproduces every playout exactly. Intermediate
 * states are not stored in the search graph.
 */
public class RandomRollout {

    private static final Logger log = LoggerFactory.getLogger(RandomRollout.class);

    private final Random random;

    public RandomRollout(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    /**
     * Play out {@code start} at random and score the final position.
     *
     * @param start the position to play out from
     * @return the result from the point of view of {@code start}'s player to move
     * @throws IllegalStateException if a non-terminal state reports no legal actions
     */
    public double evaluate(GameState start) {
        int player = start.playerToMove();
        GameState state = start;
        int steps = 0;
        while (!state.isTerminal()) {
            List<Integer> actions = state.legalActions();
            if (actions.isEmpty()) {
                throw new IllegalStateException("Non-terminal state reported no legal actions: " + state.key());
            }
            int action = actions.get(random.nextInt(actions.size()));
            state = state.applyAction(action);
            steps++;
        }
        double value = state.terminalValue();
        if (log.isTraceEnabled()) {
            log.trace("Rollout from {} ended after {} steps with value {} for player {}",
                    start.key(), steps, value, state.playerToMove());
        }
        return state.playerToMove() == player ? value : -value;
    }
}
