package ai.boardgames.player;

import ai.boardgames.game.GameState;
import java.util.List;
import java.util.Random;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Baseline opponent that plays a uniformly random legal action.
 */
@Component("opponent")
@Profile("!ai-human")
public class RandomPlayer implements Player {

    private final Random random;

    public RandomPlayer() {
        this(new Random());
    }

    public RandomPlayer(Random random) {
        this.random = random;
    }

    @Override
    public int nextAction(GameState state) {
        List<Integer> actions = state.legalActions();
        if (actions.isEmpty()) {
            return NO_ACTION;
        }
        return actions.get(random.nextInt(actions.size()));
    }
}
