package ai.boardgames;

import ai.boardgames.game.GameState;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Responsible for emitting structured JSON logs describing MCTS decisions.
 *
 * <p>Each decision is one line prefixed with {@code EPISODE_STEP}, holding the position key, the
 * player to move, the visit-count distribution over the whole action space and the chosen action.
 * These are the (position, policy target) pairs a policy-training pipeline consumes. Each finished
 * match adds one {@code EPISODE_SUMMARY} line.
 */
public class EpisodeLogger {
    private static final Logger log = LoggerFactory.getLogger(EpisodeLogger.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final boolean ENABLED = Boolean.getBoolean("log.episodes");

    private EpisodeLogger() {
    }

    /**
     * Return true if episode logging is enabled via -Dlog.episodes=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    /**
     * Build the JSON line for one decision.
     *
     * @param solverId name of the deciding player
     * @param stepIndex ply number, starting at 0
     * @param state position before the move
     * @param distribution probability per action id behind the decision
     * @param chosenAction action that was played
     * @return the JSON document, without the prefix
     */
    public static String formatStep(
            String solverId,
            int stepIndex,
            GameState state,
            double[] distribution,
            int chosenAction) throws JsonProcessingException {
        Map<String, Object> step = new LinkedHashMap<>();
        step.put("type", "step");
        step.put("solver", solverId);
        step.put("step_index", stepIndex);
        step.put("state_key", state.key());
        step.put("player", state.playerToMove());
        step.put("chosen_action", chosenAction);
        step.put("legal_actions", state.legalActions());
        step.put("distribution", distribution);
        return OBJECT_MAPPER.writeValueAsString(step);
    }

    /**
     * Emit a single decision line. Failures are logged and otherwise ignored so logging never
     * interferes with play.
     */
    public static void logStep(
            String solverId,
            int stepIndex,
            GameState state,
            double[] distribution,
            int chosenAction) {
        try {
            String json = formatStep(solverId, stepIndex, state, distribution, chosenAction);
            if (log.isInfoEnabled()) {
                log.info("EPISODE_STEP {}", json);
            }
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode step", e);
            }
        }
    }

    /**
     * Emit a single structured JSON line summarising the whole match.
     */
    public static void logSummary(Match.MatchResult result) {
        try {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("type", "summary");
            summary.put("winner", result.getWinner());
            summary.put("plies", result.getPlies());
            summary.put("final_state_key", result.getFinalState().key());
            summary.put("duration_nanos", result.getDurationNanos());
            if (log.isInfoEnabled()) {
                log.info("EPISODE_SUMMARY {}", OBJECT_MAPPER.writeValueAsString(summary));
            }
        } catch (Exception e) {
            if (log.isDebugEnabled()) {
                log.debug("Failed to log episode summary", e);
            }
        }
    }
}
