package ai.boardgames.player;

import ai.boardgames.game.GameState;

/**
 * Represents a participant that chooses the next action for the match loop.
 */
public interface Player {

    /** Returned when the player cannot continue (e.g. console input closed). */
    int NO_ACTION = -1;

    /**
     * Choose the next action.
     *
     * @param state current, non-terminal position
     * @return a legal action id, or {@link #NO_ACTION} to signal the match should stop
     */
    int nextAction(GameState state);
}
