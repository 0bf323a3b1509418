package ai.boardgames.game;

import java.util.List;

/**
 * Position in a two-player, perfect-information, zero-sum game.
 *
 * <p>Implementations are immutable: {@link #applyAction(int)} returns a new state and never
 * mutates the receiver. The search engine is written purely against this interface, so any game
 * that satisfies it can be plugged in.
 */
public interface GameState {

    /**
     * @return identifier of the player whose turn it is
     */
    int playerToMove();

    /**
     * @return true when the game is over (win, loss or draw)
     */
    boolean isTerminal();

    /**
     * Legal action ids from this position, in a deterministic order.
     *
     * <p>Must be non-empty for every non-terminal state; an empty list on a non-terminal state is a
     * broken game implementation.
     *
     * @return legal action ids
     */
    List<Integer> legalActions();

    /**
     * Produce the state reached by playing {@code action}.
     *
     * @param action a legal action id
     * @return the successor state
     */
    GameState applyAction(int action);

    /**
     * Total equality key for this position. Positions reached through different move orders that
     * are strategically identical must share a key, which is what lets the search graph merge
     * transpositions.
     *
     * @return state key
     */
    String key();

    /**
     * Game result seen from the player to move at this terminal state: 1.0 win, -1.0 loss, 0.0 draw.
     *
     * @return terminal value
     * @throws IllegalStateException if the state is not terminal
     */
    double terminalValue();
}
