package ai.boardgames.player.ai.mcts;

/**
 * Receives progress updates from long-running searches.
 *
 * <p>Invoked once per completed simulation, between simulations, so an implementation never sees
 * the search graph in an inconsistent state.
 */
@FunctionalInterface
public interface ProgressListener {

    /** Listener that ignores every update. */
    ProgressListener NONE = (completed, total, label) -> { };

    /**
     * @param completed number of simulations finished so far
     * @param total simulation budget of the running query
     * @param label short description of the running task
     */
    void onProgress(int completed, int total, String label);
}
