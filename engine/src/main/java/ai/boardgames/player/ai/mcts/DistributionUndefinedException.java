package ai.boardgames.player.ai.mcts;

/**
 * Raised when a visit-count distribution is requested but the root has no visits to normalise,
 * either because the root is terminal or because no simulation was run.
 */
public class DistributionUndefinedException extends IllegalStateException {

    public static final String MESSAGE = "distribution undefined: no simulations completed on a non-terminal root";

    public DistributionUndefinedException(String rootKey) {
        super(MESSAGE + " (root " + rootKey + ")");
    }
}
