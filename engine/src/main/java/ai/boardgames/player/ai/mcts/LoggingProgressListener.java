package ai.boardgames.player.ai.mcts;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Renders search progress as a text bar through the logger, e.g.
 * {@code Exploring tree [##########----------]  50% (500/1000)}.
 *
 * <p>A line is emitted each time progress crosses a tenth of the budget and once on completion, so a
 * search with thousands of simulations produces about ten lines.
 */
public class LoggingProgressListener implements ProgressListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingProgressListener.class);

    private static final int BAR_WIDTH = 20;
    private static final int STEPS = 10;

    @Override
    public void onProgress(int completed, int total, String label) {
        if (total <= 0 || !log.isInfoEnabled()) {
            return;
        }
        int step = completed * STEPS / total;
        int previousStep = (completed - 1) * STEPS / total;
        if (completed != total && step == previousStep) {
            return;
        }
        log.info("{}", render(completed, total, label));
    }

    static String render(int completed, int total, String label) {
        int filled = (int) ((long) completed * BAR_WIDTH / total);
        int percent = (int) ((long) completed * 100 / total);
        return String.format("%s [%s%s] %3d%% (%d/%d)",
                label, "#".repeat(filled), "-".repeat(BAR_WIDTH - filled), percent, completed, total);
    }
}
