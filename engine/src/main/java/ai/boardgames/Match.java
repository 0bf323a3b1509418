package ai.boardgames;

import ai.boardgames.config.MatchProperties;
import ai.boardgames.game.BoardFormatter;
import ai.boardgames.game.ConnectGameState;
import ai.boardgames.player.Player;
import ai.boardgames.player.ai.mcts.MctsPlayer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class Match implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(Match.class);

    private final MctsPlayer mctsPlayer;
    private final Player opponent;
    private final ConnectGameState openingPosition;
    private final boolean mctsFirst;

    @Autowired
    public Match(
            MctsPlayer mctsPlayer,
            @Qualifier("opponent") Player opponent,
            ConnectGameState openingPosition,
            MatchProperties properties) {
        this(mctsPlayer, opponent, openingPosition, properties.isMctsFirst());
    }

    Match(MctsPlayer mctsPlayer, Player opponent, ConnectGameState openingPosition, boolean mctsFirst) {
        this.mctsPlayer = mctsPlayer;
        this.opponent = opponent;
        this.openingPosition = openingPosition;
        this.mctsFirst = mctsFirst;
    }

    public static void main(String[] args) {
        SpringApplication app = new SpringApplication(Match.class);
        app.setWebApplicationType(WebApplicationType.NONE);
        app.run(args);
    }

    @Override
    public void run(String... args) {
        MatchResult result = play();
        if (log.isInfoEnabled()) {
            log.info("Match finished after {} plies: {}", result.getPlies(), describe(result.getWinner()));
        }
    }

    /**
     * Core match loop used by both the CLI runner and automated tests.
     *
     * <p>Each ply: render the board, ask the side to move for an action, apply it. The MCTS side
     * logs its distribution; with {@code -Dlog.episodes=true} every MCTS decision is also written as
     * an episode line. The loop ends at a terminal position or when a player returns
     * {@link Player#NO_ACTION}.
     *
     * @return summary of the winner, the number of plies played and the elapsed time
     */
    public MatchResult play() {
        ConnectGameState state = openingPosition;
        int mctsSide = mctsFirst ? ConnectGameState.PLAYER_ONE : ConnectGameState.PLAYER_TWO;
        int plies = 0;
        boolean aborted = false;
        long startNanos = System.nanoTime();

        while (!state.isTerminal()) {
            BoardFormatter formatter = new BoardFormatter(state);
            if (log.isInfoEnabled()) {
                log.info("\nMOVE {}\n{}", plies + 1, formatter.format());
            }

            boolean mctsTurn = state.playerToMove() == mctsSide;
            Player player = mctsTurn ? mctsPlayer : opponent;
            int action = player.nextAction(state);
            if (action == Player.NO_ACTION) {
                if (log.isInfoEnabled()) {
                    log.info("{} stopped the match", player.getClass().getSimpleName());
                }
                aborted = true;
                break;
            }

            if (mctsTurn) {
                double[] distribution = mctsPlayer.getLastDistribution();
                if (log.isDebugEnabled()) {
                    log.debug("MCTS visit distribution:\n{}", formatter.formatDistribution(distribution));
                }
                if (EpisodeLogger.isEnabled()) {
                    EpisodeLogger.logStep(MctsPlayer.class.getSimpleName(), plies, state, distribution, action);
                }
            }
            if (log.isDebugEnabled()) {
                log.debug("{} played {} at cell {}",
                        player.getClass().getSimpleName(),
                        ConnectGameState.symbol(state.playerToMove()),
                        action);
            }

            state = state.applyAction(action);
            plies++;
        }

        if (log.isInfoEnabled()) {
            log.info("\nFINAL\n{}", new BoardFormatter(state).format());
        }
        int winner = aborted ? ConnectGameState.NONE : state.winner();
        MatchResult result = new MatchResult(winner, plies, aborted, state, System.nanoTime() - startNanos);
        if (EpisodeLogger.isEnabled()) {
            EpisodeLogger.logSummary(result);
        }
        return result;
    }

    private String describe(int winner) {
        if (winner == ConnectGameState.NONE) {
            return "no winner";
        }
        int mctsSide = mctsFirst ? ConnectGameState.PLAYER_ONE : ConnectGameState.PLAYER_TWO;
        String who = winner == mctsSide ? "MCTS" : opponent.getClass().getSimpleName();
        return who + " (" + ConnectGameState.symbol(winner) + ") wins";
    }

    /**
     * Lightweight summary of a single match.
     */
    public static final class MatchResult {
        private final int winner;
        private final int plies;
        private final boolean aborted;
        private final ConnectGameState finalState;
        private final long durationNanos;

        public MatchResult(int winner, int plies, boolean aborted, ConnectGameState finalState, long durationNanos) {
            this.winner = winner;
            this.plies = plies;
            this.aborted = aborted;
            this.finalState = finalState;
            this.durationNanos = durationNanos;
        }

        /**
         * @return winning player id, or {@link ConnectGameState#NONE} for a draw or an aborted match
         */
        public int getWinner() {
            return winner;
        }

        public int getPlies() {
            return plies;
        }

        public boolean isAborted() {
            return aborted;
        }

        public ConnectGameState getFinalState() {
            return finalState;
        }

        public long getDurationNanos() {
            return durationNanos;
        }
    }
}
