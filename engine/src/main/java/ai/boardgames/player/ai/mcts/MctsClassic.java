package ai.boardgames.player.ai.mcts;

import ai.boardgames.game.GameState;
import ai.boardgames.player.ai.tree.Edge;
import ai.boardgames.player.ai.tree.Node;
import ai.boardgames.player.ai.tree.SearchGraph;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Classic Monte Carlo Tree Search with UCB selection and random playouts.
 *
 * <h2>Algorithm Overview</h2>
 * <p>Each query runs a fixed number of simulations from the queried position. One simulation is:
 * <ol>
 *   <li><b>Selection:</b> from the root, follow edges until a leaf. An unvisited edge is taken
 *       immediately (first-play urgency); otherwise the edge maximising
 *       {@code Q + C * sqrt(ln(total) / N)} is taken, earliest edge on ties.
 *   <li><b>Evaluation:</b> a terminal leaf is scored with its own terminal value. A non-terminal leaf
 *       is scored by a {@link RandomRollout} and then expanded with one edge per legal action.
 *   <li><b>Backpropagation:</b> every edge on the path gets {@code N += 1} and
 *       {@code W += ±value}, the sign flipping between the two players.
 * </ol>
 *
 * <p>The result is the root's edge visit counts normalised into a probability vector indexed by
 * action id.
 *
 * <h2>Tree reuse</h2>
 * <p>The {@link SearchGraph} survives between queries. If the queried position is already in the
 * graph (typically because it was reached from the previous root by one or two moves) it becomes the
 * new root with all its statistics, and everything not reachable from it is pruned. Otherwise the
 * graph is rebuilt from scratch.
 *
 * <p>Instances are not thread-safe: one engine serves one game session.
 */
public class MctsClassic {

    private static final Logger log = LoggerFactory.getLogger(MctsClassic.class);

    static final String PROGRESS_LABEL = "Exploring tree";

    private final int actionSpaceSize;
    private final RandomRollout rollout;
    private final ProgressListener progress;
    private final SearchGraph graph = new SearchGraph();

    /**
     * @param actionSpaceSize length of the distribution vector; every action id must be below it
     * @param rollout playout policy used to score new leaves
     * @param progress receives one update per simulation when a query is verbose
     */
    public MctsClassic(int actionSpaceSize, RandomRollout rollout, ProgressListener progress) {
        if (actionSpaceSize < 1) {
            throw new IllegalArgumentException("Action space size must be positive: " + actionSpaceSize);
        }
        this.actionSpaceSize = actionSpaceSize;
        this.rollout = Objects.requireNonNull(rollout, "rollout");
        this.progress = Objects.requireNonNull(progress, "progress");
    }

    /**
     * Run {@code simulations} MCTS simulations from {@code state} and return the normalised visit
     * counts of the root's actions.
     *
     * @param state position to search
     * @param simulations number of simulations to run, zero or more
     * @param explorationConstant UCB exploration weight {@code C}, finite and zero or more
     * @param verbose report progress after every simulation
     * @return probability per action id; entries are non-negative and sum to 1
     * @throws DistributionUndefinedException if the root ends up with no visits (terminal root or
     *         zero budget)
     * @throws IllegalStateException if the game breaks its contract during the search
     */
    public double[] getDistribution(GameState state, int simulations, double explorationConstant, boolean verbose) {
        Objects.requireNonNull(state, "state");
        if (simulations < 0) {
            throw new IllegalArgumentException("Simulation budget must not be negative: " + simulations);
        }
        if (!Double.isFinite(explorationConstant) || explorationConstant < 0.0) {
            throw new IllegalArgumentException("Exploration constant must be a finite non-negative number: " + explorationConstant);
        }
        // Earlier queries may have left visits on a reused root; an empty budget still defines nothing.
        if (simulations == 0) {
            throw new DistributionUndefinedException(state.key());
        }

        Node root = moveRoot(state);
        // Every simulation must pass through a root edge, including the first one.
        if (root.isLeaf() && !state.isTerminal()) {
            expand(root);
        }

        long startTime = System.currentTimeMillis();
        for (int i = 0; i < simulations; i++) {
            simulate(root, explorationConstant);
            if (verbose) {
                progress.onProgress(i + 1, simulations, PROGRESS_LABEL);
            }
        }
        long elapsedMs = System.currentTimeMillis() - startTime;

        double[] distribution = new double[actionSpaceSize];
        long total = 0;
        for (Edge edge : root.getEdges()) {
            int action = edge.getAction();
            if (action < 0 || action >= actionSpaceSize) {
                throw new IllegalStateException(
                        "Action " + action + " outside action space of size " + actionSpaceSize);
            }
            int visits = edge.getStats().getVisits();
            distribution[action] = visits;
            total += visits;
        }
        if (total == 0) {
            throw new DistributionUndefinedException(root.getKey());
        }
        for (int i = 0; i < distribution.length; i++) {
            distribution[i] /= total;
        }

        if (log.isDebugEnabled()) {
            log.debug("MCTS completed {} simulations in {}ms; root has {} edges, graph holds {} nodes",
                    simulations, elapsedMs, root.getEdges().size(), graph.size());
        }
        if (log.isTraceEnabled()) {
            for (Edge edge : root.getEdges()) {
                log.trace("  action {}: {}", edge.getAction(), edge.getStats());
            }
        }
        return distribution;
    }

    /**
     * Make {@code state} the root, keeping its subtree when it is already known.
     */
    private Node moveRoot(GameState state) {
        Optional<Node> known = graph.find(state.key());
        if (known.isPresent()) {
            if (log.isDebugEnabled()) {
                log.debug("Reusing search graph for {} ({} visits recorded)",
                        state.key(), known.get().getTotalVisits());
            }
            graph.pruneTo(known.get());
            return known.get();
        }
        return graph.reset(state);
    }

    /**
     * One select / evaluate / expand / backpropagate cycle.
     */
    void simulate(Node root, double explorationConstant) {
        List<Edge> path = new ArrayList<>();
        Node leaf = moveToLeaf(root, explorationConstant, path);

        double value;
        GameState leafState = leaf.getState();
        if (leafState.isTerminal()) {
            value = leafState.terminalValue();
        } else {
            value = rollout.evaluate(leafState);
            expand(leaf);
        }
        backPropagate(leafState.playerToMove(), value, path);
    }

    private Node moveToLeaf(Node root, double explorationConstant, List<Edge> path) {
        Node node = root;
        while (!node.isLeaf()) {
            Edge edge = selectEdge(node, explorationConstant);
            path.add(edge);
            node = edge.getChild();
        }
        return node;
    }

    /**
     * Pick the edge to descend through: the first unvisited edge if there is one, otherwise the
     * first edge with the highest UCB score.
     *
     * @param node an expanded node
     */
    static Edge selectEdge(Node node, double explorationConstant) {
        List<Edge> edges = node.getEdges();
        int total = node.getTotalVisits();
        double logTotal = Math.log(total);
        Edge best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (Edge edge : edges) {
            int visits = edge.getStats().getVisits();
            if (visits == 0) {
                return edge;
            }
            double score = edge.getStats().getMeanValue() + explorationConstant * Math.sqrt(logTotal / visits);
            if (score > bestScore) {
                bestScore = score;
                best = edge;
            }
        }
        return best;
    }

    /**
     * Add one edge per legal action of a non-terminal leaf, sharing child nodes already in the graph.
     */
    void expand(Node leaf) {
        if (!leaf.isLeaf()) {
            throw new IllegalStateException("Node already expanded: " + leaf.getKey());
        }
        GameState state = leaf.getState();
        List<Integer> actions = state.legalActions();
        if (actions.isEmpty()) {
            throw new IllegalStateException("Non-terminal state reported no legal actions: " + state.key());
        }
        for (int action : actions) {
            Node child = graph.lookupOrInsert(state.applyAction(action));
            leaf.addEdge(child, action);
        }
    }

    /**
     * Credit {@code value}, expressed for {@code evaluatedPlayer}, to every edge on the path.
     * Edges taken by the evaluated player gain the value, edges taken by the opponent lose it.
     */
    static void backPropagate(int evaluatedPlayer, double value, List<Edge> path) {
        for (Edge edge : path) {
            double sign = edge.getPlayer() == evaluatedPlayer ? 1.0 : -1.0;
            edge.getStats().update(sign * value);
        }
    }

    SearchGraph graph() {
        return graph;
    }
}
