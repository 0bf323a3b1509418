package ai.boardgames.player.ai.tree;

import ai.boardgames.game.GameState;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Store of every node in the search graph, keyed by {@link GameState#key()}.
 *
 * <p>The store is the sole owner of nodes. Positions reached through different move orders share a
 * key and therefore a node, which turns the search tree into a directed acyclic graph. One node is
 * designated the root; it is reassigned whenever a new query starts.
 *
 * <p>Between queries the graph is either rebuilt from scratch ({@link #reset(GameState)}) or cut
 * down to the part reachable from the new root ({@link #pruneTo(Node)}), which is how statistics
 * gathered for one move carry over to the next.
 *
 * <p>Not thread-safe; owned by a single engine.
 */
public class SearchGraph {

    private static final Logger log = LoggerFactory.getLogger(SearchGraph.class);

    private Map<String, Node> nodes = new HashMap<>();
    private Node root;

    /**
     * Discard every node and start a new graph rooted at {@code state}.
     *
     * @param state position for the new root
     * @return the new root node
     */
    public Node reset(GameState state) {
        nodes = new HashMap<>();
        root = new Node(state);
        nodes.put(root.getKey(), root);
        if (log.isTraceEnabled()) {
            log.trace("Search graph reset to {}", root.getKey());
        }
        return root;
    }

    /**
     * Node for {@code state}'s key, creating and registering one if the key is new.
     */
    public Node lookupOrInsert(GameState state) {
        return nodes.computeIfAbsent(state.key(), key -> new Node(state));
    }

    /**
     * Keep only the nodes reachable from {@code newRoot} and make it the root.
     *
     * <p>The reachable set is computed completely, with an explicit work stack rather than
     * recursion, before the store is replaced. A node that is still reachable through any path is
     * therefore never dropped.
     *
     * @param newRoot a node currently held by this store
     * @throws IllegalArgumentException if {@code newRoot} is not part of this graph
     */
    public void pruneTo(Node newRoot) {
        if (nodes.get(newRoot.getKey()) != newRoot) {
            throw new IllegalArgumentException("Node is not part of this search graph: " + newRoot.getKey());
        }
        Map<String, Node> reachable = new HashMap<>();
        Deque<Node> pending = new ArrayDeque<>();
        reachable.put(newRoot.getKey(), newRoot);
        pending.push(newRoot);
        while (!pending.isEmpty()) {
            Node node = pending.pop();
            for (Edge edge : node.getEdges()) {
                Node child = edge.getChild();
                if (reachable.putIfAbsent(child.getKey(), child) == null) {
                    pending.push(child);
                }
            }
        }
        if (log.isDebugEnabled()) {
            log.debug("Pruned search graph from {} to {} nodes", nodes.size(), reachable.size());
        }
        nodes = reachable;
        root = newRoot;
    }

    /**
     * @return the node registered under {@code key}, if any
     */
    public Optional<Node> find(String key) {
        return Optional.ofNullable(nodes.get(key));
    }

    public boolean contains(String key) {
        return nodes.containsKey(key);
    }

    /**
     * @return the current root, or null before the first reset
     */
    public Node getRoot() {
        return root;
    }

    /**
     * @return number of nodes held
     */
    public int size() {
        return nodes.size();
    }
}
