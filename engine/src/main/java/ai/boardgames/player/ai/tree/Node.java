package ai.boardgames.player.ai.tree;

import ai.boardgames.game.GameState;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Vertex of the search graph.
 *
 * <p>A node wraps exactly one game state and owns its outgoing edges in the order they were
 * created during expansion. That order is significant: selection breaks score ties in favour of the
 * earlier edge. A node without edges is a leaf; once edges have been added the node is expanded and
 * must never be expanded again.
 */
public class Node {

    private final GameState state;
    private final List<Edge> edges = new ArrayList<>();

    public Node(GameState state) {
        this.state = state;
    }

    public GameState getState() {
        return state;
    }

    /**
     * @return the state key this node is registered under
     */
    public String getKey() {
        return state.key();
    }

    /**
     * @return read-only view of the outgoing edges, in expansion order
     */
    public List<Edge> getEdges() {
        return Collections.unmodifiableList(edges);
    }

    public boolean isLeaf() {
        return edges.isEmpty();
    }

    /**
     * Append an outgoing edge.
     *
     * @param child destination node
     * @param action action id leading to the child
     * @return the new edge
     */
    public Edge addEdge(Node child, int action) {
        Edge edge = new Edge(child, action, state.playerToMove());
        edges.add(edge);
        return edge;
    }

    /**
     * Sum of the visit counts of all outgoing edges.
     */
    public int getTotalVisits() {
        int total = 0;
        for (Edge edge : edges) {
            total += edge.getStats().getVisits();
        }
        return total;
    }

    @Override
    public String toString() {
        return "Node{key=" + getKey() + ", edges=" + edges.size() + "}";
    }
}
