package ai.boardgames.player.ai.tree;

/**
 * Directed arc of the search graph, from the node whose edge list holds it to {@link #getChild()}.
 *
 * <p>The child is shared: several parents may reach the same position through different move
 * orders, so the edge refers to the node but the {@link SearchGraph} owns it.
 */
public class Edge {

    private final Node child;
    private final int action;
    private final int player;
    private final EdgeStats stats = new EdgeStats();

    /**
     * @param child destination node
     * @param action action id that leads to the child
     * @param player player to move in the parent position, i.e. the one taking the action
     */
    public Edge(Node child, int action, int player) {
        this.child = child;
        this.action = action;
        this.player = player;
    }

    public Node getChild() {
        return child;
    }

    public int getAction() {
        return action;
    }

    public int getPlayer() {
        return player;
    }

    public EdgeStats getStats() {
        return stats;
    }

    @Override
    public String toString() {
        return "Edge{action=" + action + ", player=" + player + ", " + stats + "}";
    }
}
