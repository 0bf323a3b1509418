package ai.boardgames.player.ai.tree;

/**
 * Running statistics of a single search edge.
 *
 * <ul>
 *   <li>{@code N}: number of simulations that passed through the edge
 *   <li>{@code W}: cumulative value backed up through the edge, from the acting player's view
 *   <li>{@code Q}: mean value, always exactly {@code W / N} once {@code N > 0}
 * </ul>
 *
 * <p>{@code N} only ever grows; {@link #update(double)} is the single mutator.
 */
public final class EdgeStats {

    private int visits;
    private double totalValue;
    private double meanValue;

    /**
     * Record one more simulation through this edge.
     *
     * @param value the signed value to accumulate
     */
    public void update(double value) {
        visits++;
        totalValue += value;
        meanValue = totalValue / visits;
    }

    /** @return N */
    public int getVisits() {
        return visits;
    }

    /** @return W */
    public double getTotalValue() {
        return totalValue;
    }

    /** @return Q, or 0.0 while the edge is unvisited */
    public double getMeanValue() {
        return meanValue;
    }

    @Override
    public String toString() {
        return String.format("N=%d W=%.4f Q=%.4f", visits, totalValue, meanValue);
    }
}
