package ai.boardgames.game;

/**
 * Handles formatting of a {@link ConnectGameState} board for console display.
 * <p>
 * Renders a bordered grid with column numbers across the top and row numbers down the left, so a
 * human player can read off the {@code row col} coordinates the console player expects. An optional
 * probability vector (as returned by the search engine) can be rendered as a second grid of
 * percentages beside the board.
 */
public class BoardFormatter {
    /** Width of a single cell, including padding. */
    private static final int CELL_WIDTH = 4;

    private final ConnectGameState state;

    /**
     * @param state the position to format; must not be null
     */
    public BoardFormatter(ConnectGameState state) {
        this.state = state;
    }

    /**
     * Renders the board with a status line naming the player to move or the result.
     *
     * @return a multi-line board representation
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        int size = state.size();
        appendHeader(sb, size);
        String border = "   +" + ("-".repeat(CELL_WIDTH - 1) + "+").repeat(size);
        sb.append(border).append('\n');
        for (int row = 0; row < size; row++) {
            sb.append(String.format("%2d |", row));
            for (int col = 0; col < size; col++) {
                sb.append(' ').append(ConnectGameState.symbol(state.cellAt(row, col))).append(" |");
            }
            sb.append('\n').append(border).append('\n');
        }
        sb.append(status());
        return sb.toString();
    }

    /**
     * Renders a distribution over the action space as a grid of whole percentages. Occupied cells
     * show their piece instead of a number.
     *
     * @param distribution probability per action id; length must equal the board's cell count
     * @return a multi-line rendering
     * @throws IllegalArgumentException if the vector length does not match the board
     */
    public String formatDistribution(double[] distribution) {
        int size = state.size();
        if (distribution.length != state.actionSpaceSize()) {
            throw new IllegalArgumentException("Distribution has " + distribution.length
                    + " entries but board has " + state.actionSpaceSize() + " cells");
        }
        StringBuilder sb = new StringBuilder();
        appendHeader(sb, size);
        for (int row = 0; row < size; row++) {
            sb.append(String.format("%2d |", row));
            for (int col = 0; col < size; col++) {
                int owner = state.cellAt(row, col);
                if (owner != ConnectGameState.NONE) {
                    sb.append(String.format("%" + CELL_WIDTH + "s", ConnectGameState.symbol(owner)));
                } else {
                    long percent = Math.round(distribution[state.actionAt(row, col)] * 100);
                    sb.append(String.format("%" + CELL_WIDTH + "d", percent));
                }
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private void appendHeader(StringBuilder sb, int size) {
        sb.append("    ");
        for (int col = 0; col < size; col++) {
            sb.append(String.format("%-" + CELL_WIDTH + "s", " " + col));
        }
        sb.append('\n');
    }

    private String status() {
        if (!state.isTerminal()) {
            return ConnectGameState.symbol(state.playerToMove()) + " to move\n";
        }
        if (state.winner() == ConnectGameState.NONE) {
            return "Draw\n";
        }
        return ConnectGameState.symbol(state.winner()) + " wins\n";
    }
}
