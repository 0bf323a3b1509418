package ai.boardgames.game;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Precomputed 8-neighbourhood of every cell on an N×N grid.
 *
 * <p>Cells are indexed row-major ({@code row * size + col}). For every cell the table stores one
 * entry per {@link Direction}, holding the index of the adjacent cell or {@link #OFF_BOARD} when the
 * step would leave the grid. The table is computed once per board size and shared by every state
 * of that board; it is never mutated after construction.
 */
public final class GridNeighbours {

    /** Marker for a step that leaves the grid. */
    public static final int OFF_BOARD = -1;

    /**
     * The eight compass directions, in the order they are stored for each cell.
     */
    public enum Direction {
        NORTH_WEST(-1, -1),
        NORTH(-1, 0),
        NORTH_EAST(-1, 1),
        WEST(0, -1),
        EAST(0, 1),
        SOUTH_WEST(1, -1),
        SOUTH(1, 0),
        SOUTH_EAST(1, 1);

        private final int rowDelta;
        private final int colDelta;

        Direction(int rowDelta, int colDelta) {
            this.rowDelta = rowDelta;
            this.colDelta = colDelta;
        }

        /**
         * @return the direction pointing the opposite way
         */
        public Direction opposite() {
            return values()[values().length - 1 - ordinal()];
        }
    }

    private final int size;
    private final int[][] table;
    private final List<List<Integer>> neighbourLists;

    private GridNeighbours(int size, int[][] table) {
        this.size = size;
        this.table = table;
        List<List<Integer>> lists = new ArrayList<>(table.length);
        for (int[] steps : table) {
            List<Integer> cells = new ArrayList<>(steps.length);
            for (int cell : steps) {
                if (cell != OFF_BOARD) {
                    cells.add(cell);
                }
            }
            lists.add(Collections.unmodifiableList(cells));
        }
        this.neighbourLists = Collections.unmodifiableList(lists);
    }

    /**
     * Compute the neighbour table for an N×N grid.
     *
     * @param size board side length, at least 1
     * @return the neighbour table
     * @throws IllegalArgumentException if {@code size < 1}
     */
    public static GridNeighbours of(int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Board size must be positive: " + size);
        }
        Direction[] directions = Direction.values();
        int[][] table = new int[size * size][directions.length];
        for (int row = 0; row < size; row++) {
            for (int col = 0; col < size; col++) {
                int[] steps = table[row * size + col];
                for (Direction direction : directions) {
                    int r = row + direction.rowDelta;
                    int c = col + direction.colDelta;
                    boolean inside = r >= 0 && r < size && c >= 0 && c < size;
                    steps[direction.ordinal()] = inside ? r * size + c : OFF_BOARD;
                }
            }
        }
        return new GridNeighbours(size, table);
    }

    /**
     * @return board side length
     */
    public int size() {
        return size;
    }

    /**
     * @return number of cells on the board
     */
    public int cellCount() {
        return table.length;
    }

    /**
     * Index of the cell one step from {@code cell} in {@code direction}.
     *
     * @return adjacent cell index, or {@link #OFF_BOARD}
     */
    public int step(int cell, Direction direction) {
        return table[cell][direction.ordinal()];
    }

    /**
     * On-board neighbours of {@code cell}, in {@link Direction} order.
     */
    public List<Integer> neighboursOf(int cell) {
        return neighbourLists.get(cell);
    }
}
