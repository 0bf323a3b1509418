package ai.boardgames.game;

import ai.boardgames.game.GridNeighbours.Direction;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Immutable position of an N×N "k in a row" placement game.
 *
 * <p>Two players alternately claim empty cells; the first to own {@code winLength} cells in an
 * unbroken horizontal, vertical or diagonal line wins, and a full board without a line is a draw.
 * With {@code N = k = 3} this is tic-tac-toe; larger boards give gomoku-style games.
 *
 * <p>Action ids are cell indices in row-major order, so the action space has {@code N * N} entries.
 * {@link #PLAYER_ONE} (X) always moves first.
 */
public final class ConnectGameState implements GameState {

    /** First player (X). */
    public static final int PLAYER_ONE = 1;

    /** Second player (O). */
    public static final int PLAYER_TWO = -1;

    /** No winner (game running or drawn). */
    public static final int NONE = 0;

    private static final Direction[] LINE_DIRECTIONS = {
        Direction.EAST, Direction.SOUTH, Direction.SOUTH_EAST, Direction.SOUTH_WEST
    };

    private final GridNeighbours grid;
    private final int winLength;
    private final int[] cells;
    private final int toMove;
    private final int winner;
    private final int filled;
    private final String key;

    private ConnectGameState(GridNeighbours grid, int winLength, int[] cells, int toMove, int winner, int filled) {
        this.grid = grid;
        this.winLength = winLength;
        this.cells = cells;
        this.toMove = toMove;
        this.winner = winner;
        this.filled = filled;
        this.key = buildKey(cells, toMove);
    }

    /**
     * Empty board with {@link #PLAYER_ONE} to move.
     *
     * @param grid precomputed neighbour table, which also fixes the board size
     * @param winLength number of cells in a row needed to win
     * @return the opening position
     */
    public static ConnectGameState newGame(GridNeighbours grid, int winLength) {
        validateWinLength(grid, winLength);
        return new ConnectGameState(grid, winLength, new int[grid.cellCount()], PLAYER_ONE, NONE, 0);
    }

    /**
     * Build a position from text rows using {@code X}, {@code O} and {@code .} for empty cells.
     * The player to move is derived from the piece counts.
     *
     * @throws IllegalArgumentException if the rows do not describe a reachable position
     */
    public static ConnectGameState fromRows(GridNeighbours grid, int winLength, String... rows) {
        validateWinLength(grid, winLength);
        int size = grid.size();
        if (rows.length != size) {
            throw new IllegalArgumentException("Expected " + size + " rows but got " + rows.length);
        }
        int[] cells = new int[grid.cellCount()];
        int xCount = 0;
        int oCount = 0;
        for (int row = 0; row < size; row++) {
            String line = rows[row];
            if (line.length() != size) {
                throw new IllegalArgumentException("Row " + row + " must have " + size + " cells: '" + line + "'");
            }
            for (int col = 0; col < size; col++) {
                char c = Character.toUpperCase(line.charAt(col));
                int cell = row * size + col;
                switch (c) {
                    case 'X' -> {
                        cells[cell] = PLAYER_ONE;
                        xCount++;
                    }
                    case 'O' -> {
                        cells[cell] = PLAYER_TWO;
                        oCount++;
                    }
                    case '.' -> cells[cell] = NONE;
                    default -> throw new IllegalArgumentException("Unknown cell '" + c + "' in row " + row);
                }
            }
        }
        int toMove;
        if (xCount == oCount) {
            toMove = PLAYER_ONE;
        } else if (xCount == oCount + 1) {
            toMove = PLAYER_TWO;
        } else {
            throw new IllegalArgumentException("Unreachable piece counts: X=" + xCount + ", O=" + oCount);
        }

        boolean xWins = false;
        boolean oWins = false;
        for (int cell = 0; cell < cells.length; cell++) {
            if (cells[cell] != NONE && completesLine(grid, winLength, cells, cell)) {
                if (cells[cell] == PLAYER_ONE) {
                    xWins = true;
                } else {
                    oWins = true;
                }
            }
        }
        if (xWins && oWins) {
            throw new IllegalArgumentException("Both players own a winning line");
        }
        int winner = xWins ? PLAYER_ONE : oWins ? PLAYER_TWO : NONE;
        return new ConnectGameState(grid, winLength, cells, toMove, winner, xCount + oCount);
    }

    @Override
    public int playerToMove() {
        return toMove;
    }

    @Override
    public boolean isTerminal() {
        return winner != NONE || filled == cells.length;
    }

    @Override
    public List<Integer> legalActions() {
        if (isTerminal()) {
            return Collections.emptyList();
        }
        List<Integer> actions = new ArrayList<>(cells.length - filled);
        for (int cell = 0; cell < cells.length; cell++) {
            if (cells[cell] == NONE) {
                actions.add(cell);
            }
        }
        return actions;
    }

    @Override
    public ConnectGameState applyAction(int action) {
        if (isTerminal()) {
            throw new IllegalArgumentException("Game is already over: " + key);
        }
        if (action < 0 || action >= cells.length) {
            throw new IllegalArgumentException("Action out of range: " + action);
        }
        if (cells[action] != NONE) {
            throw new IllegalArgumentException("Cell " + action + " is already occupied");
        }
        int[] next = Arrays.copyOf(cells, cells.length);
        next[action] = toMove;
        int nextWinner = completesLine(grid, winLength, next, action) ? toMove : NONE;
        return new ConnectGameState(grid, winLength, next, -toMove, nextWinner, filled + 1);
    }

    @Override
    public String key() {
        return key;
    }

    @Override
    public double terminalValue() {
        if (!isTerminal()) {
            throw new IllegalStateException("Terminal value requested for a running game: " + key);
        }
        if (winner == NONE) {
            return 0.0;
        }
        return winner == toMove ? 1.0 : -1.0;
    }

    /**
     * @return {@link #PLAYER_ONE}, {@link #PLAYER_TWO} or {@link #NONE}
     */
    public int winner() {
        return winner;
    }

    /**
     * @return owner of the cell at (row, col), or {@link #NONE}
     */
    public int cellAt(int row, int col) {
        return cells[row * grid.size() + col];
    }

    /**
     * Action id for the cell at (row, col).
     */
    public int actionAt(int row, int col) {
        return row * grid.size() + col;
    }

    public int size() {
        return grid.size();
    }

    /**
     * @return number of actions in this game's action space ({@code N * N})
     */
    public int actionSpaceSize() {
        return cells.length;
    }

    /**
     * Single-character symbol for a player id.
     */
    public static char symbol(int player) {
        if (player == PLAYER_ONE) {
            return 'X';
        }
        if (player == PLAYER_TWO) {
            return 'O';
        }
        return '.';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof ConnectGameState other)) {
            return false;
        }
        return winLength == other.winLength && key.equals(other.key);
    }

    @Override
    public int hashCode() {
        return key.hashCode();
    }

    @Override
    public String toString() {
        return key;
    }

    private static boolean completesLine(GridNeighbours grid, int winLength, int[] cells, int cell) {
        int owner = cells[cell];
        for (Direction direction : LINE_DIRECTIONS) {
            int length = 1
                    + run(grid, cells, cell, direction, owner)
                    + run(grid, cells, cell, direction.opposite(), owner);
            if (length >= winLength) {
                return true;
            }
        }
        return false;
    }

    private static int run(GridNeighbours grid, int[] cells, int from, Direction direction, int owner) {
        int count = 0;
        int cell = grid.step(from, direction);
        while (cell != GridNeighbours.OFF_BOARD && cells[cell] == owner) {
            count++;
            cell = grid.step(cell, direction);
        }
        return count;
    }

    private static void validateWinLength(GridNeighbours grid, int winLength) {
        if (winLength < 1 || winLength > grid.size()) {
            throw new IllegalArgumentException(
                    "Win length must be between 1 and " + grid.size() + ": " + winLength);
        }
    }

    private static String buildKey(int[] cells, int toMove) {
        StringBuilder sb = new StringBuilder(cells.length + 2);
        for (int cell : cells) {
            sb.append(symbol(cell));
        }
        sb.append('|').append(symbol(toMove));
        return sb.toString();
    }
}
