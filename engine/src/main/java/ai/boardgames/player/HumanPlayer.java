package ai.boardgames.player;

import ai.boardgames.config.BoardProperties;
import ai.boardgames.game.GameState;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

/**
 * Human player that reads {@code row col} coordinates from stdin (CLI).
 */
@Component("opponent")
@Profile("ai-human")
public class HumanPlayer implements Player {
    private final BufferedReader reader;
    private final PrintStream out;
    private final int size;

    @Autowired
    public HumanPlayer(BoardProperties board) {
        this(System.in, System.out, board.getSize());
    }

    public HumanPlayer(InputStream in, PrintStream out, int size) {
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.size = size;
    }

    @Override
    public int nextAction(GameState state) {
        List<Integer> legal = state.legalActions();
        while (true) {
            out.print("Enter move (row col | quit): ");
            String line;
            try {
                line = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to read move from console", e);
            }
            if (line == null || line.trim().equalsIgnoreCase("quit")) {
                return NO_ACTION;
            }
            int action = parse(line);
            if (action != NO_ACTION && legal.contains(action)) {
                return action;
            }
            out.println("Illegal move: '" + line.trim() + "'");
        }
    }

    /**
     * Parses {@code "row col"} into an action id.
     *
     * @return the action id, or {@link #NO_ACTION} when the input is malformed or off the board
     */
    int parse(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length != 2) {
            return NO_ACTION;
        }
        try {
            int row = Integer.parseInt(parts[0]);
            int col = Integer.parseInt(parts[1]);
            if (row < 0 || row >= size || col < 0 || col >= size) {
                return NO_ACTION;
            }
            return row * size + col;
        } catch (NumberFormatException e) {
            return NO_ACTION;
        }
    }
}
