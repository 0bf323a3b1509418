package ai.boardgames.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.boardgames.game.ConnectGameState;
import ai.boardgames.game.GridNeighbours;
import ai.boardgames.unit.helpers.PositionFactory;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Rules of the N×N k-in-a-row game.
 *
 * <ul>
 *   <li>turn order and legal actions
 *   <li>win detection in every line direction, draws and terminal values
 *   <li>transpositions share a key
 *   <li>illegal actions and malformed positions are rejected
 * </ul>
 */
class ConnectGameStateTest {

    @Nested
    @DisplayName("turns and actions")
    class TurnTests {

        @Test
        void newGameHasEveryCellLegalAndXToMove() {
            ConnectGameState state = PositionFactory.emptyTicTacToe();

            assertEquals(ConnectGameState.PLAYER_ONE, state.playerToMove());
            assertEquals(List.of(0, 1, 2, 3, 4, 5, 6, 7, 8), state.legalActions());
            assertFalse(state.isTerminal());
            assertEquals(9, state.actionSpaceSize());
        }

        @Test
        void applyActionAlternatesPlayersAndLeavesReceiverUntouched() {
            ConnectGameState start = PositionFactory.emptyTicTacToe();
            ConnectGameState next = start.applyAction(4);

            assertEquals(ConnectGameState.PLAYER_TWO, next.playerToMove());
            assertEquals(ConnectGameState.PLAYER_ONE, next.cellAt(1, 1));
            assertFalse(next.legalActions().contains(4));
            assertEquals(ConnectGameState.NONE, start.cellAt(1, 1), "Original state must not change");
            assertEquals(9, start.legalActions().size());
        }

        @Test
        void fromRowsDerivesPlayerToMove() {
            assertEquals(ConnectGameState.PLAYER_TWO, PositionFactory.ticTacToe("X..", "...", "...").playerToMove());
            assertEquals(ConnectGameState.PLAYER_ONE, PositionFactory.ticTacToe("XO.", "...", "...").playerToMove());
        }
    }

    @Nested
    @DisplayName("results")
    class ResultTests {

        @Test
        void rowWinEndsGameWithLossForPlayerToMove() {
            ConnectGameState state = PositionFactory.xHasWon();

            assertTrue(state.isTerminal());
            assertEquals(ConnectGameState.PLAYER_ONE, state.winner());
            assertEquals(ConnectGameState.PLAYER_TWO, state.playerToMove());
            assertEquals(-1.0, state.terminalValue());
            assertTrue(state.legalActions().isEmpty());
        }

        @Test
        void columnWinIsDetectedOnTheCompletingMove() {
            ConnectGameState state = PositionFactory.ticTacToe(
                    "XO.",
                    "XO.",
                    "...");
            ConnectGameState after = state.applyAction(6);

            assertTrue(after.isTerminal());
            assertEquals(ConnectGameState.PLAYER_ONE, after.winner());
        }

        @Test
        void diagonalAndAntiDiagonalWinsAreDetected() {
            ConnectGameState diagonal = PositionFactory.ticTacToe(
                    "XO.",
                    "OX.",
                    "...").applyAction(8);
            ConnectGameState antiDiagonal = PositionFactory.ticTacToe(
                    "XXO",
                    "XO.",
                    "...").applyAction(6);

            assertEquals(ConnectGameState.PLAYER_ONE, diagonal.winner());
            assertEquals(ConnectGameState.PLAYER_TWO, antiDiagonal.winner());
        }

        @Test
        void winCompletedInTheMiddleOfALineIsDetected() {
            ConnectGameState state = PositionFactory.ticTacToe(
                    "X.X",
                    "OO.",
                    "...").applyAction(1);

            assertEquals(ConnectGameState.PLAYER_ONE, state.winner());
        }

        @Test
        void fullBoardWithoutLineIsDraw() {
            ConnectGameState state = PositionFactory.singleLegalAction().applyAction(8);

            assertTrue(state.isTerminal());
            assertEquals(ConnectGameState.NONE, state.winner());
            assertEquals(0.0, state.terminalValue());
        }

        @Test
        void terminalValueOfRunningGameIsRejected() {
            assertThrows(IllegalStateException.class, () -> PositionFactory.emptyTicTacToe().terminalValue());
        }

        @Test
        void longerBoardsNeedTheConfiguredWinLength() {
            ConnectGameState state = ConnectGameState.fromRows(GridNeighbours.of(5), 4,
                    "XXX..",
                    "OOO..",
                    ".....",
                    ".....",
                    ".....");

            assertFalse(state.isTerminal(), "Three in a row is not enough when four are required");
            assertEquals(ConnectGameState.PLAYER_ONE, state.applyAction(3).winner());
        }
    }

    @Nested
    @DisplayName("keys")
    class KeyTests {

        @Test
        void transposedMoveOrdersShareAKey() {
            ConnectGameState start = PositionFactory.emptyTicTacToe();
            ConnectGameState first = start.applyAction(0).applyAction(4).applyAction(8);
            ConnectGameState second = start.applyAction(8).applyAction(4).applyAction(0);

            assertEquals(first.key(), second.key());
            assertEquals(first, second);
        }

        @Test
        void differentPositionsHaveDifferentKeys() {
            ConnectGameState start = PositionFactory.emptyTicTacToe();

            assertNotEquals(start.applyAction(0).key(), start.applyAction(1).key());
            assertNotEquals(start.key(), start.applyAction(0).key());
        }
    }

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        void occupiedCellIsRejected() {
            ConnectGameState state = PositionFactory.emptyTicTacToe().applyAction(0);

            assertThrows(IllegalArgumentException.class, () -> state.applyAction(0));
        }

        @Test
        void outOfRangeActionIsRejected() {
            ConnectGameState state = PositionFactory.emptyTicTacToe();

            assertThrows(IllegalArgumentException.class, () -> state.applyAction(-1));
            assertThrows(IllegalArgumentException.class, () -> state.applyAction(9));
        }

        @Test
        void moveAfterGameOverIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> PositionFactory.xHasWon().applyAction(5));
        }

        @Test
        void malformedRowsAreRejected() {
            assertThrows(IllegalArgumentException.class, () -> PositionFactory.ticTacToe("XX.", "..."));
            assertThrows(IllegalArgumentException.class, () -> PositionFactory.ticTacToe("XX", "...", "..."));
            assertThrows(IllegalArgumentException.class, () -> PositionFactory.ticTacToe("XZ.", "...", "..."));
            assertThrows(IllegalArgumentException.class, () -> PositionFactory.ticTacToe("XXX", "...", "..."),
                    "X cannot be two pieces ahead");
            assertThrows(IllegalArgumentException.class, () -> PositionFactory.ticTacToe("XXX", "OOO", "X.."),
                    "Both players cannot own a line");
        }

        @Test
        void winLengthLongerThanBoardIsRejected() {
            assertThrows(IllegalArgumentException.class,
                    () -> ConnectGameState.newGame(PositionFactory.GRID_3, 4));
        }
    }
}
