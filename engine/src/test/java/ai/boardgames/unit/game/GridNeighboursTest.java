package ai.boardgames.unit.game;

import static org.junit.jupiter.api.Assertions.*;

import ai.boardgames.game.GridNeighbours;
import ai.boardgames.game.GridNeighbours.Direction;
import java.util.List;
import org.junit.jupiter.api.Test;

/**
 * Neighbour table of an N×N grid: counts per cell position, direction steps and board edges.
 */
class GridNeighboursTest {

    @Test
    void cornerEdgeAndInteriorCellsHaveExpectedNeighbourCounts() {
        GridNeighbours grid = GridNeighbours.of(4);

        assertEquals(3, grid.neighboursOf(0).size(), "Corner has three neighbours");
        assertEquals(5, grid.neighboursOf(1).size(), "Edge cell has five neighbours");
        assertEquals(8, grid.neighboursOf(5).size(), "Interior cell has eight neighbours");
        assertEquals(3, grid.neighboursOf(15).size(), "Opposite corner has three neighbours");
    }

    @Test
    void neighboursAreListedInDirectionOrder() {
        GridNeighbours grid = GridNeighbours.of(3);

        assertEquals(List.of(0, 1, 2, 3, 5, 6, 7, 8), grid.neighboursOf(4));
        assertEquals(List.of(1, 3, 4), grid.neighboursOf(0));
    }

    @Test
    void stepsFollowCompassDirections() {
        GridNeighbours grid = GridNeighbours.of(3);

        assertEquals(1, grid.step(4, Direction.NORTH));
        assertEquals(7, grid.step(4, Direction.SOUTH));
        assertEquals(3, grid.step(4, Direction.WEST));
        assertEquals(5, grid.step(4, Direction.EAST));
        assertEquals(0, grid.step(4, Direction.NORTH_WEST));
        assertEquals(8, grid.step(4, Direction.SOUTH_EAST));
        assertEquals(2, grid.step(4, Direction.NORTH_EAST));
        assertEquals(6, grid.step(4, Direction.SOUTH_WEST));
    }

    @Test
    void stepsOffTheBoardReturnMarker() {
        GridNeighbours grid = GridNeighbours.of(3);

        assertEquals(GridNeighbours.OFF_BOARD, grid.step(0, Direction.NORTH));
        assertEquals(GridNeighbours.OFF_BOARD, grid.step(0, Direction.WEST));
        assertEquals(GridNeighbours.OFF_BOARD, grid.step(2, Direction.EAST));
        assertEquals(GridNeighbours.OFF_BOARD, grid.step(6, Direction.SOUTH));
    }

    @Test
    void rowWrapIsNotTreatedAsAdjacency() {
        GridNeighbours grid = GridNeighbours.of(3);

        // Cell 2 ends row 0 and cell 3 starts row 1; they are not neighbours.
        assertFalse(grid.neighboursOf(2).contains(3));
        assertFalse(grid.neighboursOf(3).contains(2));
    }

    @Test
    void oppositeDirectionsPairUp() {
        for (Direction direction : Direction.values()) {
            assertSame(direction, direction.opposite().opposite());
            assertNotSame(direction, direction.opposite());
        }
        assertSame(Direction.SOUTH_EAST, Direction.NORTH_WEST.opposite());
        assertSame(Direction.EAST, Direction.WEST.opposite());
    }

    @Test
    void singleCellBoardHasNoNeighbours() {
        GridNeighbours grid = GridNeighbours.of(1);

        assertEquals(1, grid.cellCount());
        assertTrue(grid.neighboursOf(0).isEmpty());
    }

    @Test
    void rejectsNonPositiveSize() {
        assertThrows(IllegalArgumentException.class, () -> GridNeighbours.of(0));
    }
}
