package uy.gub.bps.pocketzombies.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import uy.gub.bps.pocketzombies.domain.exception.InvalidDirectionException;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Direction")
class DirectionTest {

    @Test
    @DisplayName("Should parse letters and names in any case")
    void parse_acceptsLettersAndNames() {
        assertEquals(Direction.NORTH, Direction.parse("N"));
        assertEquals(Direction.EAST, Direction.parse("e"));
        assertEquals(Direction.SOUTH, Direction.parse(" south "));
        assertEquals(Direction.WEST, Direction.parse("West"));
    }

    @Test
    @DisplayName("Should reject anything that is not a cardinal direction")
    void parse_rejectsUnknownText() {
        InvalidDirectionException e = assertThrows(InvalidDirectionException.class, () -> Direction.parse("up"));
        assertEquals("up is not a valid exit direction", e.getMessage());
        assertThrows(InvalidDirectionException.class, () -> Direction.parse("X"));
        assertThrows(InvalidDirectionException.class, () -> Direction.parse(""));
        assertThrows(InvalidDirectionException.class, () -> Direction.parse(null));
    }

    @Test
    @DisplayName("Opposite and clockwise neighbours")
    void oppositeAndClockwise() {
        assertEquals(Direction.SOUTH, Direction.NORTH.opposite());
        assertEquals(Direction.WEST, Direction.EAST.opposite());
        assertEquals(Direction.EAST, Direction.NORTH.clockwise());
        assertEquals(Direction.NORTH, Direction.WEST.clockwise());
    }

    @Test
    @DisplayName("Stepping north decreases the row, stepping east increases the column")
    void coordinateStep() {
        Coordinate start = new Coordinate(3, 3);

        assertEquals(new Coordinate(2, 3), start.step(Direction.NORTH));
        assertEquals(new Coordinate(3, 4), start.step(Direction.EAST));
        assertEquals(new Coordinate(4, 3), start.step(Direction.SOUTH));
        assertEquals(new Coordinate(3, 2), start.step(Direction.WEST));
        assertEquals("(3, 3)", start.toString());
    }
}
