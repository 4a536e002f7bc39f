package uy.gub.bps.pocketzombies.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uy.gub.bps.pocketzombies.domain.exception.InvalidDirectionException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static uy.gub.bps.pocketzombies.domain.model.Direction.EAST;
import static uy.gub.bps.pocketzombies.domain.model.Direction.NORTH;
import static uy.gub.bps.pocketzombies.domain.model.Direction.SOUTH;
import static uy.gub.bps.pocketzombies.domain.model.Direction.WEST;

@DisplayName("Tile")
class TileTest {

    @Nested
    @DisplayName("Rotation")
    class Rotation {

        @Test
        @DisplayName("Should need no turns when the entry side already faces back")
        void entryAlreadyFacingBack_noTurns() {
            assertEquals(0, Tile.rotationsFor(SOUTH, NORTH));
            assertEquals(0, Tile.rotationsFor(WEST, EAST));
            assertEquals(2, Tile.rotationsFor(NORTH, NORTH));
        }

        @Test
        @DisplayName("Should always bring the entry side round to face the room the player came from")
        void entrySideEndsOppositeTheMove() {
            for (Direction entry : Direction.values()) {
                for (Direction moved : Direction.values()) {
                    Tile tile = Tile.of("Bathroom", TileCategory.INDOOR, entry).rotate(entry, moved);
                    assertEquals(List.of(moved.opposite()), tile.possibleExits(),
                            "entry " + entry + " after moving " + moved);
                }
            }
        }

        @Test
        @DisplayName("Should turn every exit with the entry side")
        void multiExitTile_turnsAllExits() {
            Tile kitchen = Tile.of("Kitchen", TileCategory.INDOOR, NORTH, EAST, WEST);

            kitchen.rotate(EAST, NORTH);

            assertEquals(List.of(NORTH, EAST, SOUTH), kitchen.possibleExits());
            assertEquals(1, kitchen.getQuarterTurns());
        }

        @Test
        @DisplayName("Four identical rotations bring every tile back to where it started")
        void fourRotations_restoreTile() {
            for (Direction entry : Direction.values()) {
                for (Direction moved : Direction.values()) {
                    Tile tile = Tile.of("Dining Room", TileCategory.INDOOR, NORTH, EAST, SOUTH);
                    List<Direction> before = tile.possibleExits();

                    for (int i = 0; i < 4; i++) {
                        tile.rotate(entry, moved);
                    }

                    String pair = "entry " + entry + " after moving " + moved;
                    assertEquals(before, tile.possibleExits(), pair);
                    assertEquals(0, tile.getQuarterTurns(), pair);
                }
            }
        }

        @Test
        @DisplayName("Should count quarter turns modulo four")
        void quarterTurns_wrapAround() {
            Tile tile = Tile.of("Family Room", TileCategory.INDOOR, NORTH, EAST, WEST);

            tile.rotate(WEST, NORTH).rotate(EAST, NORTH);

            assertEquals(0, tile.getQuarterTurns());
            assertEquals(List.of(NORTH, EAST, WEST), tile.possibleExits());
        }
    }

    @Nested
    @DisplayName("Exits")
    class Exits {

        @Test
        @DisplayName("Should list exits in N, E, S, W order")
        void possibleExits_fixedOrder() {
            Tile tile = Tile.of("Dining Room", TileCategory.INDOOR, WEST, SOUTH, NORTH);

            assertEquals(List.of(NORTH, SOUTH, WEST), tile.possibleExits());
            assertTrue(tile.hasExit(SOUTH));
            assertFalse(tile.hasExit(EAST));
            assertFalse(tile.hasExit(null));
        }

        @Test
        @DisplayName("Should open a new exit and reject a missing direction")
        void addExit() {
            Tile tile = Tile.of("Storage", TileCategory.INDOOR, NORTH);

            tile.addExit(EAST);
            tile.addExit(EAST);

            assertEquals(List.of(NORTH, EAST), tile.possibleExits());
            assertThrows(InvalidDirectionException.class, () -> tile.addExit(null));
        }

        @Test
        @DisplayName("A view keeps the exits it was taken with")
        void view_isACopy() {
            Tile tile = Tile.of("Garden", TileCategory.OUTDOOR, NORTH, EAST, WEST);
            TileView before = tile.view();

            tile.addExit(SOUTH);

            assertEquals(List.of(NORTH, EAST, WEST), before.exits());
            assertEquals(List.of(NORTH, EAST, SOUTH, WEST), tile.view().exits());
            assertEquals(TileCategory.OUTDOOR, before.category());
            assertEquals("Garden", before.name());
        }
    }
}
