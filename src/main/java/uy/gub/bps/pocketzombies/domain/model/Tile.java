package uy.gub.bps.pocketzombies.domain.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.ToString;
import uy.gub.bps.pocketzombies.domain.exception.InvalidDirectionException;

import java.util.Arrays;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * A room on the board. Exits are mutated in place when the tile is rotated or a wall is bashed,
 * so a tile belongs to exactly one board cell once placed. Observers only ever get a {@link TileView}.
 */
@Getter
@ToString
public class Tile implements Named {

    // Quarter turns needed, indexed [exit][entry] in N, E, S, W order.
    // The entry side must end up opposite the direction the player moved (exit).
    private static final int[][] ROTATIONS = {
            {2, 1, 0, 3}, // moved N
            {3, 2, 1, 0}, // moved E
            {0, 3, 2, 1}, // moved S
            {1, 0, 3, 2}  // moved W
    };

    private final String name;
    @Getter(AccessLevel.NONE)
    private final Map<Direction, Boolean> exits = new EnumMap<>(Direction.class);
    private TileCategory category;
    private final String visual;
    private int quarterTurns;

    public Tile(String name, Collection<Direction> openExits, TileCategory category, String visual) {
        this.name = name;
        this.category = category;
        this.visual = visual;
        for (Direction d : Direction.values()) {
            exits.put(d, openExits.contains(d));
        }
    }

    public static Tile of(String name, TileCategory category, Direction... openExits) {
        return new Tile(name, Arrays.asList(openExits), category, name);
    }

    public static int rotationsFor(Direction entry, Direction exit) {
        return ROTATIONS[exit.ordinal()][entry.ordinal()];
    }

    public List<Direction> possibleExits() {
        return exits.entrySet().stream()
                .filter(Map.Entry::getValue)
                .map(Map.Entry::getKey)
                .toList();
    }

    public boolean hasExit(Direction direction) {
        return direction != null && exits.get(direction);
    }

    public void addExit(Direction direction) {
        if (direction == null) {
            throw new InvalidDirectionException("null");
        }
        exits.put(direction, true);
    }

    /**
     * Turns the tile so that the side currently called {@code entry} faces back toward
     * the room the player came from, having moved in direction {@code exit}.
     *
     * @return this tile
     */
    public Tile rotate(Direction entry, Direction exit) {
        int turns = rotationsFor(entry, exit);
        for (int i = 0; i < turns; i++) {
            turnClockwise();
        }
        return this;
    }

    private void turnClockwise() {
        Map<Direction, Boolean> previous = new EnumMap<>(exits);
        for (Direction d : Direction.values()) {
            exits.put(d.clockwise(), previous.get(d));
        }
        quarterTurns = (quarterTurns + 1) % 4;
    }

    void setCategory(TileCategory category) {
        this.category = category;
    }

    public TileView view() {
        return new TileView(name, possibleExits(), category, visual, quarterTurns);
    }
}
