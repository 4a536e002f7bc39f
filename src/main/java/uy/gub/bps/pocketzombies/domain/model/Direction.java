package uy.gub.bps.pocketzombies.domain.model;

import uy.gub.bps.pocketzombies.domain.exception.InvalidDirectionException;

import java.util.Locale;

public enum Direction {
    NORTH('N', -1, 0),
    EAST('E', 0, 1),
    SOUTH('S', 1, 0),
    WEST('W', 0, -1);

    public final char letter;
    public final int dRow;
    public final int dCol;

    Direction(char letter, int dRow, int dCol) {
        this.letter = letter;
        this.dRow = dRow;
        this.dCol = dCol;
    }

    public Direction opposite() {
        return values()[(ordinal() + 2) % 4];
    }

    /** The direction one quarter turn clockwise from this one. */
    public Direction clockwise() {
        return values()[(ordinal() + 1) % 4];
    }

    /**
     * Accepts "N", "north", "NORTH" and so on.
     *
     * @throws InvalidDirectionException if the text names no cardinal direction
     */
    public static Direction parse(String text) {
        if (text == null || text.isBlank()) {
            throw new InvalidDirectionException(String.valueOf(text));
        }
        String value = text.trim().toUpperCase(Locale.ROOT);
        for (Direction d : values()) {
            if (value.length() == 1 ? value.charAt(0) == d.letter : value.equals(d.name())) {
                return d;
            }
        }
        throw new InvalidDirectionException(text);
    }

    @Override
    public String toString() {
        return String.valueOf(letter);
    }
}
