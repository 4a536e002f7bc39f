package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import uy.gub.bps.pocketzombies.domain.exception.GameDataException;

public enum Item {
    OIL("Oil", 0, 0, true),
    GASOLINE("Gasoline", 0, 0, false),
    BOARD_WITH_NAILS("Board with Nails", 1, 0, false),
    MACHETE("Machete", 2, 0, false),
    GRISLY_FEMUR("Grisly Femur", 1, 0, false),
    GOLF_CLUB("Golf Club", 1, 0, false),
    CHAINSAW("Chainsaw", 3, 0, false),
    SODA_CAN("Soda Can", 0, 2, false),
    CANDLE("Candle", 0, 0, false);

    public final String displayName;
    public final int attackBonus;
    // applied once, when picked up
    public final int healthBonus;
    // consumed instead of losing health when running from zombies
    public final boolean coversEscape;

    Item(String displayName, int attackBonus, int healthBonus, boolean coversEscape) {
        this.displayName = displayName;
        this.attackBonus = attackBonus;
        this.healthBonus = healthBonus;
        this.coversEscape = coversEscape;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    @JsonCreator
    public static Item fromName(String name) {
        for (Item item : values()) {
            if (item.displayName.equalsIgnoreCase(name) || item.name().equalsIgnoreCase(name)) {
                return item;
            }
        }
        throw new GameDataException("Unknown item: " + name);
    }

    @Override
    public String toString() {
        return displayName;
    }
}
