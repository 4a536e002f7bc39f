package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Player {
    @JsonProperty("p")
    private Coordinate location;
    @Builder.Default
    @JsonProperty("h")
    private int health = 6;
    @Builder.Default
    @JsonProperty("a")
    private int attack = 1;
    @Builder.Default
    @JsonProperty("it")
    private List<Item> items = new ArrayList<>();
    @Builder.Default
    private int itemCapacity = 2;
    @JsonProperty("tt")
    private boolean carryingTotem;

    public void heal(int amount) {
        health += amount;
    }

    public void takeDamage(int amount) {
        health -= amount;
    }

    public boolean isDead() {
        return health <= 0;
    }

    public boolean hasRoomForItem() {
        return items.size() < itemCapacity;
    }

    public boolean hasItem(Item item) {
        return items.contains(item);
    }

    /** Adds the item and applies its pickup effects. */
    public void pickUp(Item item) {
        items.add(item);
        attack += item.attackBonus;
        health += item.healthBonus;
    }

    /** Removes the item; a discarded weapon takes its attack bonus with it. */
    public boolean discard(Item item) {
        if (!items.remove(item)) {
            return false;
        }
        attack -= item.attackBonus;
        return true;
    }

    public String getDetails() {
        return "Location: " + location
                + ", Health: " + health
                + ", Attack: " + attack
                + ", Items: " + items
                + (carryingTotem ? ", carrying the Totem" : "");
    }
}
