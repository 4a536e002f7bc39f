package uy.gub.bps.pocketzombies.domain.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Random;

/**
 * Ordered stack of tiles or event cards. Draws remove from the top and the deck is never refilled.
 */
public class Deck<T extends Named> {

    private final String name;
    private final List<T> items;

    private Deck(String name, List<T> items) {
        this.name = name;
        this.items = items;
    }

    public static <T extends Named> Deck<T> shuffled(DeckConfig<T> config) {
        List<T> items = new ArrayList<>(config.items());
        Random random = config.seed() != null ? new Random(config.seed()) : new Random();
        Collections.shuffle(items, random);
        return new Deck<>(config.name(), items);
    }

    /** Keeps the given order, for decks that were shuffled upstream. */
    public static <T extends Named> Deck<T> ordered(String name, List<T> items) {
        return new Deck<>(name, new ArrayList<>(items));
    }

    public Optional<T> draw() {
        if (items.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(items.remove(0));
    }

    public Optional<T> drawByName(String itemName) {
        Iterator<T> it = items.iterator();
        while (it.hasNext()) {
            T item = it.next();
            if (item.getName().equals(itemName)) {
                it.remove();
                return Optional.of(item);
            }
        }
        return Optional.empty();
    }

    public int count() {
        return items.size();
    }

    public boolean isEmpty() {
        return items.isEmpty();
    }

    public String getName() {
        return name;
    }

    List<T> remaining() {
        return List.copyOf(items);
    }
}
