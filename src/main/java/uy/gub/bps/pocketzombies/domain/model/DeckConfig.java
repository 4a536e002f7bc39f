package uy.gub.bps.pocketzombies.domain.model;

import java.util.List;

/**
 * How to build a deck: its name, the cards in printed order, and the shuffle seed.
 * A null seed shuffles with a fresh random source.
 */
public record DeckConfig<T extends Named>(String name, List<T> items, Long seed) {
    public DeckConfig {
        items = List.copyOf(items);
    }
}
