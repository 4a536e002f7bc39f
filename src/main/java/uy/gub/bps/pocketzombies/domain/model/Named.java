package uy.gub.bps.pocketzombies.domain.model;

/**
 * Anything a {@link Deck} can hand out by name.
 */
public interface Named {
    String getName();
}
