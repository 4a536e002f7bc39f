package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Read-only copy of a tile for the presentation layer.
 */
public record TileView(
    @JsonProperty("n") String name,
    @JsonProperty("e") List<Direction> exits,
    @JsonProperty("k") TileCategory category,
    @JsonProperty("v") String visual,
    @JsonProperty("q") int quarterTurns
) {
    public TileView {
        exits = List.copyOf(exits);
    }
}
