package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TilePlacement(
    @JsonProperty("t") TileView tile,
    @JsonProperty("p") Coordinate coordinate
) {
}
