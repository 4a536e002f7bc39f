package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record Coordinate(@JsonProperty("r") int row, @JsonProperty("c") int col) {
    public Coordinate step(Direction direction) {
        return new Coordinate(row + direction.dRow, col + direction.dCol);
    }

    @Override
    public String toString() {
        return "(" + row + ", " + col + ")";
    }
}
