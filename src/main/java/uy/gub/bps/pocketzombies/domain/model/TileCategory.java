package uy.gub.bps.pocketzombies.domain.model;

public enum TileCategory {
    INDOOR("Indoor"),
    OUTDOOR("Outdoor"),
    // Foyer and Patio, set aside by the board before play starts
    SPECIAL("Special");

    public final String label;

    TileCategory(String label) {
        this.label = label;
    }
}
