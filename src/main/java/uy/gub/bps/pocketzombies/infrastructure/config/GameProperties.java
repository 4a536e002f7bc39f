package uy.gub.bps.pocketzombies.infrastructure.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.util.List;

/**
 * Settings for new games, bound from the {@code game.*} keys.
 *
 * @param seed shuffle seed for every deck; leave unset for a different game each time
 */
@ConfigurationProperties(prefix = "game")
public record GameProperties(
    @DefaultValue("3") int startRow,
    @DefaultValue("3") int startCol,
    @DefaultValue("7") int boardSize,
    @DefaultValue({"9 PM", "10 PM", "11 PM"}) List<String> clock,
    @DefaultValue("6") int startHealth,
    @DefaultValue("1") int startAttack,
    @DefaultValue("2") int itemCapacity,
    @DefaultValue("data/indoor_tiles.json") String indoorTiles,
    @DefaultValue("data/outdoor_tiles.json") String outdoorTiles,
    @DefaultValue("data/dev_cards.json") String devCards,
    Long seed
) {
}
