package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Everything the presentation layer shows after an action.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameSnapshot {
    @JsonProperty("dc")
    private int devCardsLeft;
    @JsonProperty("tm")
    private String time;
    @JsonProperty("it")
    private int indoorTilesLeft;
    @JsonProperty("ot")
    private int outdoorTilesLeft;
    @JsonProperty("h")
    private int health;
    @JsonProperty("a")
    private int attack;
    @JsonProperty("i")
    private List<Item> items;
    @JsonProperty("p")
    private Coordinate location;
    @JsonProperty("tt")
    private boolean carryingTotem;
    @JsonProperty("st")
    private GameStatus status;
}
