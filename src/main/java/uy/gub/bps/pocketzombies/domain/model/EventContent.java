package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * What a development card does at one hour of the night.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = EventContent.ZombieEncounter.class, name = "ZOMBIES"),
        @JsonSubTypes.Type(value = EventContent.ItemFind.class, name = "ITEM"),
        @JsonSubTypes.Type(value = EventContent.HealthChange.class, name = "HEALTH")
})
public sealed interface EventContent {

    String text();

    record ZombieEncounter(@JsonProperty("text") String text,
                           @JsonProperty("zombies") int zombies) implements EventContent {
    }

    record ItemFind(@JsonProperty("text") String text) implements EventContent {
    }

    record HealthChange(@JsonProperty("text") String text,
                        @JsonProperty("delta") int delta) implements EventContent {
    }
}
