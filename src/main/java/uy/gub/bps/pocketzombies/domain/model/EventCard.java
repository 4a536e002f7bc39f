package uy.gub.bps.pocketzombies.domain.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import uy.gub.bps.pocketzombies.domain.exception.GameDataException;

import java.util.Map;

/**
 * A development card: one event per clock label, plus the item found when another card
 * sends the player looking for one.
 */
public record EventCard(
    @JsonProperty("item") Item item,
    @JsonProperty("events") Map<String, EventContent> events
) implements Named {

    public EventCard {
        events = Map.copyOf(events);
    }

    public EventContent contentAt(String clockLabel) {
        EventContent content = events.get(clockLabel);
        if (content == null) {
            throw new GameDataException("Card " + item + " has no event for " + clockLabel);
        }
        return content;
    }

    @Override
    public String getName() {
        return item.displayName;
    }
}
