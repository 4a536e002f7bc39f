package uy.gub.bps.pocketzombies.domain.model;

import uy.gub.bps.pocketzombies.domain.exception.GameDataException;

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * The explored map plus everything still face down: both room decks, the development cards and the clock.
 */
public class Board {

    public static final String FOYER = "Foyer";
    public static final String PATIO = "Patio";

    // Which deck a set-aside room opens onto
    private static final Map<String, TileCategory> SPECIAL_NEIGHBOURS = Map.of(
            FOYER, TileCategory.INDOOR,
            PATIO, TileCategory.OUTDOOR
    );

    public record TileDraw(Optional<Tile> tile, TileCategory category) {
    }

    private final Map<Coordinate, Tile> tileMap = new HashMap<>();
    private final Deck<Tile> indoorTiles;
    private final Deck<Tile> outdoorTiles;
    private final Supplier<Deck<EventCard>> eventDeckFactory;
    private final List<String> clock;
    private final Tile foyer;
    private Tile patio;
    private Deck<EventCard> devCards;
    private int hour;

    public Board(Coordinate start,
                 Deck<Tile> indoorTiles,
                 Deck<Tile> outdoorTiles,
                 Supplier<Deck<EventCard>> eventDeckFactory,
                 List<String> clock) {
        if (clock == null || clock.isEmpty()) {
            throw new GameDataException("The clock needs at least one hour");
        }
        this.indoorTiles = indoorTiles;
        this.outdoorTiles = outdoorTiles;
        this.eventDeckFactory = eventDeckFactory;
        this.clock = List.copyOf(clock);
        this.devCards = eventDeckFactory.get();

        this.foyer = indoorTiles.drawByName(FOYER)
                .orElseThrow(() -> new GameDataException("Indoor deck has no " + FOYER));
        this.foyer.setCategory(TileCategory.SPECIAL);
        this.patio = outdoorTiles.drawByName(PATIO).orElse(null);
        if (patio != null) {
            patio.setCategory(TileCategory.SPECIAL);
        }
        place(start, foyer);
    }

    public boolean isExplored(Coordinate coordinate) {
        return tileMap.containsKey(coordinate);
    }

    /** The placed tile, or null when the coordinate is unexplored. */
    public Tile getTile(Coordinate coordinate) {
        return tileMap.get(coordinate);
    }

    public void place(Coordinate coordinate, Tile tile) {
        tileMap.put(coordinate, tile);
    }

    public Map<Coordinate, Tile> getTileMap() {
        return Collections.unmodifiableMap(tileMap);
    }

    /**
     * Draws the room behind a door of {@code fromRoom}. Outdoor rooms and the Patio open onto
     * the outdoor deck, every other room onto the indoor deck.
     */
    public TileDraw drawTile(Tile fromRoom) {
        TileCategory category = neighbourCategory(fromRoom);
        Deck<Tile> deck = category == TileCategory.OUTDOOR ? outdoorTiles : indoorTiles;
        return new TileDraw(deck.draw(), category);
    }

    static TileCategory neighbourCategory(Tile room) {
        return switch (room.getCategory()) {
            case OUTDOOR -> TileCategory.OUTDOOR;
            case INDOOR -> TileCategory.INDOOR;
            case SPECIAL -> SPECIAL_NEIGHBOURS.getOrDefault(room.getName(), TileCategory.INDOOR);
        };
    }

    public Optional<EventCard> drawDevCard() {
        return devCards.draw();
    }

    /**
     * Moves the clock on one hour and deals a fresh pass of development cards.
     * Does nothing once the last hour has been reached.
     */
    public void updateTime() {
        if (isLastHour()) {
            return;
        }
        hour++;
        devCards = eventDeckFactory.get();
    }

    public boolean isLastHour() {
        return hour == clock.size() - 1;
    }

    public String getTime() {
        return clock.get(hour);
    }

    public int getDevCardCount() {
        return devCards.count();
    }

    public int getIndoorTileCount() {
        return indoorTiles.count();
    }

    public int getOutdoorTileCount() {
        return outdoorTiles.count();
    }

    public Tile getFoyer() {
        return foyer;
    }

    /** Hands over the Patio set aside for the Dining Room; empty once taken or if this tile set has none. */
    public Optional<Tile> takePatio() {
        Optional<Tile> taken = Optional.ofNullable(patio);
        patio = null;
        return taken;
    }
}
