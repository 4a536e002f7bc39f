package uy.gub.bps.pocketzombies.infrastructure.config;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uy.gub.bps.pocketzombies.domain.model.Board;
import uy.gub.bps.pocketzombies.domain.model.Coordinate;
import uy.gub.bps.pocketzombies.domain.model.Deck;
import uy.gub.bps.pocketzombies.domain.model.DeckConfig;
import uy.gub.bps.pocketzombies.domain.model.EventCard;
import uy.gub.bps.pocketzombies.domain.model.Player;
import uy.gub.bps.pocketzombies.domain.model.Tile;
import uy.gub.bps.pocketzombies.domain.model.TileCategory;
import uy.gub.bps.pocketzombies.domain.service.ChoiceProvider;
import uy.gub.bps.pocketzombies.domain.service.EventCardSupply;
import uy.gub.bps.pocketzombies.domain.service.GameEngine;
import uy.gub.bps.pocketzombies.domain.service.GameEngineImpl;
import uy.gub.bps.pocketzombies.domain.service.TileSupply;

import java.util.Random;
import java.util.function.Supplier;

/**
 * Deals a new game: shuffled decks, the board with the Foyer in place and a fresh player.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class GameFactory {

    private final GameProperties properties;
    private final TileSupply tileSupply;
    private final EventCardSupply eventCardSupply;

    public GameEngine newGame(ChoiceProvider choices) {
        // One seed per deck, derived from the configured one so a seeded game replays exactly
        Random seeds = properties.seed() != null ? new Random(properties.seed()) : null;

        Deck<Tile> indoor = Deck.shuffled(new DeckConfig<>(TileCategory.INDOOR.label,
                tileSupply.tiles(TileCategory.INDOOR), nextSeed(seeds)));
        Deck<Tile> outdoor = Deck.shuffled(new DeckConfig<>(TileCategory.OUTDOOR.label,
                tileSupply.tiles(TileCategory.OUTDOOR), nextSeed(seeds)));
        Supplier<Deck<EventCard>> devCards = () -> Deck.shuffled(new DeckConfig<>("Development",
                eventCardSupply.eventCards(), nextSeed(seeds)));

        Coordinate start = new Coordinate(properties.startRow(), properties.startCol());
        Board board = new Board(start, indoor, outdoor, devCards, properties.clock());
        Player player = Player.builder()
                .location(start)
                .health(properties.startHealth())
                .attack(properties.startAttack())
                .itemCapacity(properties.itemCapacity())
                .build();

        log.info("New game dealt: {} indoor tiles, {} outdoor tiles, {} development cards, starting at {}",
                board.getIndoorTileCount(), board.getOutdoorTileCount(), board.getDevCardCount(), board.getTime());
        return new GameEngineImpl(board, player, choices);
    }

    /** Grid size the client draws; the board itself is unbounded. */
    public int boardSize() {
        return properties.boardSize();
    }

    private static Long nextSeed(Random seeds) {
        return seeds != null ? seeds.nextLong() : null;
    }
}
