package uy.gub.bps.pocketzombies.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Deck")
class DeckTest {

    private static List<Tile> rooms() {
        return List.of(
                Tile.of("Foyer", TileCategory.INDOOR, Direction.NORTH),
                Tile.of("Bathroom", TileCategory.INDOOR, Direction.NORTH),
                Tile.of("Kitchen", TileCategory.INDOOR, Direction.NORTH, Direction.EAST, Direction.WEST),
                Tile.of("Storage", TileCategory.INDOOR, Direction.NORTH),
                Tile.of("Bedroom", TileCategory.INDOOR, Direction.NORTH, Direction.WEST));
    }

    @Test
    @DisplayName("Should draw from the top until empty and never refill")
    void draw_removesFromTop() {
        Deck<Tile> deck = Deck.ordered("Indoor", rooms());

        assertEquals("Foyer", deck.draw().orElseThrow().getName());
        assertEquals(4, deck.count());
        for (int i = 0; i < 4; i++) {
            assertTrue(deck.draw().isPresent());
        }

        assertTrue(deck.isEmpty());
        assertTrue(deck.draw().isEmpty());
        assertEquals(0, deck.count());
    }

    @Test
    @DisplayName("Should pull a named card out of the middle of the deck")
    void drawByName_removesOnlyThatCard() {
        Deck<Tile> deck = Deck.ordered("Indoor", rooms());

        assertEquals("Kitchen", deck.drawByName("Kitchen").orElseThrow().getName());
        assertTrue(deck.drawByName("Kitchen").isEmpty());
        assertEquals(List.of("Foyer", "Bathroom", "Storage", "Bedroom"),
                deck.remaining().stream().map(Tile::getName).toList());
    }

    @Test
    @DisplayName("Should shuffle the same way for the same seed")
    void shuffled_isReproducibleWithSeed() {
        Deck<Tile> first = Deck.shuffled(new DeckConfig<>("Indoor", rooms(), 42L));
        Deck<Tile> second = Deck.shuffled(new DeckConfig<>("Indoor", rooms(), 42L));

        assertEquals(names(first), names(second));
        assertEquals(5, first.count());
        assertEquals("Indoor", first.getName());
    }

    @Test
    @DisplayName("Should keep every card when shuffling without a seed")
    void shuffled_keepsAllCards() {
        Deck<Tile> deck = Deck.shuffled(new DeckConfig<>("Indoor", rooms(), null));

        assertEquals(List.of("Bathroom", "Bedroom", "Foyer", "Kitchen", "Storage"),
                names(deck).stream().sorted().toList());
    }

    private static List<String> names(Deck<Tile> deck) {
        return deck.remaining().stream().map(Tile::getName).toList();
    }
}
