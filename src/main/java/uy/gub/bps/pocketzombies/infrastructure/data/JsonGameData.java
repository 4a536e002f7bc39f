package uy.gub.bps.pocketzombies.infrastructure.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import uy.gub.bps.pocketzombies.domain.exception.GameDataException;
import uy.gub.bps.pocketzombies.domain.exception.InvalidDirectionException;
import uy.gub.bps.pocketzombies.domain.model.Direction;
import uy.gub.bps.pocketzombies.domain.model.EventCard;
import uy.gub.bps.pocketzombies.domain.model.Tile;
import uy.gub.bps.pocketzombies.domain.model.TileCategory;
import uy.gub.bps.pocketzombies.domain.service.EventCardSupply;
import uy.gub.bps.pocketzombies.domain.service.TileSupply;
import uy.gub.bps.pocketzombies.infrastructure.config.GameProperties;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;

/**
 * Tile metadata and development cards read from JSON on the classpath. Everything is parsed and
 * validated once; each game then gets its own tile instances.
 */
@Slf4j
@Component
public class JsonGameData implements TileSupply, EventCardSupply {

    record TileData(String name, List<String> exits, String visual) {
    }

    private final ObjectMapper jsonMapper = new ObjectMapper();
    private final Map<TileCategory, List<TileData>> tiles;
    private final List<EventCard> eventCards;

    @Autowired
    public JsonGameData(GameProperties properties) {
        this(properties.indoorTiles(), properties.outdoorTiles(), properties.devCards());
    }

    JsonGameData(String indoorPath, String outdoorPath, String devCardsPath) {
        this.tiles = Map.of(
                TileCategory.INDOOR, loadTiles(indoorPath),
                TileCategory.OUTDOOR, loadTiles(outdoorPath));
        this.eventCards = List.copyOf(read(devCardsPath, new TypeReference<List<EventCard>>() {}));
        log.info("Loaded {} indoor tiles, {} outdoor tiles and {} development cards",
                tiles.get(TileCategory.INDOOR).size(), tiles.get(TileCategory.OUTDOOR).size(), eventCards.size());
    }

    @Override
    public List<Tile> tiles(TileCategory category) {
        List<TileData> data = tiles.get(category);
        if (data == null) {
            throw new GameDataException("No tile deck for category " + category);
        }
        return data.stream()
                .map(t -> new Tile(t.name(), t.exits().stream().map(Direction::parse).toList(), category,
                        t.visual() != null ? t.visual() : t.name()))
                .toList();
    }

    @Override
    public List<EventCard> eventCards() {
        return eventCards;
    }

    private List<TileData> loadTiles(String path) {
        List<TileData> data = read(path, new TypeReference<List<TileData>>() {});
        for (int i = 0; i < data.size(); i++) {
            TileData tile = data.get(i);
            if (tile.name() == null || tile.exits() == null || tile.exits().isEmpty()) {
                throw new GameDataException("Invalid metadata for tile " + i + " in " + path
                        + ". Make sure that each tile has a 'name' and 'exits' key.");
            }
            try {
                tile.exits().forEach(Direction::parse);
            } catch (InvalidDirectionException e) {
                throw new GameDataException("Invalid exit for tile " + tile.name() + " in " + path, e);
            }
        }
        return List.copyOf(data);
    }

    private <T> T read(String path, TypeReference<T> type) {
        ClassPathResource resource = new ClassPathResource(path);
        if (!resource.exists()) {
            throw new GameDataException("File " + path + " not found.");
        }
        try (InputStream in = resource.getInputStream()) {
            return jsonMapper.readValue(in, type);
        } catch (IOException e) {
            throw new GameDataException("Error decoding JSON from " + path + ".", e);
        }
    }
}
