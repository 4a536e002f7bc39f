package uy.gub.bps.pocketzombies.infrastructure.websocket;

import lombok.RequiredArgsConstructor;
import uy.gub.bps.pocketzombies.domain.model.GameSnapshot;
import uy.gub.bps.pocketzombies.domain.model.GameStatus;
import uy.gub.bps.pocketzombies.domain.model.TilePlacement;
import uy.gub.bps.pocketzombies.domain.service.GameObserver;

import java.util.Map;
import java.util.function.Consumer;

/**
 * Forwards engine notifications to the client as MessagePack frames.
 */
@RequiredArgsConstructor
public class SessionObserver implements GameObserver {

    private final Consumer<Map<String, Object>> sender;

    @Override
    public void onSnapshot(GameSnapshot snapshot) {
        sender.accept(Map.of("t", "SNAPSHOT", "s", snapshot));
    }

    @Override
    public void onTilePlaced(TilePlacement placement) {
        sender.accept(Map.of("t", "TILE", "tp", placement));
    }

    @Override
    public void onMessage(String message) {
        sender.accept(Map.of("t", "MESSAGE", "m", message));
    }

    @Override
    public void onGameOver(GameStatus status) {
        sender.accept(Map.of("t", "GAME_OVER", "st", status.name(), "m", status.message));
    }
}
