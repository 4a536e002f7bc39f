package uy.gub.bps.pocketzombies.domain.service;

import uy.gub.bps.pocketzombies.domain.model.GameSnapshot;
import uy.gub.bps.pocketzombies.domain.model.GameStatus;
import uy.gub.bps.pocketzombies.domain.model.TilePlacement;

/**
 * Receives state changes from the engine. Observers only read what they are given.
 */
public interface GameObserver {
    void onSnapshot(GameSnapshot snapshot);

    void onTilePlaced(TilePlacement placement);

    default void onMessage(String message) {
    }

    default void onGameOver(GameStatus status) {
    }
}
