package uy.gub.bps.pocketzombies.domain.service;

import uy.gub.bps.pocketzombies.domain.model.Tile;
import uy.gub.bps.pocketzombies.domain.model.TileCategory;

import java.util.List;

public interface TileSupply {
    /** Fresh tile instances for one game, in printed order. */
    List<Tile> tiles(TileCategory category);
}
