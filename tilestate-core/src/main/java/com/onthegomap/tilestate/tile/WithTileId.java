package com.onthegomap.tilestate.tile;

import com.onthegomap.tilestate.geo.OverscaledTileId;

/**
 * A value that knows which tile it belongs to, and can be re-pointed at another copy of the same tile.
 */
public interface WithTileId {

  OverscaledTileId tileId();

  void setTileId(OverscaledTileId tileId);
}
