package com.onthegomap.tilestate.tile;

import com.onthegomap.tilestate.geo.OverscaledTileId;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;

/**
 * A resident tile that intersects a spatial query, with the query transformed into the tile's local coordinates.
 *
 * @param tile                the matching tile
 * @param tileId              the world copy of the tile that matched
 * @param queryGeometry       the query polygon in tile-local units
 * @param cameraQueryGeometry the query polygon extended towards the camera, in tile-local units
 * @param scale               how many times the tile is magnified at the current zoom
 */
public record TileResult(
  Tile tile,
  OverscaledTileId tileId,
  List<Coordinate> queryGeometry,
  List<Coordinate> cameraQueryGeometry,
  double scale
) {}
