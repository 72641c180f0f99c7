package com.onthegomap.tilestate.tile;

import com.onthegomap.tilestate.config.TileStateConfig;
import com.onthegomap.tilestate.geo.GeoUtils;
import com.onthegomap.tilestate.geo.MapTransform;
import com.onthegomap.tilestate.geo.OverscaledTileId;
import com.onthegomap.tilestate.geo.Terrain;
import com.onthegomap.tilestate.geo.TileCoord;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides which resident vector tiles to keep after each update and which of them a spatial query should look at.
 * <p>
 * Tiles with symbols are held for a fade-out period after they stop being ideal so their labels can fade instead of
 * popping. While held they are only drawn by symbol layers and are skipped by queries since a tile closer to ideal
 * already covers them.
 */
public class VectorTileStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(VectorTileStrategy.class);

  // fraction of the smallest query dimension to shrink by when testing for antimeridian wrapping
  private static final double WRAP_CHECK_SHRINK = 0.001;

  /**
   * Updates the fade hold of every resident tile after a new ideal tile set was computed and returns the tiles that
   * should be removed now.
   *
   * @param tiles        resident tiles by id
   * @param retain       ids of tiles to keep this update, including parents and children kept to cover missing tiles
   * @param fadeDuration how long to hold tiles with symbols after they stop being retained
   * @param now          current reading of a monotonic clock in milliseconds
   * @return ids of the tiles the caller should remove
   */
  public List<OverscaledTileId> onFinishUpdate(Map<OverscaledTileId, Tile> tiles, Collection<OverscaledTileId> retain,
    Duration fadeDuration, long now) {
    List<OverscaledTileId> removeIds = new ArrayList<>();
    for (var entry : tiles.entrySet()) {
      OverscaledTileId id = entry.getKey();
      Tile tile = entry.getValue();

      // retained: clear the hold so the fade timer starts fresh if it is dropped again
      if (retain.contains(id)) {
        tile.clearSymbolFadeHold();
        continue;
      }

      if (!tile.hasSymbolBuckets()) {
        removeIds.add(id);
      } else if (!tile.holdingForSymbolFade()) {
        tile.setSymbolHoldDuration(fadeDuration.toMillis(), now);
      } else if (tile.symbolFadeFinished(now)) {
        LOGGER.trace("Symbol fade finished for {}", id);
        tile.clearSymbolFadeHold();
        removeIds.add(id);
      }
    }
    return removeIds;
  }

  /** Same as {@link #onFinishUpdate(Map, Collection, Duration, long)} using the configured fade duration. */
  public List<OverscaledTileId> onFinishUpdate(Map<OverscaledTileId, Tile> tiles, Collection<OverscaledTileId> retain,
    TileStateConfig config, long now) {
    return onFinishUpdate(tiles, retain, config.fadeDuration(), now);
  }

  /**
   * Returns true if {@code tile} has data and should be drawn: tiles held for a symbol fade are only drawn by symbol
   * layers so that other layers use the tile that replaced them.
   */
  public boolean isTileRenderable(Tile tile, boolean symbolLayer) {
    return tile != null && tile.hasData() && (symbolLayer || !tile.holdingForSymbolFade());
  }

  /** Returns the ids of every tile held for a symbol fade. */
  public List<OverscaledTileId> getTilesHoldingForSymbolFade(Map<OverscaledTileId, Tile> tiles) {
    List<OverscaledTileId> ids = new ArrayList<>();
    for (var entry : tiles.entrySet()) {
      if (entry.getValue().holdingForSymbolFade()) {
        ids.add(entry.getKey());
      }
    }
    return ids;
  }

  /**
   * Finds the resident tiles that a screen-space query polygon touches.
   *
   * @param tiles              resident tiles by id
   * @param queryGeometry      query polygon in screen pixels
   * @param maxPitchScaleFactor how much a pixel at the far edge of a pitched map is stretched, used to pad the query
   * @param has3DLayer         whether any queried layer is extruded, in which case the query is extended towards the
   *                           camera
   * @param transform          the current camera, or {@code null} if the map has not been laid out yet
   * @param terrain            the terrain the map is draped over, or {@code null}
   * @return matching tiles from coarsest to finest, with the query in each tile's local coordinates
   */
  public List<TileResult> tilesIn(Map<OverscaledTileId, Tile> tiles, List<Coordinate> queryGeometry,
    double maxPitchScaleFactor, boolean has3DLayer, MapTransform transform, Terrain terrain) {
    List<TileResult> tileResults = new ArrayList<>();
    if (transform == null || queryGeometry.isEmpty()) {
      return tileResults;
    }
    boolean allowWorldCopies = transform.allowWorldCopies();

    List<Coordinate> cameraPointQueryGeometry = has3DLayer ?
      transform.cameraQueryGeometry(queryGeometry) : queryGeometry;

    UnaryOperator<Coordinate> project = point -> transform.screenPointToWorld(point, terrain);
    List<Coordinate> worldQueryGeometry = transformBbox(queryGeometry, project, !allowWorldCopies);
    List<Coordinate> cameraQueryGeometry = transformBbox(cameraPointQueryGeometry, project, !allowWorldCopies);
    Envelope cameraBounds = GeoUtils.boundsOf(cameraQueryGeometry);

    List<Tile> sortedTiles = tiles.values().stream()
      .sorted((a, b) -> OverscaledTileId.COMPARATOR.compare(a.tileId(), b.tileId()))
      .toList();

    for (Tile tile : sortedTiles) {
      if (tile.holdingForSymbolFade()) {
        // a tile closer to ideal already covers tiles held for fading
        continue;
      }
      OverscaledTileId ownId = tile.tileId();
      // without world copies a query near the antimeridian can reach the tile from either side
      List<OverscaledTileId> tileIds = allowWorldCopies ? List.of(ownId) : List.of(ownId.unwrapTo(-1),
        ownId.unwrapTo(0));
      double scale = Math.pow(2, transform.zoom() - ownId.overscaledZ());
      double queryPadding = maxPitchScaleFactor * tile.queryPadding() * TileCoord.EXTENT / tile.tileSize() / scale;

      for (OverscaledTileId tileId : tileIds) {
        Envelope tileSpaceBounds = new Envelope(
          tileId.getTilePoint(new CoordinateXY(cameraBounds.getMinX(), cameraBounds.getMinY())),
          tileId.getTilePoint(new CoordinateXY(cameraBounds.getMaxX(), cameraBounds.getMaxY()))
        );
        tileSpaceBounds.expandBy(queryPadding);

        if (tileSpaceBounds.intersects(TileCoord.EXTENT_BOUNDS)) {
          tileResults.add(new TileResult(
            tile,
            allowWorldCopies ? tileId : tileId.unwrapTo(0),
            toTileSpace(tileId, worldQueryGeometry),
            toTileSpace(tileId, cameraQueryGeometry),
            scale
          ));
        }
      }
    }
    return tileResults;
  }

  private static List<Coordinate> toTileSpace(OverscaledTileId tileId, List<Coordinate> world) {
    return world.stream().map(tileId::getTilePoint).toList();
  }

  /**
   * Projects a screen-space polygon to world coordinates.
   * <p>
   * When {@code checkWrap} is set, the projection only has one world copy so a box spanning from 179°E to 179°W would
   * project to a box covering everything except what it should. That case is detected by projecting a slightly shrunk
   * copy of the box: if its projection is not inside the projected box then the box wrapped around the world, and
   * points on the eastern half are moved one world to the west.
   */
  List<Coordinate> transformBbox(List<Coordinate> geom, UnaryOperator<Coordinate> project, boolean checkWrap) {
    List<Coordinate> transformed = geom.stream().map(project).toList();
    if (checkWrap) {
      Envelope bounds = GeoUtils.boundsOf(geom);
      double shrink = Math.min(bounds.getWidth(), bounds.getHeight()) * WRAP_CHECK_SHRINK;
      bounds.expandBy(-shrink);
      // a rotated camera can put two opposite corners on the same side of the antimeridian
      Envelope projected = GeoUtils.boundsOf(GeoUtils.corners(bounds).stream().map(project).toList());
      Envelope newBounds = GeoUtils.boundsOf(transformed);

      if (!newBounds.covers(projected)) {
        transformed = transformed.stream()
          .map(coord -> coord.x > 0.5 ? new CoordinateXY(coord.x - 1, coord.y) : coord)
          .toList();
      }
    }
    return transformed;
  }
}
