package com.onthegomap.tilestate.geo;

import static com.onthegomap.tilestate.config.TileStateConfig.MAX_MAXZOOM;

import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;

/**
 * The canonical coordinate of a <a href="https://wiki.openstreetmap.org/wiki/Slippy_map_tilenames">slippy map
 * tile</a>, independent of which copy of the world it is displayed in.
 *
 * @param x x coordinate of the tile where 0 is the western-most tile just to the east the international date line and
 *          2^z-1 is the eastern-most tile
 * @param y y coordinate of the tile where 0 is the northern-most tile and 2^z-1 is the southern-most tile
 * @param z zoom level ({@code <= 25})
 */
@Immutable
public record TileCoord(int x, int y, int z) {

  /** Number of units across a tile in tile-local coordinates. */
  public static final int EXTENT = 8192;

  /** Bounds of a tile in tile-local coordinates. */
  public static final Envelope EXTENT_BOUNDS = new Envelope(0, EXTENT, 0, EXTENT);

  public TileCoord {
    if (z < 0 || z > MAX_MAXZOOM) {
      throw new IllegalArgumentException("Invalid zoom " + z + ", must be between 0 and " + MAX_MAXZOOM);
    }
    int dim = 1 << z;
    if (x < 0 || x >= dim || y < 0 || y >= dim) {
      throw new IllegalArgumentException("x=" + x + " y=" + y + " out of range for z=" + z);
    }
  }

  public static TileCoord ofXYZ(int x, int y, int z) {
    return new TileCoord(x, y, z);
  }

  /**
   * Returns the position of a world coordinate ({@code 0..1} across the world in the first world copy) relative to the
   * top-left corner of this tile, in units where the tile spans {@link #EXTENT}.
   */
  public Coordinate getTilePoint(Coordinate world) {
    double tilesAtZoom = 1 << z;
    return new CoordinateXY(
      (world.x * tilesAtZoom - x) * EXTENT,
      (world.y * tilesAtZoom - y) * EXTENT
    );
  }

  @Override
  public String toString() {
    return "{x=" + x + " y=" + y + " z=" + z + '}';
  }
}
