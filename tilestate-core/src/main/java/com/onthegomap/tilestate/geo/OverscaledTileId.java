package com.onthegomap.tilestate.geo;

import java.util.Comparator;
import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;

/**
 * Identifies a tile as it is displayed: a canonical {@link TileCoord}, the zoom level it is displayed at (which can be
 * greater than the canonical zoom when a tile is stretched past the source's max zoom) and which copy of the world it
 * is displayed in.
 *
 * @param overscaledZ zoom level the tile is displayed at, never less than {@code canonical.z()}
 * @param wrap        which copy of the world the tile is in, 0 is the primary copy, -1 is to the west, 1 to the east
 * @param canonical   the tile that holds the data
 */
@Immutable
public record OverscaledTileId(int overscaledZ, int wrap, TileCoord canonical) {

  /**
   * Orders tiles so that lower zoom levels come before higher ones, then interleaves world copies (0, -1, 1, -2 ...)
   * from the outside in, and within a zoom level and world copy sorts from the south-east corner.
   * <p>
   * Iterating in this order visits coarser tiles before the finer tiles drawn on top of them.
   */
  public static final Comparator<OverscaledTileId> COMPARATOR = (a, b) -> {
    int result = Integer.compare(a.overscaledZ, b.overscaledZ);
    if (result == 0) {
      result = Integer.compare(wrapRank(b.wrap), wrapRank(a.wrap));
    }
    if (result == 0) {
      result = Integer.compare(b.canonical.y(), a.canonical.y());
    }
    if (result == 0) {
      result = Integer.compare(b.canonical.x(), a.canonical.x());
    }
    if (result == 0) {
      result = Integer.compare(a.canonical.z(), b.canonical.z());
    }
    return result;
  };

  public OverscaledTileId {
    if (canonical == null) {
      throw new IllegalArgumentException("canonical tile is required");
    }
    if (overscaledZ < canonical.z()) {
      throw new IllegalArgumentException(
        "overscaledZ " + overscaledZ + " must be >= canonical zoom " + canonical.z());
    }
  }

  public static OverscaledTileId of(int overscaledZ, int wrap, int z, int x, int y) {
    return new OverscaledTileId(overscaledZ, wrap, TileCoord.ofXYZ(x, y, z));
  }

  /** Returns the tile at {@code z/x/y} in the primary world copy, not overscaled. */
  public static OverscaledTileId of(int z, int x, int y) {
    return of(z, 0, z, x, y);
  }

  private static int wrapRank(int wrap) {
    return Math.abs(wrap * 2) - (wrap < 0 ? 1 : 0);
  }

  /** Returns this tile moved to world copy {@code newWrap}. */
  public OverscaledTileId unwrapTo(int newWrap) {
    return newWrap == wrap ? this : new OverscaledTileId(overscaledZ, newWrap, canonical);
  }

  /** Returns this tile moved to the primary world copy so it shares a key with the same tile in every other copy. */
  public OverscaledTileId wrapped() {
    return unwrapTo(0);
  }

  /**
   * Returns the position of {@code world}, a web mercator coordinate where the primary world copy spans {@code 0..1},
   * relative to the top-left corner of this tile in tile-local units (0..{@link TileCoord#EXTENT}).
   */
  public Coordinate getTilePoint(Coordinate world) {
    return canonical.getTilePoint(new CoordinateXY(world.x - wrap, world.y));
  }

  @Override
  public String toString() {
    return "{z=" + overscaledZ + " wrap=" + wrap + " canonical=" + canonical + '}';
  }
}
