package com.onthegomap.tilestate.config;

import java.time.Duration;

/**
 * Holder for the settings a host passes to the tile and GeoJSON source lifecycle components.
 *
 * @param maxTileCacheSize upper bound on the number of tiles kept in a source's tile cache, or {@code null} to size
 *                         the cache from the viewport only
 * @param fadeDuration     how long tiles with symbols stay resident after they stop being ideal so their labels can
 *                         fade out
 * @param tileSize         size of a tile in pixels
 * @param promoteId        property to read feature ids from instead of the GeoJSON {@code id} member, or {@code null}
 */
public record TileStateConfig(
  Integer maxTileCacheSize,
  Duration fadeDuration,
  int tileSize,
  String promoteId
) {

  public static final int MAX_MAXZOOM = 25;
  private static final int DEFAULT_TILE_SIZE = 512;

  public TileStateConfig {
    if (maxTileCacheSize != null && maxTileCacheSize < 0) {
      throw new IllegalArgumentException("maxTileCacheSize must be >= 0, was " + maxTileCacheSize);
    }
    if (tileSize <= 0) {
      throw new IllegalArgumentException("tileSize must be > 0, was " + tileSize);
    }
    if (fadeDuration == null || fadeDuration.isNegative()) {
      throw new IllegalArgumentException("fadeDuration must be >= 0, was " + fadeDuration);
    }
    if (promoteId != null && promoteId.isBlank()) {
      promoteId = null;
    }
  }

  public static TileStateConfig defaults() {
    return from(Arguments.of());
  }

  public static TileStateConfig from(Arguments arguments) {
    return new TileStateConfig(
      arguments.getIntegerObject("max_tile_cache_size",
        "maximum number of tiles to cache per source, unset to size the cache from the viewport"),
      arguments.getDuration("fade_duration", "how long tiles with symbols are held so labels can fade out", "300ms"),
      arguments.getInteger("tile_size", "tile size in pixels", DEFAULT_TILE_SIZE),
      arguments.getString("promote_id", "feature property to use as the feature id", null)
    );
  }
}
