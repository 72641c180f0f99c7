package com.onthegomap.tilestate.tile;

import com.onthegomap.tilestate.collection.BoundedLruCache;
import com.onthegomap.tilestate.config.TileStateConfig;
import com.onthegomap.tilestate.geo.OverscaledTileId;
import java.util.function.Consumer;
import java.util.function.Predicate;
import net.jcip.annotations.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A {@link BoundedLruCache} of tiles that are no longer displayed, keyed so that every copy of the world shares one
 * entry for the same tile.
 * <p>
 * A tile fetched for world copy -1 is just as valid for world copy 1, so the cache strips the world copy from keys and
 * re-points the returned value at the copy the caller asked for.
 *
 * @param <T> the tile payload
 */
@NotThreadSafe
public class TileCache<T extends WithTileId> {

  private static final Logger LOGGER = LoggerFactory.getLogger(TileCache.class);

  // number of zoom levels a user typically moves between while panning around one area
  private static final int COMMON_ZOOM_RANGE = 5;

  private final BoundedLruCache<OverscaledTileId, T> cache;

  /**
   * Creates a new tile cache.
   *
   * @param maxSize maximum number of tiles to hold
   * @param onEvict hook called with every tile that leaves the cache so its resources can be released, or
   *                {@code null}
   */
  public TileCache(int maxSize, Consumer<? super T> onEvict) {
    this.cache = new BoundedLruCache<>(maxSize, onEvict);
  }

  private static OverscaledTileId key(OverscaledTileId tileId) {
    return tileId.wrapped();
  }

  /**
   * Returns the tile cached for any world copy of {@code tileId}, re-pointed at {@code tileId}, or {@code null} if not
   * cached.
   */
  public T get(OverscaledTileId tileId) {
    T tile = cache.get(key(tileId));
    if (tile != null) {
      tile.setTileId(tileId);
    }
    return tile;
  }

  /** Returns true if any world copy of {@code tileId} is cached, without touching its recency. */
  public boolean has(OverscaledTileId tileId) {
    return cache.containsKey(key(tileId));
  }

  public void set(OverscaledTileId tileId, T tile) {
    cache.set(key(tileId), tile);
  }

  public void remove(OverscaledTileId tileId) {
    cache.remove(key(tileId));
  }

  public void setMaxSize(int maxSize) {
    cache.setMaxSize(maxSize);
  }

  public int maxSize() {
    return cache.maxSize();
  }

  public int size() {
    return cache.size();
  }

  public void filter(Predicate<? super T> predicate) {
    cache.filter(predicate);
  }

  public void clear() {
    cache.clear();
  }

  /**
   * Returns how many tiles to keep cached for a viewport: enough to cover the screen across a few zoom levels, capped at
   * {@code maxTileCacheSize} when it is set.
   */
  public static int viewDependentMaxSize(int width, int height, int tileSize, Integer maxTileCacheSize) {
    int widthInTiles = (int) Math.ceil((double) width / tileSize) + 1;
    int heightInTiles = (int) Math.ceil((double) height / tileSize) + 1;
    int approxTilesInView = widthInTiles * heightInTiles;
    int viewDependentMaxSize = approxTilesInView * COMMON_ZOOM_RANGE;
    return maxTileCacheSize == null ? viewDependentMaxSize : Math.min(maxTileCacheSize, viewDependentMaxSize);
  }

  /** Resizes this cache for a {@code width x height} pixel viewport using the tile size and cap from {@code config}. */
  public void updateMaxSizeForViewport(int width, int height, TileStateConfig config) {
    int maxSize = viewDependentMaxSize(width, height, config.tileSize(), config.maxTileCacheSize());
    LOGGER.trace("Sizing tile cache for {}x{} viewport to {} tiles", width, height, maxSize);
    setMaxSize(maxSize);
  }
}
