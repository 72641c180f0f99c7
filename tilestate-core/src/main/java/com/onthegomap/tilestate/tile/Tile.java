package com.onthegomap.tilestate.tile;

import com.onthegomap.tilestate.geo.OverscaledTileId;
import java.util.Objects;
import net.jcip.annotations.NotThreadSafe;

/**
 * A tile that is resident in memory for a source, along with the state that decides how long it stays resident.
 * <p>
 * A tile with symbols that drops out of the ideal set is held for a fade-out period so its labels can animate away
 * instead of disappearing. Times are readings of a monotonic clock in milliseconds supplied by the caller.
 */
@NotThreadSafe
public class Tile implements WithTileId {

  private OverscaledTileId tileId;
  private final int tileSize;
  private TileData data = TileData.EMPTY;
  private boolean hasSymbolBuckets = false;
  private double queryPadding = 0;
  private boolean holdingForSymbolFade = false;
  private long symbolFadeHoldUntil;

  public Tile(OverscaledTileId tileId, int tileSize) {
    this.tileId = Objects.requireNonNull(tileId, "tileId");
    if (tileSize <= 0) {
      throw new IllegalArgumentException("tileSize must be > 0, was " + tileSize);
    }
    this.tileSize = tileSize;
  }

  @Override
  public OverscaledTileId tileId() {
    return tileId;
  }

  @Override
  public void setTileId(OverscaledTileId tileId) {
    this.tileId = Objects.requireNonNull(tileId, "tileId");
  }

  public int tileSize() {
    return tileSize;
  }

  public TileData data() {
    return data;
  }

  /**
   * Replaces the contents of this tile.
   *
   * @param data            decoded tile contents
   * @param hasSymbolBuckets whether any layer in the tile renders symbols
   * @param queryPadding    how many pixels features in this tile can be drawn outside their geometry
   */
  public Tile setData(TileData data, boolean hasSymbolBuckets, double queryPadding) {
    this.data = Objects.requireNonNull(data, "data");
    this.hasSymbolBuckets = hasSymbolBuckets;
    this.queryPadding = queryPadding;
    return this;
  }

  public boolean hasData() {
    return data.hasData();
  }

  public boolean hasSymbolBuckets() {
    return hasSymbolBuckets;
  }

  public double queryPadding() {
    return queryPadding;
  }

  /** Starts holding this tile for {@code durationMillis} after {@code now} so its symbols can fade out. */
  public void setSymbolHoldDuration(long durationMillis, long now) {
    holdingForSymbolFade = true;
    symbolFadeHoldUntil = now + durationMillis;
  }

  public void clearSymbolFadeHold() {
    holdingForSymbolFade = false;
  }

  public boolean holdingForSymbolFade() {
    return holdingForSymbolFade;
  }

  /** Returns true if this tile is not held or its hold has run out at {@code now}. */
  public boolean symbolFadeFinished(long now) {
    return !holdingForSymbolFade || now >= symbolFadeHoldUntil;
  }

  @Override
  public String toString() {
    return "Tile{" + tileId + (holdingForSymbolFade ? " holding until " + symbolFadeHoldUntil : "") + '}';
  }
}
