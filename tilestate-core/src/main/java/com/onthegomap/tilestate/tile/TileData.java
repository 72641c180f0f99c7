package com.onthegomap.tilestate.tile;

/**
 * Contents of a resident tile, kept as the encoded bytes fetched from the server or generated from a GeoJSON source.
 *
 * @param rawData encoded tile bytes, or {@code null} when the tile has not loaded
 */
public record TileData(byte[] rawData) {

  public static final TileData EMPTY = new TileData(null);

  public static TileData ofRaw(byte[] rawData) {
    return new TileData(rawData);
  }

  public boolean hasData() {
    return rawData != null;
  }
}
