package com.onthegomap.tilestate.geo;

/**
 * Elevation model the map is draped over, used when un-projecting screen points on a 3D map.
 */
@FunctionalInterface
public interface Terrain {

  /** Returns the elevation in meters at a web mercator {@code worldX, worldY} coordinate. */
  double getElevation(double worldX, double worldY);
}
