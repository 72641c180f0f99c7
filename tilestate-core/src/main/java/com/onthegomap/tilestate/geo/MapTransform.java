package com.onthegomap.tilestate.geo;

import java.util.List;
import org.locationtech.jts.geom.Coordinate;

/**
 * The camera and projection a map is currently rendered with, as far as tile queries need to know about it.
 * <p>
 * Screen points are in pixels from the top-left corner of the viewport. World coordinates are web mercator coordinates
 * where the primary world copy spans {@code 0..1} on both axes.
 */
public interface MapTransform {

  /** Current fractional zoom level of the camera. */
  double zoom();

  /**
   * Returns false for projections like a globe that only ever show one copy of the world, in which case screen points
   * on the other side of the antimeridian un-project to the opposite edge of the world.
   */
  boolean allowWorldCopies();

  /**
   * Returns the screen-space polygon that can contain features rendered above the ground and visible through
   * {@code queryGeometry}, extending it towards the camera to cover extruded features.
   */
  List<Coordinate> cameraQueryGeometry(List<Coordinate> queryGeometry);

  /** Un-projects a screen point to world coordinates, using {@code terrain} when the map is draped over one. */
  Coordinate screenPointToWorld(Coordinate screenPoint, Terrain terrain);
}
