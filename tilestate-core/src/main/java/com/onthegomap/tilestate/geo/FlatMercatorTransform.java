package com.onthegomap.tilestate.geo;

import java.util.List;
import net.jcip.annotations.Immutable;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;

/**
 * A top-down web mercator camera with no pitch or bearing.
 * <p>
 * Because the camera looks straight down, terrain elevation does not move the ground point under a screen pixel and
 * the camera sits over the center of the viewport. When {@code allowWorldCopies} is false, un-projected x coordinates
 * are wrapped into the primary world copy the same way a globe projection would.
 *
 * @param centerLng        longitude at the center of the viewport
 * @param centerLat        latitude at the center of the viewport
 * @param zoom             fractional zoom level
 * @param width            viewport width in pixels
 * @param height           viewport height in pixels
 * @param tileSize         size of a zoom-0 world in pixels
 * @param allowWorldCopies whether the map repeats horizontally
 */
@Immutable
public record FlatMercatorTransform(
  double centerLng,
  double centerLat,
  double zoom,
  int width,
  int height,
  int tileSize,
  boolean allowWorldCopies
) implements MapTransform {

  public FlatMercatorTransform {
    if (width <= 0 || height <= 0) {
      throw new IllegalArgumentException("Viewport must not be empty, was " + width + "x" + height);
    }
    if (tileSize <= 0) {
      throw new IllegalArgumentException("tileSize must be > 0, was " + tileSize);
    }
  }

  private double worldSize() {
    return tileSize * Math.pow(2, zoom);
  }

  /** Returns the screen position the camera looks down from. */
  public Coordinate cameraPoint() {
    return new CoordinateXY(width / 2d, height / 2d);
  }

  @Override
  public List<Coordinate> cameraQueryGeometry(List<Coordinate> queryGeometry) {
    Coordinate camera = cameraPoint();
    if (queryGeometry.size() == 1) {
      return List.of(queryGeometry.get(0), camera);
    }
    Envelope envelope = GeoUtils.boundsOf(queryGeometry);
    envelope.expandToInclude(camera);
    List<Coordinate> corners = GeoUtils.corners(envelope);
    return List.of(corners.get(0), corners.get(1), corners.get(2), corners.get(3), corners.get(0));
  }

  @Override
  public Coordinate screenPointToWorld(Coordinate screenPoint, Terrain terrain) {
    double worldSize = worldSize();
    double x = GeoUtils.getWorldX(centerLng) + (screenPoint.x - width / 2d) / worldSize;
    double y = GeoUtils.getWorldY(centerLat) + (screenPoint.y - height / 2d) / worldSize;
    return new CoordinateXY(allowWorldCopies ? x : GeoUtils.wrapWorldX(x), y);
  }
}
