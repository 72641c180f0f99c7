package com.onthegomap.tilestate.geo;

import java.util.Collection;
import java.util.List;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.impl.PackedCoordinateSequenceFactory;

/**
 * A collection of utilities for working with JTS data structures and geographic data.
 * <p>
 * "world" coordinates in this class refer to web mercator coordinates where the top-left/northwest corner of the map is
 * (0,0) and bottom-right/southeast corner is (1,1).
 */
public class GeoUtils {

  public static final GeometryFactory JTS_FACTORY = new GeometryFactory(PackedCoordinateSequenceFactory.DOUBLE_FACTORY);

  public static final Geometry EMPTY_GEOMETRY = JTS_FACTORY.createGeometryCollection();
  private static final double RADIANS_PER_DEGREE = Math.PI / 180;
  private static final double DEGREES_PER_RADIAN = 180 / Math.PI;
  private static final double MAX_LAT = getWorldLat(-0.1);
  private static final double MIN_LAT = getWorldLat(1.1);

  private GeoUtils() {}

  /**
   * Returns the latitude for a web mercator {@code y} coordinate where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   */
  public static double getWorldLat(double y) {
    double n = Math.PI - 2 * Math.PI * y;
    return DEGREES_PER_RADIAN * Math.atan(0.5 * (Math.exp(n) - Math.exp(-n)));
  }

  /**
   * Returns the web mercator X coordinate for {@code longitude} where 0 is the international date line on the west
   * side, 1 is the international date line on the east side, and 0.5 is the prime meridian.
   */
  public static double getWorldX(double longitude) {
    return (longitude + 180) / 360;
  }

  /**
   * Returns the web mercator Y coordinate for {@code latitude} where 0 is the north edge of the map, 0.5 is the
   * equator, and 1 is the south edge of the map.
   */
  public static double getWorldY(double latitude) {
    if (latitude <= MIN_LAT) {
      return 1.1;
    }
    if (latitude >= MAX_LAT) {
      return -0.1;
    }
    double sin = Math.sin(latitude * RADIANS_PER_DEGREE);
    return 0.5 - 0.25 * Math.log((1 + sin) / (1 - sin)) / Math.PI;
  }

  /** Returns world {@code x} moved into the first world copy {@code [0, 1)}. */
  public static double wrapWorldX(double x) {
    double wrapped = x - Math.floor(x);
    return wrapped >= 1 ? 0 : wrapped;
  }

  /** Returns the smallest envelope containing every coordinate in {@code coordinates}. */
  public static Envelope boundsOf(Collection<? extends Coordinate> coordinates) {
    Envelope result = new Envelope();
    for (Coordinate coordinate : coordinates) {
      result.expandToInclude(coordinate);
    }
    return result;
  }

  /** Returns the four corners of {@code envelope} in clockwise order starting at the top-left. */
  public static List<Coordinate> corners(Envelope envelope) {
    return List.of(
      new CoordinateXY(envelope.getMinX(), envelope.getMinY()),
      new CoordinateXY(envelope.getMaxX(), envelope.getMinY()),
      new CoordinateXY(envelope.getMaxX(), envelope.getMaxY()),
      new CoordinateXY(envelope.getMinX(), envelope.getMaxY())
    );
  }

  public static Polygon createPolygon(LinearRing exteriorRing, List<LinearRing> rings) {
    return JTS_FACTORY.createPolygon(exteriorRing, rings.toArray(LinearRing[]::new));
  }
}
