package com.onthegomap.tilestate;

import com.onthegomap.tilestate.geo.GeoUtils;
import com.onthegomap.tilestate.source.FeatureId;
import com.onthegomap.tilestate.source.GeoJsonFeature;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;

public class TestUtils {

  public static List<Coordinate> newCoordinateList(double... coords) {
    List<Coordinate> result = new ArrayList<>(coords.length / 2);
    for (int i = 0; i < coords.length; i += 2) {
      result.add(new CoordinateXY(coords[i], coords[i + 1]));
    }
    return result;
  }

  public static Point newPoint(double x, double y) {
    return GeoUtils.JTS_FACTORY.createPoint(new CoordinateXY(x, y));
  }

  public static LineString newLineString(double... coords) {
    return GeoUtils.JTS_FACTORY.createLineString(newCoordinateList(coords).toArray(new Coordinate[0]));
  }

  public static Polygon newPolygon(double... coords) {
    return GeoUtils.JTS_FACTORY.createPolygon(newCoordinateList(coords).toArray(new Coordinate[0]));
  }

  public static List<Coordinate> rectangleCoordList(double minX, double minY, double maxX, double maxY) {
    return newCoordinateList(
      minX, minY,
      maxX, minY,
      maxX, maxY,
      minX, maxY,
      minX, minY
    );
  }

  public static Polygon rectangle(double minX, double minY, double maxX, double maxY) {
    return GeoUtils.JTS_FACTORY.createPolygon(rectangleCoordList(minX, minY, maxX, maxY).toArray(new Coordinate[0]));
  }

  /** Returns a point feature with {@code id} and properties from alternating key/value arguments. */
  public static GeoJsonFeature feature(Object id, Object... keyValues) {
    return new GeoJsonFeature(id, newPoint(0, 0), properties(keyValues));
  }

  public static Map<String, Object> properties(Object... keyValues) {
    Map<String, Object> result = new LinkedHashMap<>();
    for (int i = 0; i < keyValues.length; i += 2) {
      result.put(keyValues[i].toString(), keyValues[i + 1]);
    }
    return result;
  }

  public static FeatureId id(long id) {
    return FeatureId.of(id);
  }

  public static FeatureId id(String id) {
    return FeatureId.of(id);
  }
}
