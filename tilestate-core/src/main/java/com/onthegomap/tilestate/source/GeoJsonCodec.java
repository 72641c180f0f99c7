package com.onthegomap.tilestate.source;

import static com.onthegomap.tilestate.geo.GeoUtils.JTS_FACTORY;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.onthegomap.tilestate.geo.GeoUtils;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.CoordinateArrays;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Point;
import org.locationtech.jts.geom.Polygon;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decodes GeoJSON features and source diffs from JSON text.
 * <p>
 * Invalid json syntax and unsupported top-level objects throw {@link GeoJsonFormatException}, but invalid geometries
 * just log a warning and decode as an empty geometry, and ids that cannot identify a feature are dropped from diffs.
 *
 * @see <a href="https://datatracker.ietf.org/doc/html/rfc7946">GeoJSON specification (RFC 7946)</a>
 */
public class GeoJsonCodec {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeoJsonCodec.class);
  private static final TypeReference<Map<String, Object>> PROPERTIES_TYPE = new TypeReference<>() {};

  private final ObjectMapper mapper = new ObjectMapper();

  /**
   * Returns the feature or feature collection encoded in {@code json}, or {@code null} if it is the JSON literal
   * {@code null}.
   *
   * @throws GeoJsonFormatException if {@code json} is not valid json, or is another kind of GeoJSON object
   */
  public UpdateableGeoJson readUpdateable(String json) {
    JsonNode root = parse(json);
    if (root == null || root.isNull() || root.isMissingNode()) {
      return null;
    }
    String type = root.path("type").asText(null);
    if ("Feature".equals(type)) {
      return UpdateableGeoJson.of(feature(root));
    } else if ("FeatureCollection".equals(type)) {
      JsonNode features = root.path("features");
      if (!features.isArray()) {
        throw new GeoJsonFormatException("FeatureCollection is missing a features array");
      }
      return UpdateableGeoJson.of(map(features, this::feature));
    }
    throw new GeoJsonFormatException("Expected a Feature or FeatureCollection but got: " + type);
  }

  /**
   * Returns the source diff encoded in {@code json} as an object with optional {@code removeAll}, {@code remove},
   * {@code add} and {@code update} members.
   *
   * @throws GeoJsonFormatException if {@code json} is not valid json
   */
  public GeoJsonSourceDiff readDiff(String json) {
    JsonNode root = parse(json);
    if (root == null || !root.isObject()) {
      throw new GeoJsonFormatException("Expected a diff object");
    }
    List<FeatureId> remove = root.has("remove") ? ids(root.get("remove")) : null;
    List<GeoJsonFeature> add = root.has("add") ? map(root.get("add"), this::feature) : null;
    List<GeoJsonFeatureDiff> update = null;
    if (root.has("update")) {
      update = new ArrayList<>();
      for (JsonNode node : root.get("update")) {
        GeoJsonFeatureDiff featureDiff = featureDiff(node);
        if (featureDiff != null) {
          update.add(featureDiff);
        }
      }
    }
    return new GeoJsonSourceDiff(root.path("removeAll").asBoolean(false), remove, add, update);
  }

  private JsonNode parse(String json) {
    try {
      return mapper.readTree(json);
    } catch (JsonProcessingException e) {
      throw new GeoJsonFormatException("Invalid json: " + e.getOriginalMessage(), e);
    }
  }

  private GeoJsonFeature feature(JsonNode node) {
    if (!"Feature".equals(node.path("type").asText(null))) {
      throw new GeoJsonFormatException("Expected a Feature but got: " + node.path("type").asText(null));
    }
    JsonNode properties = node.path("properties");
    return new GeoJsonFeature(
      rawId(node.get("id")),
      geometry(node.get("geometry")),
      properties.isObject() ? mapper.convertValue(properties, PROPERTIES_TYPE) : Map.of()
    );
  }

  private GeoJsonFeatureDiff featureDiff(JsonNode node) {
    FeatureId id = FeatureId.from(rawId(node.get("id")));
    if (id == null) {
      LOGGER.warn("Ignoring feature update with invalid id: {}", node.get("id"));
      return null;
    }
    var builder = GeoJsonFeatureDiff.builder(id);
    if (node.hasNonNull("newGeometry")) {
      builder.newGeometry(geometry(node.get("newGeometry")));
    }
    if (node.path("removeAllProperties").asBoolean(false)) {
      builder.removeAllProperties();
    }
    for (JsonNode key : node.path("removeProperties")) {
      builder.removeProperty(key.asText());
    }
    for (JsonNode property : node.path("addOrUpdateProperties")) {
      builder.addOrUpdateProperty(property.path("key").asText(), mapper.convertValue(property.get("value"),
        Object.class));
    }
    return builder.build();
  }

  private List<FeatureId> ids(JsonNode array) {
    List<FeatureId> result = new ArrayList<>();
    for (JsonNode node : array) {
      FeatureId id = FeatureId.from(rawId(node));
      if (id == null) {
        LOGGER.warn("Ignoring invalid feature id to remove: {}", node);
      } else {
        result.add(id);
      }
    }
    return result;
  }

  private static Object rawId(JsonNode node) {
    if (node == null || node.isNull()) {
      return null;
    } else if (node.isTextual()) {
      return node.asText();
    } else if (node.isIntegralNumber() && node.canConvertToLong()) {
      return node.asLong();
    } else if (node.isNumber()) {
      return node.asDouble();
    }
    return null;
  }

  private Geometry geometry(JsonNode node) {
    if (node == null || node.isNull()) {
      return GeoUtils.EMPTY_GEOMETRY;
    }
    String type = node.path("type").asText(null);
    try {
      if ("GeometryCollection".equals(type)) {
        return JTS_FACTORY.createGeometryCollection(map(node.path("geometries"), this::geometry)
          .toArray(Geometry[]::new));
      }
      JsonNode coords = node.path("coordinates");
      if (!coords.isArray()) {
        warn("Missing coordinates in geojson geometry", node);
        return GeoUtils.EMPTY_GEOMETRY;
      }
      if (type == null) {
        warn("Missing geometry type", node);
        return GeoUtils.EMPTY_GEOMETRY;
      }
      return switch (type) {
        case "Point" -> point(coords);
        case "LineString" -> lineString(coords);
        case "Polygon" -> polygon(coords);
        case "MultiPoint" -> JTS_FACTORY.createMultiPoint(map(coords, this::point).toArray(Point[]::new));
        case "MultiLineString" ->
          JTS_FACTORY.createMultiLineString(map(coords, this::lineString).toArray(LineString[]::new));
        case "MultiPolygon" -> JTS_FACTORY.createMultiPolygon(map(coords, this::polygon).toArray(Polygon[]::new));
        default -> {
          warn("Unexpected geometry type: " + type, node);
          yield GeoUtils.EMPTY_GEOMETRY;
        }
      };
    } catch (IllegalArgumentException e) {
      warn("Invalid geojson geometry: " + e.getMessage(), node);
      return GeoUtils.EMPTY_GEOMETRY;
    }
  }

  private static <T> List<T> map(JsonNode array, Function<JsonNode, T> mapper) {
    List<T> result = new ArrayList<>();
    for (JsonNode item : array) {
      result.add(mapper.apply(item));
    }
    return result;
  }

  private Point point(JsonNode coordinates) {
    return JTS_FACTORY.createPoint(coordinate(coordinates));
  }

  private LineString lineString(JsonNode coordinates) {
    return JTS_FACTORY.createLineString(coordinateArray(coordinates));
  }

  private Polygon polygon(JsonNode coordinates) {
    List<LinearRing> rings = map(coordinates, this::linearRing);
    return GeoUtils.createPolygon(
      rings.isEmpty() ? null : rings.get(0),
      rings.size() <= 1 ? List.of() : rings.subList(1, rings.size())
    );
  }

  private LinearRing linearRing(JsonNode coordinates) {
    Coordinate[] ring = coordinateArray(coordinates);
    if (!CoordinateArrays.isRing(ring)) {
      throw new IllegalArgumentException("polygon ring is not closed " + coordinates);
    }
    return JTS_FACTORY.createLinearRing(ring);
  }

  private Coordinate[] coordinateArray(JsonNode coordinates) {
    return map(coordinates, this::coordinate).toArray(Coordinate[]::new);
  }

  private Coordinate coordinate(JsonNode coordinate) {
    if (coordinate.size() < 2 || !coordinate.get(0).isNumber() || !coordinate.get(1).isNumber()) {
      throw new IllegalArgumentException("invalid coordinate " + coordinate);
    }
    return new CoordinateXY(coordinate.get(0).asDouble(), coordinate.get(1).asDouble());
  }

  private static void warn(String message, JsonNode geometry) {
    LOGGER.warn("{}: {}", message, geometry);
  }
}
