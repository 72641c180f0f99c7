package com.onthegomap.tilestate.source;

import com.onthegomap.tilestate.geo.GeoUtils;
import java.util.Map;
import org.locationtech.jts.geom.Geometry;

/**
 * A feature from a GeoJSON source.
 * <p>
 * Instances are never modified once they are created: edits make a shallow copy with {@link #withGeometry(Geometry)}
 * or {@link #withProperties(Map)} so other holders of the original feature do not see the change.
 *
 * @param id         the raw {@code id} member of the feature, or {@code null}
 * @param geometry   the parsed JTS geometry, or an empty geometry if it was missing
 * @param properties the {@code properties} member, or an empty map if it was missing
 */
public record GeoJsonFeature(Object id, Geometry geometry, Map<String, Object> properties) {

  public GeoJsonFeature {
    if (geometry == null) {
      geometry = GeoUtils.EMPTY_GEOMETRY;
    }
    if (properties == null) {
      properties = Map.of();
    }
  }

  public GeoJsonFeature(Geometry geometry, Map<String, Object> properties) {
    this(null, geometry, properties);
  }

  /**
   * Returns the id of this feature, read from the {@code promoteId} property when it is set or the {@code id} member
   * otherwise, or {@code null} if it is missing or not a usable id.
   */
  public FeatureId resolveId(String promoteId) {
    return FeatureId.from(promoteId != null ? properties.get(promoteId) : id);
  }

  public GeoJsonFeature withGeometry(Geometry newGeometry) {
    return new GeoJsonFeature(id, newGeometry, properties);
  }

  public GeoJsonFeature withProperties(Map<String, Object> newProperties) {
    return new GeoJsonFeature(id, geometry, newProperties);
  }
}
