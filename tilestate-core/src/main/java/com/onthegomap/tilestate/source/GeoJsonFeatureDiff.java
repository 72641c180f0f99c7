package com.onthegomap.tilestate.source;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.locationtech.jts.geom.Geometry;

/**
 * Changes to apply to one existing feature of a GeoJSON source.
 * <p>
 * Applied in this order: replace the geometry, clear all properties, remove {@code removeProperties}, then set each of
 * {@code addOrUpdateProperties} in order so that a later value for the same key wins. List fields are {@code null}
 * when they are absent.
 *
 * @param id                    id of the feature to change
 * @param newGeometry           geometry to replace the existing one with, or {@code null} to keep it
 * @param removeAllProperties   whether to clear every property
 * @param removeProperties      property keys to remove
 * @param addOrUpdateProperties property values to set
 */
public record GeoJsonFeatureDiff(
  FeatureId id,
  Geometry newGeometry,
  boolean removeAllProperties,
  List<String> removeProperties,
  List<PropertyUpdate> addOrUpdateProperties
) {

  public GeoJsonFeatureDiff {
    Objects.requireNonNull(id, "id");
    removeProperties = removeProperties == null ? null : List.copyOf(removeProperties);
    addOrUpdateProperties = addOrUpdateProperties == null ? null : List.copyOf(addOrUpdateProperties);
  }

  public static Builder builder(FeatureId id) {
    return new Builder(id);
  }

  /** Returns true if this diff has nothing to change about its feature. */
  public boolean isNoOp() {
    return newGeometry == null && !changesProperties();
  }

  /** Returns true if applying this diff rebuilds the feature's properties. */
  public boolean changesProperties() {
    return removeAllProperties ||
      (removeProperties != null && !removeProperties.isEmpty()) ||
      (addOrUpdateProperties != null && !addOrUpdateProperties.isEmpty());
  }

  /**
   * A property value to set.
   *
   * @param key   the property key
   * @param value the new value, which may be {@code null}
   */
  public record PropertyUpdate(String key, Object value) {

    public PropertyUpdate {
      Objects.requireNonNull(key, "key");
    }
  }

  /** Mutable builder for {@link GeoJsonFeatureDiff}. */
  public static class Builder {

    private final FeatureId id;
    private Geometry newGeometry;
    private boolean removeAllProperties = false;
    private List<String> removeProperties;
    private List<PropertyUpdate> addOrUpdateProperties;

    private Builder(FeatureId id) {
      this.id = id;
    }

    public Builder newGeometry(Geometry geometry) {
      this.newGeometry = geometry;
      return this;
    }

    public Builder removeAllProperties() {
      this.removeAllProperties = true;
      return this;
    }

    public Builder removeProperty(String key) {
      if (removeProperties == null) {
        removeProperties = new ArrayList<>();
      }
      removeProperties.add(key);
      return this;
    }

    public Builder addOrUpdateProperty(String key, Object value) {
      if (addOrUpdateProperties == null) {
        addOrUpdateProperties = new ArrayList<>();
      }
      addOrUpdateProperties.add(new PropertyUpdate(key, value));
      return this;
    }

    public GeoJsonFeatureDiff build() {
      return new GeoJsonFeatureDiff(id, newGeometry, removeAllProperties, removeProperties, addOrUpdateProperties);
    }
  }
}
