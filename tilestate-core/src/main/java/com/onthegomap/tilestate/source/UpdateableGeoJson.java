package com.onthegomap.tilestate.source;

import java.util.List;

/**
 * GeoJSON data that may support incremental updates: a single {@link Single feature} or a {@link Collection feature
 * collection}. Missing data is represented by {@code null}.
 *
 * @see GeoJsonSourceDiffs#isUpdateable(UpdateableGeoJson, String)
 */
public sealed interface UpdateableGeoJson {

  /** Returns every feature in this data. */
  List<GeoJsonFeature> features();

  static Single of(GeoJsonFeature feature) {
    return new Single(feature);
  }

  static Collection of(List<GeoJsonFeature> features) {
    return new Collection(features);
  }

  /** A GeoJSON {@code Feature}. */
  record Single(GeoJsonFeature feature) implements UpdateableGeoJson {

    public Single {
      if (feature == null) {
        throw new IllegalArgumentException("feature is required");
      }
    }

    @Override
    public List<GeoJsonFeature> features() {
      return List.of(feature);
    }
  }

  /** A GeoJSON {@code FeatureCollection}. */
  record Collection(List<GeoJsonFeature> features) implements UpdateableGeoJson {

    public Collection {
      features = List.copyOf(features);
    }
  }
}
