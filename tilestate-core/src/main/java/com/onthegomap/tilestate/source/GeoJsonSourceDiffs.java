package com.onthegomap.tilestate.source;

import com.onthegomap.tilestate.source.GeoJsonFeatureDiff.PropertyUpdate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.locationtech.jts.geom.Geometry;

/**
 * Utilities for incrementally updating the features of a GeoJSON source with {@link GeoJsonSourceDiff diffs}.
 * <p>
 * Data has to be turned into a working set with {@link #toWorkingSet(UpdateableGeoJson, String)} before diffs can be
 * {@link #apply(Map, GeoJsonSourceDiff, String) applied} to it. Diffs that arrive while a previous one is still being
 * applied can be combined with {@link #merge(GeoJsonSourceDiff, GeoJsonSourceDiff)} into a single equivalent diff.
 * <p>
 * Applying a merged diff always leaves a working set in the same state as applying its parts in order, so merging
 * drops earlier property edits that a later diff wipes out instead of carrying them along.
 * <p>
 * Ids that cannot be resolved and changes to features that do not exist are ignored rather than treated as errors.
 */
public final class GeoJsonSourceDiffs {

  private GeoJsonSourceDiffs() {}

  /**
   * Returns true if {@code data} can be incrementally updated: it is {@code null}, a single feature with an id, or a
   * collection where every feature has an id and no two features share one.
   *
   * @param data      the data to check
   * @param promoteId property to read ids from instead of the feature's {@code id}, or {@code null}
   */
  public static boolean isUpdateable(UpdateableGeoJson data, String promoteId) {
    if (data == null) {
      return true;
    }
    if (data instanceof UpdateableGeoJson.Single single) {
      return single.feature().resolveId(promoteId) != null;
    }
    // reject reused ids so features are never silently dropped
    Set<FeatureId> seenIds = new HashSet<>();
    for (GeoJsonFeature feature : data.features()) {
      FeatureId id = feature.resolveId(promoteId);
      if (id == null || !seenIds.add(id)) {
        return false;
      }
    }
    return true;
  }

  /**
   * Returns a mutable map from id to feature for {@code data}, in the order features appear.
   * <p>
   * The result is only well-defined when {@link #isUpdateable(UpdateableGeoJson, String)} is true for {@code data}.
   */
  public static Map<FeatureId, GeoJsonFeature> toWorkingSet(UpdateableGeoJson data, String promoteId) {
    Map<FeatureId, GeoJsonFeature> result = new LinkedHashMap<>();
    if (data != null) {
      for (GeoJsonFeature feature : data.features()) {
        FeatureId id = feature.resolveId(promoteId);
        if (id != null) {
          result.put(id, feature);
        }
      }
    }
    return result;
  }

  /**
   * Applies {@code diff} to {@code workingSet} in place.
   * <p>
   * Added features without a resolvable id and updates to missing features are skipped. An updated feature is
   * replaced by a changed copy, never modified, and an update with nothing to change leaves the stored feature as is.
   */
  public static void apply(Map<FeatureId, GeoJsonFeature> workingSet, GeoJsonSourceDiff diff, String promoteId) {
    if (diff.removeAll()) {
      workingSet.clear();
    }

    if (diff.remove() != null) {
      for (FeatureId id : diff.remove()) {
        workingSet.remove(id);
      }
    }

    if (diff.add() != null) {
      for (GeoJsonFeature feature : diff.add()) {
        FeatureId id = feature.resolveId(promoteId);
        if (id != null) {
          workingSet.put(id, feature);
        }
      }
    }

    if (diff.update() != null) {
      for (GeoJsonFeatureDiff update : diff.update()) {
        GeoJsonFeature feature = workingSet.get(update.id());
        if (feature == null || update.isNoOp()) {
          continue;
        }
        if (update.newGeometry() != null) {
          feature = feature.withGeometry(update.newGeometry());
        }
        if (update.changesProperties()) {
          feature = feature.withProperties(applyPropertyChanges(feature.properties(), update));
        }
        workingSet.put(update.id(), feature);
      }
    }
  }

  private static Map<String, Object> applyPropertyChanges(Map<String, Object> existing, GeoJsonFeatureDiff update) {
    Map<String, Object> properties = update.removeAllProperties() ? new LinkedHashMap<>() :
      new LinkedHashMap<>(existing);
    if (update.removeProperties() != null) {
      for (String key : update.removeProperties()) {
        properties.remove(key);
      }
    }
    if (update.addOrUpdateProperties() != null) {
      for (PropertyUpdate property : update.addOrUpdateProperties()) {
        properties.put(property.key(), property.value());
      }
    }
    return Collections.unmodifiableMap(properties);
  }

  /** Same as {@link #merge(GeoJsonSourceDiff, GeoJsonSourceDiff, String)} for sources without a promote id. */
  public static GeoJsonSourceDiff merge(GeoJsonSourceDiff prev, GeoJsonSourceDiff next) {
    return merge(prev, next, null);
  }

  /**
   * Returns one diff that has the same effect as applying {@code prev} and then {@code next} to any working set.
   * <p>
   * Pending adds and updates that a later remove makes moot are dropped, updates to the same feature are combined with
   * {@link #mergeFeatureDiffs(GeoJsonFeatureDiff, GeoJsonFeatureDiff)}, and a feature that is added again is no longer
   * removed. Empty lists are left out of the result.
   *
   * @param prev      the earlier diff, or {@code null}
   * @param next      the later diff, or {@code null}
   * @param promoteId property used to identify added features, or {@code null} to use their {@code id}
   */
  public static GeoJsonSourceDiff merge(GeoJsonSourceDiff prev, GeoJsonSourceDiff next, String promoteId) {
    if (prev == null) {
      return next == null ? GeoJsonSourceDiff.EMPTY : next;
    }
    if (next == null) {
      return prev;
    }

    HashedDiff before = HashedDiff.of(prev, promoteId);
    HashedDiff after = HashedDiff.of(next, promoteId);

    // removing everything wipes out anything added or updated before
    if (after.removeAll) {
      before.add.clear();
      before.update.clear();
    }

    // removing a feature wipes out earlier adds or updates to it
    for (FeatureId id : after.remove) {
      before.add.remove(id);
      before.update.remove(id);
    }

    // adding a feature replaces it entirely, including earlier updates
    for (FeatureId id : after.add.keySet()) {
      before.update.remove(id);
    }

    // updating a feature that was updated before
    for (var entry : after.update.entrySet()) {
      GeoJsonFeatureDiff prevUpdate = before.update.remove(entry.getKey());
      if (prevUpdate != null) {
        entry.setValue(mergeFeatureDiffs(prevUpdate, entry.getValue()));
      }
    }

    HashedDiff merged = new HashedDiff(before.removeAll || after.removeAll);
    merged.remove.addAll(before.remove);
    merged.remove.addAll(after.remove);
    merged.add.putAll(before.add);
    merged.add.putAll(after.add);
    merged.update.putAll(before.update);
    merged.update.putAll(after.update);

    // adding a feature overrides removing it
    merged.remove.removeAll(merged.add.keySet());

    return merged.toDiff();
  }

  /**
   * Returns one feature diff that has the same effect as applying {@code prev} and then {@code next} to the same
   * feature.
   * <p>
   * The geometry from {@code next} wins when it has one, and property edits are concatenated with {@code next}'s after
   * {@code prev}'s. Edits from {@code prev} that {@code next} wipes out are dropped: all of them when {@code next}
   * removes every property, or the values for keys that {@code next} removes.
   */
  public static GeoJsonFeatureDiff mergeFeatureDiffs(GeoJsonFeatureDiff prev, GeoJsonFeatureDiff next) {
    Geometry geometry = next.newGeometry() != null ? next.newGeometry() : prev.newGeometry();
    boolean removeAllProperties = prev.removeAllProperties() || next.removeAllProperties();
    List<String> removeProperties;
    List<PropertyUpdate> addOrUpdateProperties;

    if (next.removeAllProperties()) {
      removeProperties = concat(null, next.removeProperties());
      addOrUpdateProperties = concat(null, next.addOrUpdateProperties());
    } else {
      removeProperties = concat(prev.removeProperties(), next.removeProperties());
      List<PropertyUpdate> prevUpdates = prev.addOrUpdateProperties();
      if (prevUpdates != null && next.removeProperties() != null) {
        Set<String> removedLater = new HashSet<>(next.removeProperties());
        prevUpdates = prevUpdates.stream().filter(property -> !removedLater.contains(property.key())).toList();
      }
      addOrUpdateProperties = concat(prevUpdates, next.addOrUpdateProperties());
    }

    return new GeoJsonFeatureDiff(prev.id(), geometry, removeAllProperties, removeProperties, addOrUpdateProperties);
  }

  private static <T> List<T> concat(List<T> a, List<T> b) {
    List<T> result = new ArrayList<>();
    if (a != null) {
      result.addAll(a);
    }
    if (b != null) {
      result.addAll(b);
    }
    return result.isEmpty() ? null : result;
  }

  /** A mutable copy of a diff indexed by id for constant-time conflict lookups while merging. */
  private static final class HashedDiff {

    private final boolean removeAll;
    private final Set<FeatureId> remove = new LinkedHashSet<>();
    private final Map<FeatureId, GeoJsonFeature> add = new LinkedHashMap<>();
    private final Map<FeatureId, GeoJsonFeatureDiff> update = new LinkedHashMap<>();

    private HashedDiff(boolean removeAll) {
      this.removeAll = removeAll;
    }

    static HashedDiff of(GeoJsonSourceDiff diff, String promoteId) {
      HashedDiff hashed = new HashedDiff(diff.removeAll());
      if (diff.remove() != null) {
        hashed.remove.addAll(diff.remove());
      }
      if (diff.add() != null) {
        for (GeoJsonFeature feature : diff.add()) {
          FeatureId id = feature.resolveId(promoteId);
          // features without an id would be skipped when applied anyway
          if (id != null) {
            hashed.add.put(id, feature);
          }
        }
      }
      if (diff.update() != null) {
        for (GeoJsonFeatureDiff featureDiff : diff.update()) {
          // several updates to one feature in the same diff apply one after the other
          hashed.update.merge(featureDiff.id(), featureDiff, GeoJsonSourceDiffs::mergeFeatureDiffs);
        }
      }
      return hashed;
    }

    GeoJsonSourceDiff toDiff() {
      return new GeoJsonSourceDiff(
        removeAll,
        remove.isEmpty() ? null : List.copyOf(remove),
        add.isEmpty() ? null : List.copyOf(add.values()),
        update.isEmpty() ? null : List.copyOf(update.values())
      );
    }
  }
}
