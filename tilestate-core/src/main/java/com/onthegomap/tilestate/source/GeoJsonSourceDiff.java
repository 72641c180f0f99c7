package com.onthegomap.tilestate.source;

import java.util.ArrayList;
import java.util.List;

/**
 * An incremental update to the features of a GeoJSON source.
 * <p>
 * Always applied in this order regardless of which fields are set: remove every feature if {@code removeAll}, remove
 * the features in {@code remove}, add or replace the features in {@code add}, then apply the changes in
 * {@code update}. List fields are {@code null} when they are absent.
 *
 * @param removeAll whether to remove every feature first
 * @param remove    ids of features to remove
 * @param add       complete features to add, replacing any feature with the same id
 * @param update    changes to existing features
 */
public record GeoJsonSourceDiff(
  boolean removeAll,
  List<FeatureId> remove,
  List<GeoJsonFeature> add,
  List<GeoJsonFeatureDiff> update
) {

  public static final GeoJsonSourceDiff EMPTY = new GeoJsonSourceDiff(false, null, null, null);

  public GeoJsonSourceDiff {
    remove = remove == null ? null : List.copyOf(remove);
    add = add == null ? null : List.copyOf(add);
    update = update == null ? null : List.copyOf(update);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Returns true if applying this diff would not change anything. */
  public boolean isEmpty() {
    return !removeAll && isNullOrEmpty(remove) && isNullOrEmpty(add) && isNullOrEmpty(update);
  }

  private static boolean isNullOrEmpty(List<?> list) {
    return list == null || list.isEmpty();
  }

  /** Mutable builder for {@link GeoJsonSourceDiff}. */
  public static class Builder {

    private boolean removeAll = false;
    private List<FeatureId> remove;
    private List<GeoJsonFeature> add;
    private List<GeoJsonFeatureDiff> update;

    private Builder() {}

    public Builder removeAll() {
      this.removeAll = true;
      return this;
    }

    public Builder remove(FeatureId... ids) {
      if (remove == null) {
        remove = new ArrayList<>();
      }
      remove.addAll(List.of(ids));
      return this;
    }

    public Builder add(GeoJsonFeature... features) {
      if (add == null) {
        add = new ArrayList<>();
      }
      add.addAll(List.of(features));
      return this;
    }

    public Builder update(GeoJsonFeatureDiff... diffs) {
      if (update == null) {
        update = new ArrayList<>();
      }
      update.addAll(List.of(diffs));
      return this;
    }

    public GeoJsonSourceDiff build() {
      return new GeoJsonSourceDiff(removeAll, remove, add, update);
    }
  }
}
