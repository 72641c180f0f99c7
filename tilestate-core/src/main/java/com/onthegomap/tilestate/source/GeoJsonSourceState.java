package com.onthegomap.tilestate.source;

import com.onthegomap.tilestate.config.TileStateConfig;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import net.jcip.annotations.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The features of one GeoJSON source along with diffs that were received but not yet folded into them.
 * <p>
 * Diffs that arrive while tiles are still being rebuilt from the previous data are coalesced into a single pending
 * diff, which the next rebuild applies in one go with {@link #applyPendingDiff()}. Callers must serialize calls to a
 * single instance.
 */
@NotThreadSafe
public class GeoJsonSourceState {

  private static final Logger LOGGER = LoggerFactory.getLogger(GeoJsonSourceState.class);

  private final String name;
  private final String promoteId;
  private UpdateableGeoJson data;
  private Map<FeatureId, GeoJsonFeature> workingSet;
  private GeoJsonSourceDiff pendingDiff;

  /**
   * Creates the state for a source with no data.
   *
   * @param name      name of the source to use in log messages
   * @param promoteId property to read feature ids from instead of the {@code id} member, or {@code null}
   */
  public GeoJsonSourceState(String name, String promoteId) {
    this.name = name;
    this.promoteId = promoteId;
    setData(null);
  }

  public GeoJsonSourceState(String name, TileStateConfig config) {
    this(name, config.promoteId());
  }

  /** Replaces all the data of this source, discarding any pending diff. */
  public void setData(UpdateableGeoJson newData) {
    this.data = newData;
    this.pendingDiff = null;
    if (GeoJsonSourceDiffs.isUpdateable(newData, promoteId)) {
      this.workingSet = GeoJsonSourceDiffs.toWorkingSet(newData, promoteId);
    } else {
      LOGGER.debug("{}: data has missing or duplicate feature ids, incremental updates disabled", name);
      this.workingSet = null;
    }
  }

  /** Returns true if the current data can be changed with {@link #updateData(GeoJsonSourceDiff)}. */
  public boolean isUpdateable() {
    return workingSet != null;
  }

  /**
   * Queues {@code diff} to be applied on the next rebuild, merging it with any diff already waiting.
   *
   * @throws IllegalStateException if the current data has missing or duplicate feature ids
   */
  public void updateData(GeoJsonSourceDiff diff) {
    if (workingSet == null) {
      throw new IllegalStateException("Cannot update existing geojson data in " + name +
        ": every feature needs a unique id");
    }
    if (pendingDiff != null) {
      LOGGER.debug("{}: coalescing diff with pending update", name);
    }
    pendingDiff = GeoJsonSourceDiffs.merge(pendingDiff, diff, promoteId);
  }

  public boolean hasPendingDiff() {
    return pendingDiff != null;
  }

  /** Returns the diff that will be applied by the next rebuild, or {@code null} if there is none. */
  public GeoJsonSourceDiff pendingDiff() {
    return pendingDiff;
  }

  /**
   * Folds the pending diff into the features of this source and returns the resulting data to rebuild tiles from.
   */
  public UpdateableGeoJson applyPendingDiff() {
    if (pendingDiff != null) {
      GeoJsonSourceDiff diff = pendingDiff;
      pendingDiff = null;
      int before = workingSet.size();
      GeoJsonSourceDiffs.apply(workingSet, diff, promoteId);
      data = UpdateableGeoJson.of(List.copyOf(workingSet.values()));
      LOGGER.debug("{}: applied diff, {} features before and {} after", name, before, workingSet.size());
    }
    return data;
  }

  /** Returns the current data, without any pending diff applied. */
  public UpdateableGeoJson data() {
    return data;
  }

  /** Returns a read-only view of the current features by id, or {@code null} if the data is not updateable. */
  public Map<FeatureId, GeoJsonFeature> workingSet() {
    return workingSet == null ? null : Collections.unmodifiableMap(workingSet);
  }
}
