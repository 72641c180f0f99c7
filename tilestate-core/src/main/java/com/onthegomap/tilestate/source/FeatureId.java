package com.onthegomap.tilestate.source;

import java.math.BigDecimal;
import java.math.BigInteger;
import net.jcip.annotations.Immutable;

/**
 * Identifies a GeoJSON feature by either an integer or a string.
 * <p>
 * The two kinds never compare equal: the number {@code 5} and the string {@code "5"} identify different features.
 *
 * @param value a {@link Long} or a {@link String}
 */
@Immutable
public record FeatureId(Object value) {

  public FeatureId {
    if (!(value instanceof Long) && !(value instanceof String)) {
      throw new IllegalArgumentException("Feature id must be a long or a string, got: " + value);
    }
  }

  public static FeatureId of(long id) {
    return new FeatureId(id);
  }

  public static FeatureId of(String id) {
    return new FeatureId(id);
  }

  /**
   * Returns the id for a raw value read from GeoJSON, or {@code null} if the value cannot identify a feature.
   * <p>
   * Integral numbers become numeric ids and strings become string ids. Anything else, including fractional numbers, is
   * not a usable id.
   */
  public static FeatureId from(Object raw) {
    if (raw instanceof FeatureId id) {
      return id;
    } else if (raw instanceof String string) {
      return of(string);
    } else if (raw instanceof Long || raw instanceof Integer || raw instanceof Short || raw instanceof Byte) {
      return of(((Number) raw).longValue());
    } else if (raw instanceof BigInteger big && big.bitLength() < 64) {
      return of(big.longValue());
    } else if (raw instanceof Double || raw instanceof Float || raw instanceof BigDecimal) {
      double d = ((Number) raw).doubleValue();
      if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d) <= Long.MAX_VALUE) {
        return of((long) d);
      }
    }
    return null;
  }

  public boolean isNumeric() {
    return value instanceof Long;
  }

  @Override
  public String toString() {
    return isNumeric() ? value.toString() : '"' + value.toString() + '"';
  }
}
