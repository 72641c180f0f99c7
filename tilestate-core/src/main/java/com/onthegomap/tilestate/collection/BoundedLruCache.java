package com.onthegomap.tilestate.collection;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Predicate;
import net.jcip.annotations.NotThreadSafe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * A fixed-capacity cache that evicts the least-recently-used entry when it fills up.
 * <p>
 * Every value that leaves the cache, whether it was evicted, replaced, filtered out, removed explicitly or dropped by
 * {@link #clear()}, is handed to the {@code onEvict} hook exactly once so callers can release resources tied to it. The
 * hook is called synchronously from inside the mutating operation and must not call back into this cache.
 * <p>
 * Recency is only updated by a {@link #get(Object)} hit and by {@link #set(Object, Object)}.
 *
 * @param <K> the key type
 * @param <V> the value type
 */
@NotThreadSafe
public class BoundedLruCache<K, V> {

  private static final Logger LOGGER = LoggerFactory.getLogger(BoundedLruCache.class);

  // insertion order is recency order: first entry is the least-recently-used
  private final LinkedHashMap<K, V> map = new LinkedHashMap<>();
  private final Consumer<? super V> onEvict;
  private int maxSize;

  /**
   * Creates a new cache.
   *
   * @param maxSize maximum number of entries to hold, anything {@code <= 0} holds nothing
   * @param onEvict hook called with every value that leaves the cache, or {@code null} for none
   */
  public BoundedLruCache(int maxSize, Consumer<? super V> onEvict) {
    this.maxSize = maxSize;
    this.onEvict = onEvict;
  }

  public BoundedLruCache(int maxSize) {
    this(maxSize, null);
  }

  /** Returns the value stored for {@code key} and marks it most-recently-used, or {@code null} if absent. */
  public V get(K key) {
    V value = map.remove(key);
    if (value != null) {
      map.put(key, value);
    }
    return value;
  }

  /** Returns true if {@code key} is present, without touching its recency. */
  public boolean containsKey(K key) {
    return map.containsKey(key);
  }

  /**
   * Stores {@code value} as the most-recently-used entry.
   * <p>
   * A previous value for the same key is evicted first, otherwise when the cache is full the least-recently-used entry
   * is evicted to make room. Values must not be null.
   */
  public void set(K key, V value) {
    Objects.requireNonNull(value, "value");
    if (map.containsKey(key)) {
      remove(key);
    } else if (maxSize > 0 && map.size() >= maxSize) {
      evictOldest();
    }
    map.put(key, value);
    // only has an effect when maxSize <= 0
    trimToMaxSize();
  }

  /** Removes the entry for {@code key} and passes it to the evict hook, does nothing if it is absent. */
  public void remove(K key) {
    if (map.containsKey(key)) {
      evict(map.remove(key));
    }
  }

  /**
   * Changes the capacity of this cache, evicting least-recently-used entries one at a time until the cache fits.
   */
  public void setMaxSize(int maxSize) {
    if (maxSize != this.maxSize) {
      LOGGER.debug("Changing cache capacity from {} to {} ({} entries held)", this.maxSize, maxSize, map.size());
    }
    this.maxSize = maxSize;
    trimToMaxSize();
  }

  public int maxSize() {
    return maxSize;
  }

  public int size() {
    return map.size();
  }

  /** Evicts every entry whose value does not match {@code predicate}, leaving the recency order of the rest alone. */
  public void filter(Predicate<? super V> predicate) {
    List<V> removed = new ArrayList<>();
    for (Iterator<V> iterator = map.values().iterator(); iterator.hasNext(); ) {
      V value = iterator.next();
      if (!predicate.test(value)) {
        iterator.remove();
        removed.add(value);
      }
    }
    removed.forEach(this::evict);
  }

  /** Removes every entry, passing each value to the evict hook. */
  public void clear() {
    if (map.isEmpty()) {
      return;
    }
    List<V> removed = new ArrayList<>(map.values());
    map.clear();
    LOGGER.debug("Cleared {} cache entries", removed.size());
    removed.forEach(this::evict);
  }

  /** Returns the keys currently held, least-recently-used first. */
  public List<K> keys() {
    return List.copyOf(map.keySet());
  }

  /** Returns the values currently held, least-recently-used first. */
  public List<V> values() {
    return List.copyOf(map.values());
  }

  private void trimToMaxSize() {
    while (!map.isEmpty() && map.size() > Math.max(0, maxSize)) {
      evictOldest();
    }
  }

  private void evictOldest() {
    Iterator<Map.Entry<K, V>> iterator = map.entrySet().iterator();
    V oldest = iterator.next().getValue();
    iterator.remove();
    evict(oldest);
  }

  private void evict(V value) {
    if (onEvict != null) {
      onEvict.accept(value);
    }
  }
}
