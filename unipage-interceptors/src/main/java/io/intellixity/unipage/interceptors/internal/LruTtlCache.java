package io.intellixity.unipage.interceptors.internal;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;

/**
 * Synchronized LRU cache with expire-after-write and optional expire-after-access.\n
 *
 * A zero TTL or idle period disables that expiry. Loading happens outside the lock: callers do
 * {@code get}, compute, then {@code put}, so two concurrent misses may both compute.
 */
public final class LruTtlCache<K, V> {
  private final int maxEntries;
  private final long ttlMillis;
  private final long idleMillis;
  private final LongSupplier nowMillis;

  // access-order
  private final LinkedHashMap<K, Slot<V>> map = new LinkedHashMap<>(16, 0.75f, true);

  private static final class Slot<V> {
    final V value;
    final long writtenAt;
    long touchedAt;

    Slot(V value, long now) {
      this.value = value;
      this.writtenAt = now;
      this.touchedAt = now;
    }
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis) {
    this(maxEntries, ttlMillis, idleMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, long idleMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    if (idleMillis < 0) throw new IllegalArgumentException("idleMillis must be >= 0");
    this.maxEntries = maxEntries;
    this.ttlMillis = ttlMillis;
    this.idleMillis = idleMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
  }

  /** Live value for {@code key}, or null on a miss. */
  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    long now = nowMillis.getAsLong();
    Slot<V> s = map.get(key);
    if (s == null) return null;
    if (expired(s, now)) {
      map.remove(key);
      return null;
    }
    s.touchedAt = now;
    return s.value;
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    long now = nowMillis.getAsLong();
    pruneExpired(now);
    map.put(key, new Slot<>(value, now));
    while (map.size() > maxEntries) {
      Iterator<K> eldest = map.keySet().iterator();
      eldest.next();
      eldest.remove();
    }
  }

  public synchronized void clear() {
    map.clear();
  }

  public synchronized int size() {
    pruneExpired(nowMillis.getAsLong());
    return map.size();
  }

  private boolean expired(Slot<V> s, long now) {
    if (ttlMillis > 0 && now - s.writtenAt >= ttlMillis) return true;
    return idleMillis > 0 && now - s.touchedAt >= idleMillis;
  }

  private void pruneExpired(long now) {
    Iterator<Map.Entry<K, Slot<V>>> it = map.entrySet().iterator();
    while (it.hasNext()) {
      if (expired(it.next().getValue(), now)) it.remove();
    }
  }
}
