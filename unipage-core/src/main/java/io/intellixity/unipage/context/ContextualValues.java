package io.intellixity.unipage.context;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Immutable per-request snapshot of values resolved outside the core (authenticated user, tenant, flags).\n
 *
 * Values may be null (a provider ran but found nothing); {@link #contains(String)} tells absent from null.
 */
public final class ContextualValues {
  private static final ContextualValues EMPTY = new ContextualValues(Map.of(), "ctx:empty");

  private final Map<String, Object> values;
  private final String cacheKey;

  private ContextualValues(Map<String, Object> values, String cacheKey) {
    this.values = values;
    this.cacheKey = cacheKey;
  }

  public static ContextualValues empty() {
    return EMPTY;
  }

  /** Map-backed snapshot; the cache key is derived from the (sorted) content. */
  public static ContextualValues of(Map<String, ?> values) {
    return of(values, null);
  }

  /** Map-backed snapshot with an explicit stable cache key. */
  public static ContextualValues of(Map<String, ?> values, String cacheKey) {
    if (values == null || values.isEmpty()) {
      return (cacheKey == null || cacheKey.isBlank()) ? EMPTY : new ContextualValues(Map.of(), cacheKey);
    }
    Map<String, Object> copy = new LinkedHashMap<>();
    for (var e : values.entrySet()) {
      copy.put(Objects.requireNonNull(e.getKey(), "contextual key"), e.getValue());
    }
    Map<String, Object> frozen = Collections.unmodifiableMap(copy);
    String ck = (cacheKey == null || cacheKey.isBlank()) ? derivedKey(frozen) : cacheKey;
    return new ContextualValues(frozen, ck);
  }

  /** Return a value or null if absent. */
  public Object get(String key) {
    return values.get(key);
  }

  /** Return a required, non-null value; throws if missing. */
  public Object getRequired(String key) {
    Objects.requireNonNull(key, "key");
    Object v = values.get(key);
    if (v == null) throw new IllegalStateException("Missing contextual value: " + key);
    return v;
  }

  public boolean contains(String key) {
    return values.containsKey(key);
  }

  /** Copy with one more (or replaced) entry; the cache key is re-derived. */
  public ContextualValues with(String key, Object value) {
    Objects.requireNonNull(key, "key");
    Map<String, Object> copy = new LinkedHashMap<>(values);
    copy.put(key, value);
    return of(copy);
  }

  public Map<String, Object> asMap() {
    return values;
  }

  /** Stable identity of this snapshot, used by result caches. */
  public String cacheKey() {
    return cacheKey;
  }

  public boolean isEmpty() {
    return values.isEmpty();
  }

  // Length-prefixed so that no key or value text can imitate a separator; null and "null" differ.
  private static String derivedKey(Map<String, Object> values) {
    StringBuilder sb = new StringBuilder("ctx:");
    for (var e : new TreeMap<>(values).entrySet()) {
      sb.append(e.getKey().length()).append(':').append(e.getKey());
      Object v = e.getValue();
      if (v == null) {
        sb.append('~');
      } else {
        String text = String.valueOf(v);
        sb.append('=').append(v.getClass().getName()).append('#').append(text.length()).append(':').append(text);
      }
    }
    return sb.toString();
  }

  @Override
  public String toString() {
    return "ContextualValues" + values.keySet();
  }
}
