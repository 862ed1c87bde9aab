package io.intellixity.unipage.exec;

import io.intellixity.unipage.context.ContextualValues;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Per-request, per-source state that interceptors operate on.\n
 *
 * Query texts and parameter lists are mutable so interceptors can rewrite them before the terminal runs.
 * Source identity, phase, filters and the pagination window are fixed: the union coordinator relies on
 * the window it computed. Contextual values resolved by the transport are read-only; interceptors publish
 * additional values for the rest of the chain through {@link #putDerived(String, Object)}.
 * <p>
 * Instances are confined to a single execution and are not thread-safe.
 */
public final class QueryContext {
  private final String sourceId;
  private final QueryPhase phase;
  private final Object filters;
  private final int limit;
  private final int offset;
  private final ContextualValues contextualValues;
  private final Map<String, Object> derived = new LinkedHashMap<>();

  private String selectQuery;
  private List<Object> selectParams;
  private String countQuery;
  private List<Object> countParams;

  public QueryContext(String sourceId,
                      QueryPhase phase,
                      String selectQuery,
                      List<?> selectParams,
                      String countQuery,
                      List<?> countParams,
                      Object filters,
                      int limit,
                      int offset,
                      ContextualValues contextualValues) {
    this.sourceId = Objects.requireNonNull(sourceId, "sourceId");
    this.phase = Objects.requireNonNull(phase, "phase");
    Pagination.requireValid(limit, offset);
    this.selectQuery = selectQuery;
    this.selectParams = mutableCopy(selectParams);
    this.countQuery = countQuery;
    this.countParams = mutableCopy(countParams);
    this.filters = filters;
    this.limit = limit;
    this.offset = offset;
    this.contextualValues = (contextualValues == null) ? ContextualValues.empty() : contextualValues;
  }

  public String sourceId() { return sourceId; }
  public QueryPhase phase() { return phase; }
  public int limit() { return limit; }
  public int offset() { return offset; }

  public Object filters() {
    return filters;
  }

  /** Typed view of the filters; throws if they are of another type. */
  public <F> F filters(Class<F> type) {
    Objects.requireNonNull(type, "type");
    if (filters == null) return null;
    if (!type.isInstance(filters)) {
      throw new IllegalStateException("Filters of source '" + sourceId + "' are " + filters.getClass().getName()
          + ", not " + type.getName());
    }
    return type.cast(filters);
  }

  public String selectQuery() { return selectQuery; }
  public List<Object> selectParams() { return selectParams; }
  public String countQuery() { return countQuery; }
  public List<Object> countParams() { return countParams; }

  public void selectQuery(String selectQuery) {
    this.selectQuery = selectQuery;
  }

  public void selectParams(List<?> selectParams) {
    this.selectParams = mutableCopy(selectParams);
  }

  /** Setting a null count query suppresses counting for this execution. */
  public void countQuery(String countQuery) {
    this.countQuery = countQuery;
  }

  public void countParams(List<?> countParams) {
    this.countParams = mutableCopy(countParams);
  }

  /** Values resolved by the transport before the chain started. */
  public ContextualValues contextualValues() {
    return contextualValues;
  }

  /** Derived value if an interceptor published one, else the transport-resolved value, else null. */
  public Object contextual(String key) {
    if (derived.containsKey(key)) return derived.get(key);
    return contextualValues.get(key);
  }

  /**
   * Publish a value for interceptors further down the chain.
   * Keys resolved by the transport cannot be overridden.
   */
  public void putDerived(String key, Object value) {
    Objects.requireNonNull(key, "key");
    if (contextualValues.contains(key)) {
      throw new IllegalStateException("Contextual value '" + key + "' is resolved by the transport and is read-only");
    }
    derived.put(key, value);
  }

  public Map<String, Object> derivedValues() {
    return Collections.unmodifiableMap(derived);
  }

  private static List<Object> mutableCopy(List<?> params) {
    return (params == null) ? new ArrayList<>() : new ArrayList<>(params);
  }

  @Override
  public String toString() {
    return "QueryContext{source=" + sourceId + ", phase=" + phase + ", limit=" + limit + ", offset=" + offset
        + ", selectParams=" + selectParams.size() + ", countParams=" + countParams.size() + "}";
  }
}
