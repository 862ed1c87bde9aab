package io.intellixity.unipage.interceptors;

import io.intellixity.unipage.exec.Interceptor;
import io.intellixity.unipage.exec.QueryContext;
import io.intellixity.unipage.exec.QueryHandler;
import io.intellixity.unipage.exec.QueryPhase;
import io.intellixity.unipage.exec.Result;
import io.intellixity.unipage.interceptors.internal.LruTtlCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Caches what the rest of the chain returns.\n
 *
 * The key covers source, phase, the final query texts and parameters as this interceptor sees them, the window,
 * and {@code ContextualValues.cacheKey()}, so users with different contextual values never share entries.
 * A hit short-circuits the chain. Register it after interceptors that rewrite queries.
 */
public final class CachingInterceptor implements Interceptor {
  private static final Logger log = LoggerFactory.getLogger(CachingInterceptor.class);

  private final LruTtlCache<Key, Result<Map<String, Object>>> cache;

  record Key(String sourceId, QueryPhase phase,
             String selectQuery, List<Object> selectParams,
             String countQuery, List<Object> countParams,
             int limit, int offset, String contextKey) {
  }

  public CachingInterceptor(int maxEntries, Duration ttl, Duration idle) {
    this(new LruTtlCache<>(maxEntries, millis(ttl, "ttl"), millis(idle, "idle")));
  }

  CachingInterceptor(LruTtlCache<Key, Result<Map<String, Object>>> cache) {
    this.cache = Objects.requireNonNull(cache, "cache");
  }

  @Override
  public Result<Map<String, Object>> intercept(QueryContext ctx, QueryHandler next) {
    Key key = keyOf(ctx);
    Result<Map<String, Object>> hit = cache.get(key);
    if (hit != null) {
      if (log.isDebugEnabled()) {
        log.debug("unipage.cache op=hit source={} phase={} limit={} offset={}", ctx.sourceId(), ctx.phase(), ctx.limit(), ctx.offset());
      }
      return hit;
    }
    Result<Map<String, Object>> fresh = next.handle(ctx);
    if (fresh != null) cache.put(key, frozen(fresh));
    return fresh;
  }

  public void invalidateAll() {
    cache.clear();
  }

  public int size() {
    return cache.size();
  }

  static Key keyOf(QueryContext ctx) {
    return new Key(ctx.sourceId(), ctx.phase(),
        ctx.selectQuery(), List.copyOf(nullSafe(ctx.selectParams())),
        ctx.countQuery(), List.copyOf(nullSafe(ctx.countParams())),
        ctx.limit(), ctx.offset(), ctx.contextualValues().cacheKey());
  }

  // List.copyOf rejects nulls; bound parameters may legitimately be null
  private static List<Object> nullSafe(List<Object> params) {
    List<Object> out = new ArrayList<>(params.size());
    for (Object p : params) out.add(p == null ? NullParam.INSTANCE : p);
    return out;
  }

  private enum NullParam { INSTANCE }

  private static Result<Map<String, Object>> frozen(Result<Map<String, Object>> r) {
    List<Map<String, Object>> rows = new ArrayList<>(r.data().size());
    for (Map<String, Object> row : r.data()) {
      rows.add(row == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(row)));
    }
    return Result.of(rows, r.total());
  }

  private static long millis(Duration d, String name) {
    Objects.requireNonNull(d, name);
    if (d.isNegative()) throw new IllegalArgumentException(name + " must be >= 0");
    return d.toMillis();
  }
}
