package io.intellixity.unipage.interceptors;

import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.exec.Interceptor;
import io.intellixity.unipage.exec.QueryContext;
import io.intellixity.unipage.exec.QueryHandler;
import io.intellixity.unipage.exec.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Logs one line per execution with timing. Parameter values are never logged.
 */
public final class LoggingInterceptor implements Interceptor {
  private static final Logger log = LoggerFactory.getLogger(LoggingInterceptor.class);

  private final String userKey;

  public LoggingInterceptor() {
    this(null);
  }

  /** @param userKey contextual key whose value is included as {@code user=} (null to omit) */
  public LoggingInterceptor(String userKey) {
    this.userKey = userKey;
  }

  @Override
  public Result<Map<String, Object>> intercept(QueryContext ctx, QueryHandler next) {
    long start = System.nanoTime();
    Object user = (userKey == null) ? null : ctx.contextual(userKey);
    try {
      Result<Map<String, Object>> r = next.handle(ctx);
      if (log.isInfoEnabled()) {
        log.info("unipage.request source={} phase={} limit={} offset={} user={} rows={} total={} elapsedMs={}",
            ctx.sourceId(), ctx.phase(), ctx.limit(), ctx.offset(), user,
            r == null ? 0 : r.data().size(), r == null ? null : r.total(), elapsedMs(start));
      }
      return r;
    } catch (QueryException e) {
      log.warn("unipage.request source={} phase={} limit={} offset={} user={} failed code={} elapsedMs={} msg={}",
          ctx.sourceId(), ctx.phase(), ctx.limit(), ctx.offset(), user, e.code(), elapsedMs(start), e.getMessage());
      throw e;
    } catch (RuntimeException e) {
      log.warn("unipage.request source={} phase={} user={} failed error={} elapsedMs={}",
          ctx.sourceId(), ctx.phase(), user, e.getClass().getSimpleName(), elapsedMs(start), e);
      throw e;
    }
  }

  private static long elapsedMs(long startNanos) {
    return (System.nanoTime() - startNanos) / 1_000_000L;
  }
}
