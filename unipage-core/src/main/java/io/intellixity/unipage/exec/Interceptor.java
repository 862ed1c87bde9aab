package io.intellixity.unipage.exec;

import java.util.Map;

/**
 * Middleware around query execution.\n
 *
 * An interceptor may mutate the context and call {@code next}, return its own result without calling
 * {@code next} (short-circuit), post-process what {@code next} returns, or throw to abort the request.
 * Interceptors are registered once and shared by all requests, so they must not keep per-request state in
 * fields.
 */
@FunctionalInterface
public interface Interceptor {
  Result<Map<String, Object>> intercept(QueryContext context, QueryHandler next);
}
