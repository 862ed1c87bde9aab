package io.intellixity.unipage.interceptors;

import io.intellixity.unipage.error.RejectedException;
import io.intellixity.unipage.exec.Interceptor;
import io.intellixity.unipage.exec.QueryContext;
import io.intellixity.unipage.exec.QueryHandler;
import io.intellixity.unipage.exec.Result;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Lets a request through only when required contextual values are present and every check passes.\n
 *
 * - missing (or null) required value: rejected with 401\n
 * - failed check: rejected with the check's status and reason (403 by default)\n
 */
public final class AuthorizationInterceptor implements Interceptor {
  public static final int UNAUTHORIZED = 401;
  public static final int FORBIDDEN = 403;

  private final Set<String> requiredKeys;
  private final List<Check> checks;

  private record Check(Predicate<QueryContext> predicate, int status, String reason) {
  }

  private AuthorizationInterceptor(Builder b) {
    this.requiredKeys = Set.copyOf(b.requiredKeys);
    this.checks = List.copyOf(b.checks);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Shorthand for {@code builder().require(keys).build()}. */
  public static AuthorizationInterceptor requiring(String... keys) {
    Builder b = builder();
    for (String k : keys) b.require(k);
    return b.build();
  }

  @Override
  public Result<Map<String, Object>> intercept(QueryContext ctx, QueryHandler next) {
    for (String key : requiredKeys) {
      if (ctx.contextual(key) == null) {
        throw new RejectedException(UNAUTHORIZED, "Missing required contextual value '" + key + "'");
      }
    }
    for (Check c : checks) {
      if (!c.predicate().test(ctx)) throw new RejectedException(c.status(), c.reason());
    }
    return next.handle(ctx);
  }

  public static final class Builder {
    private final Set<String> requiredKeys = new LinkedHashSet<>();
    private final List<Check> checks = new ArrayList<>();

    private Builder() {}

    public Builder require(String key) {
      Objects.requireNonNull(key, "key");
      if (key.isBlank()) throw new IllegalArgumentException("key must not be blank");
      requiredKeys.add(key);
      return this;
    }

    public Builder check(Predicate<QueryContext> predicate) {
      return check(predicate, FORBIDDEN, "Forbidden");
    }

    public Builder check(Predicate<QueryContext> predicate, int status, String reason) {
      Objects.requireNonNull(predicate, "predicate");
      if (status < 400 || status > 599) throw new IllegalArgumentException("status must be a 4xx/5xx code: " + status);
      checks.add(new Check(predicate, status, Objects.requireNonNull(reason, "reason")));
      return this;
    }

    public AuthorizationInterceptor build() {
      return new AuthorizationInterceptor(this);
    }
  }
}
