package io.intellixity.unipage.exec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@code i1(i2(...(in(terminal))))} from an ordered interceptor list.
 * <p>
 * The first interceptor is outermost: interceptors are entered in list order and exited in reverse.
 * An empty list yields the terminal itself.
 */
public final class InterceptorChain {
  private InterceptorChain() {}

  public static QueryHandler build(List<? extends Interceptor> interceptors, QueryHandler terminal) {
    Objects.requireNonNull(terminal, "terminal");
    QueryHandler handler = terminal;
    if (interceptors == null) return handler;
    for (int i = interceptors.size() - 1; i >= 0; i--) {
      Interceptor current = Objects.requireNonNull(interceptors.get(i), "interceptor");
      QueryHandler next = handler;
      handler = ctx -> {
        Result<Map<String, Object>> r = current.intercept(ctx, next);
        if (r == null) throw new IllegalStateException("Interceptor returned null: " + current.getClass().getName());
        return r;
      };
    }
    return handler;
  }

  /** Endpoint-level interceptors run outside source-level ones. */
  public static List<Interceptor> concat(List<? extends Interceptor> outer, List<? extends Interceptor> inner) {
    List<Interceptor> out = new ArrayList<>();
    if (outer != null) out.addAll(outer);
    if (inner != null) out.addAll(inner);
    return List.copyOf(out);
  }
}
