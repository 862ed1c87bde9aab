package io.intellixity.unipage.context;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

/**
 * Resolves one contextual value from a transport-level request object (servlet request, RPC metadata...).\n
 *
 * Providers are declared at registration time and run by the transport before a handler is invoked.
 */
public interface ContextualProvider {
  /** Key under which the resolved value is published. */
  String key();

  /** Request type this provider understands. */
  Class<?> requestType();

  /** Resolve the value; may return null, may throw (e.g. a rejection) to abort the request. */
  Object resolve(Object request);

  static <R> ContextualProvider of(String key, Class<R> requestType, Function<? super R, ?> resolver) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(requestType, "requestType");
    Objects.requireNonNull(resolver, "resolver");
    if (key.isBlank()) throw new IllegalArgumentException("contextual provider key is blank");
    return new ContextualProvider() {
      @Override public String key() { return key; }
      @Override public Class<?> requestType() { return requestType; }

      @Override
      public Object resolve(Object request) {
        if (!requestType.isInstance(request)) {
          throw new IllegalArgumentException("Contextual provider '" + key + "' expects " + requestType.getName()
              + " but got " + (request == null ? "null" : request.getClass().getName()));
        }
        return resolver.apply(requestType.cast(request));
      }
    };
  }

  /** Run providers in declaration order and snapshot their values. */
  static ContextualValues resolveAll(List<? extends ContextualProvider> providers, Object request) {
    if (providers == null || providers.isEmpty()) return ContextualValues.empty();
    Map<String, Object> out = new LinkedHashMap<>();
    for (ContextualProvider p : providers) {
      out.put(p.key(), p.resolve(request));
    }
    return ContextualValues.of(out);
  }

  /** Validate provider keys are unique and return an immutable copy. */
  static List<ContextualProvider> copyOf(List<? extends ContextualProvider> providers) {
    if (providers == null || providers.isEmpty()) return List.of();
    List<ContextualProvider> out = new ArrayList<>(providers.size());
    List<String> keys = new ArrayList<>();
    for (ContextualProvider p : providers) {
      Objects.requireNonNull(p, "contextual provider");
      if (keys.contains(p.key())) throw new IllegalArgumentException("Duplicate contextual provider key: " + p.key());
      keys.add(p.key());
      out.add(p);
    }
    return List.copyOf(out);
  }
}
