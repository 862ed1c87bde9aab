package io.intellixity.unipage.source;

import java.util.Objects;

/**
 * Query text as a function of filters.\n
 *
 * Implementations must be deterministic and side-effect free. Only the query shape may depend on filters;
 * values always travel as bound parameters (see {@link QueryTemplate} for identifier substitution).
 */
@FunctionalInterface
public interface QueryText<F> {
  String render(F filters);

  /** Constant text, independent of filters. */
  static <F> QueryText<F> of(String text) {
    Objects.requireNonNull(text, "text");
    if (text.isBlank()) throw new IllegalArgumentException("query text is blank");
    return new Constant<>(text);
  }

  record Constant<F>(String text) implements QueryText<F> {
    @Override
    public String render(F filters) {
      return text;
    }
  }
}
