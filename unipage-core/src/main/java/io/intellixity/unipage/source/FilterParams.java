package io.intellixity.unipage.source;

import java.util.List;

/** Positional parameters derived from filters only (count queries, shared filter params). */
@FunctionalInterface
public interface FilterParams<F> {
  List<?> params(F filters);
}
