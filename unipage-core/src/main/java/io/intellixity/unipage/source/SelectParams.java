package io.intellixity.unipage.source;

import java.util.List;

/** Positional parameters of a select, given filters and the fetch window. */
@FunctionalInterface
public interface SelectParams<F> {
  List<?> params(F filters, int limit, int offset);
}
