package io.intellixity.unipage.engine;

import java.util.List;
import java.util.Map;

/**
 * Read-only execution capability over one backing store.\n
 *
 * Implementations own their connection/session lifecycle and must be safe for concurrent use.
 * Failures surface as {@link io.intellixity.unipage.error.QueryException}; an engine never returns
 * partial rows and never turns a failure into an empty result.
 */
public interface QueryEngine {
  /** Stable identifier of this engine instance (logging, cache keys). */
  String id();

  /** Execute a SELECT with positional parameters; rows are keyed by column label in column order. */
  List<Map<String, Object>> select(String query, List<?> params);

  /** Execute a COUNT with positional parameters. */
  long count(String query, List<?> params);
}
