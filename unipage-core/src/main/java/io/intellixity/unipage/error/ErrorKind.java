package io.intellixity.unipage.error;

/** Failure categories surfaced to the transport layer; {@link #code()} values are stable. */
public enum ErrorKind {
  /** Source unreachable, connection refused, or timed out. */
  ENGINE_CONNECTIVITY("engine_connectivity"),
  /** Malformed query or parameter mismatch reported by the engine. */
  QUERY_EXECUTION("query_execution"),
  /** A returned row cannot be coerced into the declared output shape. */
  ROW_MAPPING("row_mapping"),
  /** An interceptor deliberately short-circuited the request. */
  INTERCEPTOR_REJECTED("interceptor_rejected"),
  /** Negative limit or offset. */
  INVALID_PAGINATION("invalid_pagination"),
  /** A priority override references an unregistered source. */
  UNKNOWN_PRIORITY_SOURCE("unknown_priority_source"),
  /** A filter value cannot be used to shape a dynamic query. */
  INVALID_FILTER("invalid_filter"),
  /** The caller abandoned the request before it completed. */
  CANCELLED("cancelled");

  private final String code;

  ErrorKind(String code) {
    this.code = code;
  }

  public String code() {
    return code;
  }
}
