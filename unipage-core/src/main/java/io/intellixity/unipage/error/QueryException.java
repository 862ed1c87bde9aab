package io.intellixity.unipage.error;

import java.util.Objects;

/**
 * Structured request-time failure.\n
 *
 * Every failure that reaches a handler boundary is (or wraps into) one of these, so the transport can map
 * {@link #kind()} to a status without inspecting messages.
 */
public class QueryException extends RuntimeException {
  private final ErrorKind kind;

  public QueryException(ErrorKind kind, String message) {
    super(message);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public QueryException(ErrorKind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public ErrorKind kind() {
    return kind;
  }

  /** Shorthand for {@code kind().code()}. */
  public String code() {
    return kind.code();
  }
}
