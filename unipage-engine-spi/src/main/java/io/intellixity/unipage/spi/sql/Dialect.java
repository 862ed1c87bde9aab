package io.intellixity.unipage.spi.sql;

import io.intellixity.unipage.error.ErrorKind;

import java.util.List;

/** Backend-specific SPI: compiles raw query text plus positional parameters, and classifies backend failures. */
public interface Dialect<S extends NativeStatement> {
  String id();

  /**
   * Compile query text with positional parameters into a native statement.
   * Malformed text or a parameter-count mismatch fails with {@link ErrorKind#QUERY_EXECUTION}.
   */
  S compile(String queryText, List<?> params);

  /** Failure category of a backend exception; defaults to {@link ErrorKind#QUERY_EXECUTION}. */
  default ErrorKind classify(Throwable error) {
    return ErrorKind.QUERY_EXECUTION;
  }
}
