package io.intellixity.unipage.examples.web;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.error.RejectedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/** Maps {@link QueryException} kinds to HTTP statuses with a {@code {code, message}} body. */
@RestControllerAdvice
public final class QueryExceptionHandler {
  private static final Logger log = LoggerFactory.getLogger(QueryExceptionHandler.class);

  public record ErrorBody(String code, String message) {}

  @ExceptionHandler(QueryException.class)
  public ResponseEntity<ErrorBody> onQueryException(QueryException e) {
    int status = status(e);
    if (status >= 500) {
      log.error("unipage.http status={} code={} msg={}", status, e.code(), e.getMessage(), e);
    } else if (log.isDebugEnabled()) {
      log.debug("unipage.http status={} code={} msg={}", status, e.code(), e.getMessage());
    }
    String message = (e instanceof RejectedException r) ? r.reason() : e.getMessage();
    return ResponseEntity.status(status).body(new ErrorBody(e.code(), message));
  }

  static int status(QueryException e) {
    if (e instanceof RejectedException r) return r.status();
    return status(e.kind());
  }

  static int status(ErrorKind kind) {
    return switch (kind) {
      case ENGINE_CONNECTIVITY, CANCELLED -> 503;
      case QUERY_EXECUTION, ROW_MAPPING -> 500;
      case INVALID_PAGINATION, UNKNOWN_PRIORITY_SOURCE, INVALID_FILTER -> 400;
      // a rejection without a carried status
      case INTERCEPTOR_REJECTED -> 403;
    };
  }
}
