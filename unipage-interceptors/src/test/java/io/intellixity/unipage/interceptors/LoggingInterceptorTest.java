package io.intellixity.unipage.interceptors;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.exec.Result;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class LoggingInterceptorTest {

  @Test
  void returnsDownstreamResultUnchanged() {
    Result<Map<String, Object>> expected = Result.of(List.of(Map.of("id", 1)), 7L);
    LoggingInterceptor logging = new LoggingInterceptor("user");

    Result<Map<String, Object>> r = logging.intercept(Contexts.select("books", 5, 0, Map.of("user", "alice")), ctx -> expected);

    assertSame(expected, r);
  }

  @Test
  void rethrowsFailures() {
    LoggingInterceptor logging = new LoggingInterceptor();
    QueryException boom = new QueryException(ErrorKind.ENGINE_CONNECTIVITY, "down");

    QueryException e = assertThrows(QueryException.class,
        () -> logging.intercept(Contexts.select("books", 5, 0, Map.of()), ctx -> { throw boom; }));
    assertSame(boom, e);

    IllegalStateException ise = new IllegalStateException("bug");
    assertSame(ise, assertThrows(IllegalStateException.class,
        () -> logging.intercept(Contexts.select("books", 5, 0, Map.of()), ctx -> { throw ise; })));
  }
}
