package io.intellixity.unipage.examples.web;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.error.RejectedException;
import org.junit.jupiter.api.Test;
import org.springframework.http.ResponseEntity;

import static org.junit.jupiter.api.Assertions.*;

final class QueryExceptionHandlerTest {
  private final QueryExceptionHandler handler = new QueryExceptionHandler();

  @Test
  void statusPerKind() {
    assertEquals(503, QueryExceptionHandler.status(ErrorKind.ENGINE_CONNECTIVITY));
    assertEquals(503, QueryExceptionHandler.status(ErrorKind.CANCELLED));
    assertEquals(500, QueryExceptionHandler.status(ErrorKind.QUERY_EXECUTION));
    assertEquals(500, QueryExceptionHandler.status(ErrorKind.ROW_MAPPING));
    assertEquals(400, QueryExceptionHandler.status(ErrorKind.INVALID_PAGINATION));
    assertEquals(400, QueryExceptionHandler.status(ErrorKind.UNKNOWN_PRIORITY_SOURCE));
    assertEquals(400, QueryExceptionHandler.status(ErrorKind.INVALID_FILTER));
  }

  @Test
  void rejectionCarriesItsOwnStatusAndReason() {
    ResponseEntity<QueryExceptionHandler.ErrorBody> r = handler.onQueryException(new RejectedException(451, "legal hold"));

    assertEquals(451, r.getStatusCode().value());
    assertEquals("interceptor_rejected", r.getBody().code());
    assertEquals("legal hold", r.getBody().message());
  }

  @Test
  void bodyHasStableCode() {
    ResponseEntity<QueryExceptionHandler.ErrorBody> r =
        handler.onQueryException(new QueryException(ErrorKind.ENGINE_CONNECTIVITY, "Engine 's2' select failed"));

    assertEquals(503, r.getStatusCode().value());
    assertEquals("engine_connectivity", r.getBody().code());
  }
}
