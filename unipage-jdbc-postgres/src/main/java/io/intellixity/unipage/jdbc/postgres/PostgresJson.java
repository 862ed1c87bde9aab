package io.intellixity.unipage.jdbc.postgres;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.error.QueryException;
import io.intellixity.unipage.mapping.Json;

final class PostgresJson {
  private PostgresJson() {}

  static String write(Object value) {
    try {
      return Json.mapper().writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new QueryException(ErrorKind.QUERY_EXECUTION, "Parameter cannot be written as JSON: " + e.getOriginalMessage(), e);
    }
  }
}
