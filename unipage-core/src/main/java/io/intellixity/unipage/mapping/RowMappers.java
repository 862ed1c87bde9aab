package io.intellixity.unipage.mapping;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Map;
import java.util.Objects;

public final class RowMappers {
  private RowMappers() {}

  /** Raw rows as returned by the engine. */
  public static RowMapper<Map<String, Object>> identity() {
    return row -> row;
  }

  /**
   * Jackson {@code convertValue} into {@code type}; unknown columns are ignored, missing primitives and
   * type mismatches fail the row.
   */
  public static <T> RowMapper<T> jackson(Class<T> type) {
    return jackson(type, Json.mapper());
  }

  public static <T> RowMapper<T> jackson(Class<T> type, ObjectMapper mapper) {
    Objects.requireNonNull(type, "type");
    ObjectMapper strict = Objects.requireNonNull(mapper, "mapper").copy()
        .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    return row -> strict.convertValue(row, type);
  }
}
