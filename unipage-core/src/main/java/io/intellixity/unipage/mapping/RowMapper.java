package io.intellixity.unipage.mapping;

import java.util.Map;

/** Pure function from a raw row (column label to value) to the declared output shape. */
@FunctionalInterface
public interface RowMapper<T> {
  T map(Map<String, Object> row);
}
