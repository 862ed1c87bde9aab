package io.intellixity.unipage.jdbc;

import io.intellixity.unipage.spi.sql.NativeStatement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** JDBC SQL with '?' placeholders plus positional values (null elements allowed). */
public record SqlStatement(String sql, List<Object> params) implements NativeStatement {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    params = (params == null) ? List.of() : Collections.unmodifiableList(new ArrayList<>(params));
  }

  @Override public String text() { return sql; }
  @Override public int paramCount() { return params.size(); }
}
