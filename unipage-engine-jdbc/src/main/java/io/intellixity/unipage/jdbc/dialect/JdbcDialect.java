package io.intellixity.unipage.jdbc.dialect;

import io.intellixity.unipage.jdbc.JdbcSettings;
import io.intellixity.unipage.jdbc.SqlStatement;
import io.intellixity.unipage.spi.sql.Dialect;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Dialect for JDBC engines: URL shape, parameter binding and error classification.\n
 *
 * Implementations are discovered through {@code META-INF/unipage.factories} (see {@link JdbcDialects}).
 */
public interface JdbcDialect extends Dialect<SqlStatement> {
  /** JDBC URL for the settings; an explicit {@link JdbcSettings#url()} wins. */
  String jdbcUrl(JdbcSettings settings);

  /** Bind one positional value (1-based). */
  void bind(PreparedStatement ps, int position, Object value) throws SQLException;
}
