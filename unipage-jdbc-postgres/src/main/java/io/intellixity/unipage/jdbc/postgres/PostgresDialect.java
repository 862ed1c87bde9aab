package io.intellixity.unipage.jdbc.postgres;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.jdbc.dialect.AbstractJdbcDialect;
import org.postgresql.util.PGobject;
import org.postgresql.util.PSQLState;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.Map;

/**
 * Postgres dialect implementation for JDBC.\n
 *
 * Keeps only Postgres-specific overrides: URL shape, JSON binding and error classification.
 * Generic behavior lives in {@link AbstractJdbcDialect}.
 */
public final class PostgresDialect extends AbstractJdbcDialect {
  @Override public String id() { return "postgres"; }
  @Override protected String urlPrefix() { return "jdbc:postgresql://"; }
  @Override protected int defaultPort() { return 5432; }

  /** Maps bind as {@code jsonb}. */
  @Override
  public void bind(PreparedStatement ps, int position, Object value) throws SQLException {
    if (value instanceof Map<?, ?> m) {
      PGobject obj = new PGobject();
      obj.setType("jsonb");
      obj.setValue(PostgresJson.write(m));
      ps.setObject(position, obj);
      return;
    }
    super.bind(ps, position, value);
  }

  @Override
  protected ErrorKind classifyVendor(SQLException e) {
    String state = e.getSQLState();
    if (state == null) return null;
    if (PSQLState.isConnectionError(state)) return ErrorKind.ENGINE_CONNECTIVITY;
    if (PSQLState.QUERY_CANCELED.getState().equals(state)) return ErrorKind.ENGINE_CONNECTIVITY;
    if (PSQLState.COMMUNICATION_ERROR.getState().equals(state)) return ErrorKind.ENGINE_CONNECTIVITY;
    return null;
  }
}
