package io.intellixity.unipage.jdbc.dialect;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.jdbc.JdbcSettings;
import io.intellixity.unipage.jdbc.PlaceholderCompiler;
import io.intellixity.unipage.jdbc.SqlStatement;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLNonTransientConnectionException;
import java.sql.SQLTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;

/**
 * Shared JDBC dialect behavior.\n
 *
 * Subclasses typically override:\n
 * - {@link #urlPrefix()} / {@link #defaultPort()} for URL building\n
 * - {@link #classifyVendor(SQLException)} for vendor error codes\n
 * - {@link #bind(PreparedStatement, int, Object)} for types the driver does not take natively\n
 */
public abstract class AbstractJdbcDialect implements JdbcDialect {

  @Override
  public SqlStatement compile(String queryText, List<?> params) {
    List<Object> values = new ArrayList<>(params);
    return new SqlStatement(PlaceholderCompiler.toJdbcSql(queryText, values.size()), values);
  }

  @Override
  public String jdbcUrl(JdbcSettings settings) {
    if (settings.url() != null) return settings.url();
    if (settings.host() == null || settings.database() == null) {
      throw new IllegalArgumentException("Dialect '" + id() + "' needs url or host+database: " + settings);
    }
    int port = (settings.port() == null) ? defaultPort() : settings.port();
    return urlPrefix() + settings.host() + ":" + port + "/" + settings.database();
  }

  @Override
  public void bind(PreparedStatement ps, int position, Object value) throws SQLException {
    if (value == null) {
      ps.setNull(position, Types.NULL);
      return;
    }
    if (value instanceof Enum<?> e) {
      ps.setString(position, e.name());
      return;
    }
    ps.setObject(position, value);
  }

  @Override
  public final ErrorKind classify(Throwable error) {
    for (Throwable t = error; t != null; t = t.getCause()) {
      if (t instanceof SQLTimeoutException) return ErrorKind.ENGINE_CONNECTIVITY;
      if (t instanceof SQLTransientConnectionException) return ErrorKind.ENGINE_CONNECTIVITY;
      if (t instanceof SQLNonTransientConnectionException) return ErrorKind.ENGINE_CONNECTIVITY;
      if (t instanceof SQLException sql) {
        String state = sql.getSQLState();
        if (state != null && state.startsWith("08")) return ErrorKind.ENGINE_CONNECTIVITY;
        ErrorKind vendor = classifyVendor(sql);
        if (vendor != null) return vendor;
      }
      if (t instanceof java.net.ConnectException || t instanceof java.net.SocketTimeoutException) {
        return ErrorKind.ENGINE_CONNECTIVITY;
      }
    }
    return ErrorKind.QUERY_EXECUTION;
  }

  /** Vendor-specific refinement; null means "no opinion". */
  protected ErrorKind classifyVendor(SQLException e) {
    return null;
  }

  protected String urlPrefix() {
    throw new IllegalArgumentException("Dialect '" + id() + "' cannot build a URL; set url explicitly");
  }

  protected int defaultPort() {
    return 0;
  }
}
