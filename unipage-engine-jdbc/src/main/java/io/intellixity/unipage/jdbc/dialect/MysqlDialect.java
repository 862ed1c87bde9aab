package io.intellixity.unipage.jdbc.dialect;

import io.intellixity.unipage.error.ErrorKind;

import java.sql.SQLException;

/** MySQL / MariaDB via Connector/J. */
public final class MysqlDialect extends AbstractJdbcDialect {
  /** ER_QUERY_TIMEOUT (max_execution_time exceeded). */
  private static final int ER_QUERY_TIMEOUT = 3024;
  /** ER_QUERY_INTERRUPTED. */
  private static final int ER_QUERY_INTERRUPTED = 1317;

  @Override public String id() { return "mysql"; }
  @Override protected String urlPrefix() { return "jdbc:mysql://"; }
  @Override protected int defaultPort() { return 3306; }

  @Override
  protected ErrorKind classifyVendor(SQLException e) {
    int code = e.getErrorCode();
    if (code == ER_QUERY_TIMEOUT || code == ER_QUERY_INTERRUPTED) return ErrorKind.ENGINE_CONNECTIVITY;
    return null;
  }
}
