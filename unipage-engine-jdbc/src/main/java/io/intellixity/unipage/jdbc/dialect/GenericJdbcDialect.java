package io.intellixity.unipage.jdbc.dialect;

/** Any JDBC driver; the URL must be given explicitly. */
public final class GenericJdbcDialect extends AbstractJdbcDialect {
  @Override public String id() { return "generic"; }
}
