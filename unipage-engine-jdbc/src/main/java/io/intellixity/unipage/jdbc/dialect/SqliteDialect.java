package io.intellixity.unipage.jdbc.dialect;

import io.intellixity.unipage.error.ErrorKind;
import io.intellixity.unipage.jdbc.JdbcSettings;

import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.temporal.TemporalAccessor;
import java.util.UUID;

/**
 * SQLite via xerial sqlite-jdbc. {@code database} is the file path.\n
 *
 * java.time values and UUIDs are bound as ISO text, which is how SQLite stores them.
 */
public final class SqliteDialect extends AbstractJdbcDialect {
  private static final int SQLITE_BUSY = 5;
  private static final int SQLITE_LOCKED = 6;
  private static final int SQLITE_CANTOPEN = 14;

  @Override public String id() { return "sqlite"; }

  @Override
  public String jdbcUrl(JdbcSettings settings) {
    if (settings.url() != null) return settings.url();
    if (settings.database() == null) throw new IllegalArgumentException("sqlite needs url or database (file path)");
    return "jdbc:sqlite:" + settings.database();
  }

  @Override
  public void bind(PreparedStatement ps, int position, Object value) throws SQLException {
    if (value instanceof TemporalAccessor || value instanceof UUID) {
      ps.setString(position, value.toString());
      return;
    }
    super.bind(ps, position, value);
  }

  @Override
  protected ErrorKind classifyVendor(SQLException e) {
    // Primary result code lives in the low byte of extended codes
    int code = e.getErrorCode() & 0xff;
    if (code == SQLITE_BUSY || code == SQLITE_LOCKED || code == SQLITE_CANTOPEN) return ErrorKind.ENGINE_CONNECTIVITY;
    return null;
  }
}
