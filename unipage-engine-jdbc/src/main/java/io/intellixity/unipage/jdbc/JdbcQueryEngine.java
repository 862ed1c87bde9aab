package io.intellixity.unipage.jdbc;

import io.intellixity.unipage.jdbc.dialect.JdbcDialect;
import io.intellixity.unipage.spi.exec.AbstractQueryEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Query engine over a {@link DataSource}.\n
 *
 * A connection is borrowed per call and returned before the call completes, so one engine serves any number
 * of concurrent requests (the pool bounds actual concurrency). {@link #close()} closes the data source when
 * this engine owns it.
 */
public final class JdbcQueryEngine extends AbstractQueryEngine<SqlStatement, JdbcHandle> implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngine.class);

  private final DataSource ds;
  private final int queryTimeoutSeconds;
  private final boolean ownsDataSource;

  public JdbcQueryEngine(JdbcHandle handle, JdbcDialect dialect, int queryTimeoutSeconds, boolean ownsDataSource) {
    super(Objects.requireNonNull(dialect, "dialect"), Objects.requireNonNull(handle, "handle"));
    if (queryTimeoutSeconds < 0) throw new IllegalArgumentException("queryTimeoutSeconds < 0");
    this.ds = handle.client();
    this.queryTimeoutSeconds = queryTimeoutSeconds;
    this.ownsDataSource = ownsDataSource;
  }

  /** Engine over a caller-owned data source, no statement timeout. */
  public JdbcQueryEngine(JdbcHandle handle, JdbcDialect dialect) {
    this(handle, dialect, 0, false);
  }

  @Override
  protected List<Map<String, Object>> executeSelect(SqlStatement ss) throws SQLException {
    long start = System.nanoTime();
    debugSql("SELECT", ss);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = prepare(c, ss);
         ResultSet rs = ps.executeQuery()) {
      List<Map<String, Object>> out = new JdbcRowReader(rs).readAll();
      debugDone("SELECT", out.size(), System.nanoTime() - start);
      return out;
    }
  }

  @Override
  protected long executeCount(SqlStatement ss) throws SQLException {
    long start = System.nanoTime();
    debugSql("COUNT", ss);
    try (Connection c = ds.getConnection();
         PreparedStatement ps = prepare(c, ss);
         ResultSet rs = ps.executeQuery()) {
      if (!rs.next()) return 0;
      long v = rs.getLong(1);
      debugDone("COUNT", v, System.nanoTime() - start);
      return v;
    }
  }

  private PreparedStatement prepare(Connection c, SqlStatement ss) throws SQLException {
    PreparedStatement ps = c.prepareStatement(ss.sql());
    try {
      if (queryTimeoutSeconds > 0) ps.setQueryTimeout(queryTimeoutSeconds);
      JdbcDialect dialect = (JdbcDialect) dialect();
      for (int i = 0; i < ss.params().size(); i++) {
        dialect.bind(ps, i + 1, ss.params().get(i));
      }
      return ps;
    } catch (SQLException | RuntimeException e) {
      ps.close();
      throw e;
    }
  }

  @Override
  public void close() {
    if (!ownsDataSource) return;
    if (ds instanceof AutoCloseable ac) {
      try {
        ac.close();
      } catch (Exception e) {
        log.warn("unipage.jdbc op=close handleId={} error={}", id(), e.toString());
      }
    }
  }

  private void debugSql(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return;
    JdbcHandle h = handle();
    log.debug("unipage.jdbc op={} dialect={} bindCount={} handleId={} schema={} sql={}",
        op, dialect().id(), ss.paramCount(), h.id(), h.schema(), ss.sql());

    // TRACE: bind summary only (no raw values; avoids PII leaks)
    if (log.isTraceEnabled() && !ss.params().isEmpty()) {
      int idx = 1;
      for (Object v : ss.params()) {
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("unipage.jdbc bind index={} valueType={} valueLen={}", idx++, vType, vLen);
      }
    }
  }

  private void debugDone(String op, Object result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("unipage.jdbc_done op={} handleId={} durationMs={} result={}",
        op, id(), durationNanos / 1_000_000.0, result);
  }
}
