package io.intellixity.unipage.jdbc;

import io.intellixity.unipage.jdbc.dialect.JdbcDialect;
import io.intellixity.unipage.jdbc.dialect.JdbcDialects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;

/** Factory methods for {@link JdbcQueryEngine}. */
public final class JdbcQueryEngines {
  private static final Logger log = LoggerFactory.getLogger(JdbcQueryEngines.class);

  private JdbcQueryEngines() {}

  /** Pooled engine; the returned engine owns (and closes) its pool. */
  public static JdbcQueryEngine pooled(String id, String dialectId, JdbcSettings settings) {
    JdbcDialect dialect = JdbcDialects.byId(dialectId);
    log.info("unipage.jdbc op=pool engine={} dialect={} settings={}", id, dialect.id(), settings);
    DataSource ds = JdbcDataSources.pooled(id, dialect, settings);
    return new JdbcQueryEngine(new JdbcHandle(id, ds, settings.schema()), dialect, settings.queryTimeoutSeconds(), true);
  }

  /** Engine over a caller-owned data source. */
  public static JdbcQueryEngine of(String id, String dialectId, DataSource ds) {
    return new JdbcQueryEngine(new JdbcHandle(id, ds), JdbcDialects.byId(dialectId));
  }
}
