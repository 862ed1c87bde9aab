package io.intellixity.unipage.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.unipage.jdbc.dialect.JdbcDialect;

import java.util.Objects;

/** HikariCP pools built from {@link JdbcSettings}. */
public final class JdbcDataSources {
  private JdbcDataSources() {}

  public static HikariDataSource pooled(String poolName, JdbcDialect dialect, JdbcSettings settings) {
    Objects.requireNonNull(dialect, "dialect");
    Objects.requireNonNull(settings, "settings");
    HikariConfig cfg = new HikariConfig();
    cfg.setPoolName("unipage-" + Objects.requireNonNull(poolName, "poolName"));
    cfg.setJdbcUrl(dialect.jdbcUrl(settings));
    if (settings.user() != null) cfg.setUsername(settings.user());
    if (settings.password() != null) cfg.setPassword(settings.password());
    cfg.setMaximumPoolSize(settings.poolSize());
    cfg.setConnectionTimeout(settings.connectionTimeout().toMillis());
    // Connectivity problems surface on first query, not at construction
    cfg.setInitializationFailTimeout(-1);
    return new HikariDataSource(cfg);
  }
}
