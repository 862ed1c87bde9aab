package io.intellixity.unipage.jdbc;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection settings for one JDBC source.\n
 *
 * Either {@code url} is given, or the dialect builds one from host/port/database.
 */
public final class JdbcSettings {
  private final String url;
  private final String host;
  private final Integer port;
  private final String database;
  private final String user;
  private final String password;
  private final String schema;
  private final int poolSize;
  private final Duration connectionTimeout;
  private final int queryTimeoutSeconds;

  private JdbcSettings(Builder b) {
    this.url = blankToNull(b.url);
    this.host = blankToNull(b.host);
    this.port = b.port;
    this.database = blankToNull(b.database);
    this.user = blankToNull(b.user);
    this.password = b.password;
    this.schema = blankToNull(b.schema);
    this.poolSize = b.poolSize;
    this.connectionTimeout = b.connectionTimeout;
    this.queryTimeoutSeconds = b.queryTimeoutSeconds;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String url() { return url; }
  public String host() { return host; }
  public Integer port() { return port; }
  public String database() { return database; }
  public String user() { return user; }
  public String password() { return password; }
  public String schema() { return schema; }
  public int poolSize() { return poolSize; }
  public Duration connectionTimeout() { return connectionTimeout; }
  /** Per-statement timeout; 0 means none. */
  public int queryTimeoutSeconds() { return queryTimeoutSeconds; }

  private static String blankToNull(String s) {
    return (s == null || s.isBlank()) ? null : s.trim();
  }

  @Override
  public String toString() {
    // No password
    return "JdbcSettings{url=" + url + ", host=" + host + ", port=" + port + ", database=" + database
        + ", user=" + user + ", schema=" + schema + ", poolSize=" + poolSize
        + ", queryTimeoutSeconds=" + queryTimeoutSeconds + "}";
  }

  public static final class Builder {
    private String url;
    private String host;
    private Integer port;
    private String database;
    private String user;
    private String password;
    private String schema;
    private int poolSize = 5;
    private Duration connectionTimeout = Duration.ofSeconds(5);
    private int queryTimeoutSeconds;

    private Builder() {}

    public Builder url(String url) { this.url = url; return this; }
    public Builder host(String host) { this.host = host; return this; }
    public Builder port(Integer port) { this.port = port; return this; }
    public Builder database(String database) { this.database = database; return this; }
    public Builder user(String user) { this.user = user; return this; }
    public Builder password(String password) { this.password = password; return this; }
    public Builder schema(String schema) { this.schema = schema; return this; }

    public Builder poolSize(int poolSize) {
      if (poolSize < 1) throw new IllegalArgumentException("poolSize must be >= 1: " + poolSize);
      this.poolSize = poolSize;
      return this;
    }

    public Builder connectionTimeout(Duration connectionTimeout) {
      this.connectionTimeout = Objects.requireNonNull(connectionTimeout, "connectionTimeout");
      return this;
    }

    public Builder queryTimeoutSeconds(int seconds) {
      if (seconds < 0) throw new IllegalArgumentException("queryTimeoutSeconds must be >= 0: " + seconds);
      this.queryTimeoutSeconds = seconds;
      return this;
    }

    public JdbcSettings build() {
      return new JdbcSettings(this);
    }
  }
}
