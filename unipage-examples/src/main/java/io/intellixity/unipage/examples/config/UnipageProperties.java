package io.intellixity.unipage.examples.config;

import io.intellixity.unipage.union.UnknownTotalPolicy;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "unipage")
public class UnipageProperties {
  private int defaultLimit = 100;
  /** Source backing the single-source endpoints; defaults to the first configured source. */
  private String primarySource;
  private final Union union = new Union();
  private final Map<String, SourceDb> sources = new LinkedHashMap<>();

  public int getDefaultLimit() { return defaultLimit; }
  public void setDefaultLimit(int defaultLimit) { this.defaultLimit = defaultLimit; }
  public String getPrimarySource() { return primarySource; }
  public void setPrimarySource(String primarySource) { this.primarySource = primarySource; }
  public Union getUnion() { return union; }
  public Map<String, SourceDb> getSources() { return sources; }

  public static class Union {
    private Duration timeout = Duration.ofSeconds(10);
    private UnknownTotalPolicy unknownTotalPolicy = UnknownTotalPolicy.UNBOUNDED;
    /** Default priority; sources not listed follow in configuration order. */
    private List<String> priority = new ArrayList<>();

    public Duration getTimeout() { return timeout; }
    public void setTimeout(Duration timeout) { this.timeout = timeout; }
    public UnknownTotalPolicy getUnknownTotalPolicy() { return unknownTotalPolicy; }
    public void setUnknownTotalPolicy(UnknownTotalPolicy unknownTotalPolicy) { this.unknownTotalPolicy = unknownTotalPolicy; }
    public List<String> getPriority() { return priority; }
    public void setPriority(List<String> priority) { this.priority = priority; }
  }

  public static class SourceDb {
    private String dialect = "sqlite";
    private String url;
    private String host;
    private Integer port;
    private String database;
    private String username;
    private String password;
    private String schema;
    private int poolSize = 5;
    private int queryTimeoutSeconds;

    /** Number of example books written into an empty store at startup (0 = none). */
    private int seedRows;

    public String getDialect() { return dialect; }
    public void setDialect(String dialect) { this.dialect = dialect; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }
    public String getDatabase() { return database; }
    public void setDatabase(String database) { this.database = database; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getPoolSize() { return poolSize; }
    public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
    public int getQueryTimeoutSeconds() { return queryTimeoutSeconds; }
    public void setQueryTimeoutSeconds(int queryTimeoutSeconds) { this.queryTimeoutSeconds = queryTimeoutSeconds; }
    public int getSeedRows() { return seedRows; }
    public void setSeedRows(int seedRows) { this.seedRows = seedRows; }
  }
}
