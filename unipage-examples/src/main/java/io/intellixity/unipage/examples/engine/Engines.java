package io.intellixity.unipage.examples.engine;

import io.intellixity.unipage.examples.config.UnipageProperties;
import io.intellixity.unipage.jdbc.JdbcQueryEngine;
import io.intellixity.unipage.jdbc.JdbcQueryEngines;
import io.intellixity.unipage.jdbc.JdbcSettings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** One pooled engine per configured source, in configuration order. */
public final class Engines implements AutoCloseable {
  private final Map<String, JdbcQueryEngine> engines;

  public Engines(UnipageProperties props) {
    if (props.getSources().isEmpty()) throw new IllegalStateException("No sources configured under unipage.sources");
    Map<String, JdbcQueryEngine> out = new LinkedHashMap<>();
    for (Map.Entry<String, UnipageProperties.SourceDb> e : props.getSources().entrySet()) {
      out.put(e.getKey(), JdbcQueryEngines.pooled(e.getKey(), e.getValue().getDialect(), settings(e.getValue())));
    }
    this.engines = Collections.unmodifiableMap(out);
  }

  public JdbcQueryEngine get(String sourceId) {
    JdbcQueryEngine e = engines.get(sourceId);
    if (e == null) throw new IllegalArgumentException("Unknown source: " + sourceId + " (configured: " + engines.keySet() + ")");
    return e;
  }

  public List<String> ids() {
    return List.copyOf(engines.keySet());
  }

  @Override
  public void close() {
    engines.values().forEach(JdbcQueryEngine::close);
  }

  private static JdbcSettings settings(UnipageProperties.SourceDb db) {
    return JdbcSettings.builder()
        .url(db.getUrl())
        .host(db.getHost())
        .port(db.getPort())
        .database(db.getDatabase())
        .user(db.getUsername())
        .password(db.getPassword())
        .schema(db.getSchema())
        .poolSize(db.getPoolSize())
        .queryTimeoutSeconds(db.getQueryTimeoutSeconds())
        .build();
  }
}
