package io.intellixity.unipage.jdbc.dialect;

import io.intellixity.unipage.util.UnipageFactoriesLoader;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Lookup of JDBC dialects registered in {@code META-INF/unipage.factories}. */
public final class JdbcDialects {
  private JdbcDialects() {}

  public static JdbcDialect byId(String id) {
    if (id == null || id.isBlank()) throw new IllegalArgumentException("dialect id is blank");
    Map<String, JdbcDialect> all = discovered();
    JdbcDialect d = all.get(id.trim().toLowerCase(Locale.ROOT));
    if (d == null) throw new IllegalArgumentException("Unknown JDBC dialect '" + id + "'; available: " + all.keySet());
    return d;
  }

  public static Map<String, JdbcDialect> discovered() {
    List<JdbcDialect> loaded = UnipageFactoriesLoader.load(JdbcDialect.class);
    Map<String, JdbcDialect> out = new LinkedHashMap<>();
    for (JdbcDialect d : loaded) out.putIfAbsent(d.id().toLowerCase(Locale.ROOT), d);
    return out;
  }
}
