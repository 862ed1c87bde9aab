package io.intellixity.unipage.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.Enumeration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Properties;

/**
 * spring.factories-style loader for pluggable backends (dialects).\n
 *
 * Looks up all {@code META-INF/unipage.factories} resources on the classpath.\n
 * Each resource is a Java Properties file of the form:\n
 *
 * <pre>
 * io.intellixity.unipage.jdbc.dialect.JdbcDialect=com.acme.OracleDialect,com.acme.Db2Dialect
 * </pre>
 *
 * Values may be comma-separated; order of discovery is preserved and duplicates are dropped.
 */
public final class UnipageFactoriesLoader {
  public static final String RESOURCE = "META-INF/unipage.factories";

  private UnipageFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = UnipageFactoriesLoader.class.getClassLoader();

    String key = spiType.getName();
    LinkedHashSet<String> implNames = new LinkedHashSet<>();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new IllegalStateException("Failed to enumerate " + RESOURCE, e);
    }

    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new IllegalStateException("Failed to load " + RESOURCE + " from " + url, e);
      }

      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) out.add(newInstance(implName, spiType, cl));
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!spiType.isAssignableFrom(raw)) {
        throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
      }
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for " + spiType.getName(), e);
    }
  }
}
