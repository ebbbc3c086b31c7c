package io.intellixity.sqlgrammar.util;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style loader.
 *
 * Looks up all {@code META-INF/sqlgrammar.factories} resources on the classpath.
 * Each resource is a Java Properties file keyed by SPI type name:
 *
 * <pre>
 * io.intellixity.sqlgrammar.spi.sql.Dialect=com.acme.MyDialect,com.acme.OtherDialect
 * </pre>
 *
 * Values may be comma-separated. Whitespace is ignored.
 * <p>
 * This is how {@code Dialect} implementations in separate jars (the Postgres dialect, for one)
 * become resolvable by id without the compiler depending on them. Each jar ships its own
 * factories file. Entries keep classpath order and repeated class names are instantiated once.
 */
public final class SqlGrammarFactoriesLoader {
  public static final String RESOURCE = "META-INF/sqlgrammar.factories";

  private SqlGrammarFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = SqlGrammarFactoriesLoader.class.getClassLoader();

    String key = spiType.getName();
    List<String> implNames = new ArrayList<>();

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

    // the same jar can be on the classpath twice
    LinkedHashSet<String> uniq = new LinkedHashSet<>(implNames);
    List<T> out = new ArrayList<>(uniq.size());
    for (String implName : uniq) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new IllegalStateException("Unknown class " + implName + " listed for SPI " + spiType.getName(), e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new IllegalArgumentException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
