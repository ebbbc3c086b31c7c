package io.intellixity.sqlgrammar.spi.sql;

import io.intellixity.sqlgrammar.util.SqlGrammarFactoriesLoader;

import java.util.*;

/**
 * Dialect registry built via discovery (META-INF/sqlgrammar.factories).
 *
 * Resolution semantics:
 * - ids are matched case-insensitively;
 * - a null or blank id resolves to {@link DefaultDialect#ID};
 * - two dialects claiming the same id is a configuration error.
 */
public final class DiscoveredDialectRegistry {
  private final Map<String, Dialect> byId;

  public DiscoveredDialectRegistry() {
    this(SqlGrammarFactoriesLoader.load(Dialect.class));
  }

  DiscoveredDialectRegistry(List<Dialect> dialects) {
    Map<String, Dialect> m = new LinkedHashMap<>();
    for (Dialect d : dialects) {
      if (d == null) continue;
      String id = normalize(d.id());
      Dialect prev = m.putIfAbsent(id, d);
      if (prev != null && prev.getClass() != d.getClass()) {
        throw new IllegalStateException("Duplicate dialect id '" + id + "': " +
            prev.getClass().getName() + " and " + d.getClass().getName());
      }
    }
    this.byId = Collections.unmodifiableMap(m);
  }

  public Dialect resolve(String id) {
    Dialect d = byId.get(normalize(id));
    if (d == null) {
      throw new IllegalArgumentException("No dialect registered for id=" + id + ", known=" + byId.keySet());
    }
    return d;
  }

  public Set<String> ids() {
    return byId.keySet();
  }

  private static String normalize(String id) {
    if (id == null || id.isBlank()) return DefaultDialect.ID;
    return id.trim().toLowerCase(Locale.ROOT);
  }
}
