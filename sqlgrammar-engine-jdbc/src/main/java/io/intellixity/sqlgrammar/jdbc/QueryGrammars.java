package io.intellixity.sqlgrammar.jdbc;

import io.intellixity.sqlgrammar.jdbc.grammar.QueryGrammar;
import io.intellixity.sqlgrammar.spi.sql.DiscoveredDialectRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Builds {@link QueryGrammar}s with dialects discovered from META-INF/sqlgrammar.factories. */
public final class QueryGrammars {
  private static final Logger log = LoggerFactory.getLogger(QueryGrammars.class);

  private QueryGrammars() {}

  /** Options from {@code sqlgrammar.properties} (or defaults), dialect resolved by its id. */
  public static QueryGrammar fromClasspath() {
    return create(GrammarOptions.load());
  }

  public static QueryGrammar forDialect(String dialectId) {
    return create(GrammarOptions.defaults().withDialect(dialectId));
  }

  public static QueryGrammar create(GrammarOptions options) {
    DiscoveredDialectRegistry registry = new DiscoveredDialectRegistry();
    QueryGrammar g = new QueryGrammar(registry.resolve(options.dialect()), options);
    log.debug("sqlgrammar.grammar dialect={} known={} tablePrefix={}", g.dialect().id(), registry.ids(), options.tablePrefix());
    return g;
  }
}
