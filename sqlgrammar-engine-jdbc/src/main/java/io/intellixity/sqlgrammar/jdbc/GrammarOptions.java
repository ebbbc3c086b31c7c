package io.intellixity.sqlgrammar.jdbc;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Properties;

/**
 * Settings fixed when a grammar is built.
 *
 * @param dialect    id resolved through the dialect registry
 * @param tablePrefix prepended to every table name (and table alias)
 * @param rowAlias   row-number column of the group-limit emulation
 * @param tableAlias derived table of the group-limit emulation
 * @param unionAlias derived table wrapping a union or having query under an aggregate
 */
public record GrammarOptions(String dialect, String tablePrefix, String rowAlias, String tableAlias, String unionAlias) {
  private static final Logger log = LoggerFactory.getLogger(GrammarOptions.class);

  /** Classpath resource read by {@link #load()}. */
  public static final String RESOURCE = "sqlgrammar.properties";

  public static final String KEY_DIALECT = "sqlgrammar.dialect";
  public static final String KEY_TABLE_PREFIX = "sqlgrammar.table-prefix";
  public static final String KEY_ROW_ALIAS = "sqlgrammar.alias.row";
  public static final String KEY_TABLE_ALIAS = "sqlgrammar.alias.table";
  public static final String KEY_UNION_ALIAS = "sqlgrammar.alias.union";

  public static final String DEFAULT_DIALECT = "default";
  public static final String DEFAULT_ROW_ALIAS = "sqlgrammar_row";
  public static final String DEFAULT_TABLE_ALIAS = "sqlgrammar_table";
  public static final String DEFAULT_UNION_ALIAS = "temp_table";

  public GrammarOptions {
    dialect = blankTo(dialect, DEFAULT_DIALECT).trim();
    tablePrefix = tablePrefix == null ? "" : tablePrefix;
    rowAlias = blankTo(rowAlias, DEFAULT_ROW_ALIAS);
    tableAlias = blankTo(tableAlias, DEFAULT_TABLE_ALIAS);
    unionAlias = blankTo(unionAlias, DEFAULT_UNION_ALIAS);
    if (rowAlias.equals(tableAlias)) {
      throw new IllegalArgumentException("Row alias and table alias must differ: " + rowAlias);
    }
  }

  public static GrammarOptions defaults() {
    return new GrammarOptions(null, null, null, null, null);
  }

  public static GrammarOptions fromProperties(Properties p) {
    return new GrammarOptions(
        p.getProperty(KEY_DIALECT),
        p.getProperty(KEY_TABLE_PREFIX),
        p.getProperty(KEY_ROW_ALIAS),
        p.getProperty(KEY_TABLE_ALIAS),
        p.getProperty(KEY_UNION_ALIAS)
    );
  }

  /** Reads {@value #RESOURCE} from the context class loader; defaults when absent. */
  public static GrammarOptions load() {
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = GrammarOptions.class.getClassLoader();
    return load(cl);
  }

  public static GrammarOptions load(ClassLoader cl) {
    try (InputStream in = cl.getResourceAsStream(RESOURCE)) {
      if (in == null) {
        log.debug("sqlgrammar.options resource={} found=false", RESOURCE);
        return defaults();
      }
      Properties p = new Properties();
      try (Reader r = new InputStreamReader(in, StandardCharsets.UTF_8)) {
        p.load(r);
      }
      GrammarOptions o = fromProperties(p);
      log.debug("sqlgrammar.options resource={} found=true dialect={} tablePrefix={}", RESOURCE, o.dialect(), o.tablePrefix());
      return o;
    } catch (IOException e) {
      throw new IllegalStateException("Failed to read " + RESOURCE, e);
    }
  }

  public GrammarOptions withDialect(String dialect) {
    return new GrammarOptions(dialect, tablePrefix, rowAlias, tableAlias, unionAlias);
  }

  public GrammarOptions withTablePrefix(String tablePrefix) {
    return new GrammarOptions(dialect, tablePrefix, rowAlias, tableAlias, unionAlias);
  }

  private static String blankTo(String v, String dflt) {
    return (v == null || v.isBlank()) ? dflt : v;
  }
}
