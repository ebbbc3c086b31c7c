package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Expression;
import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.compile.JsonPath;
import io.intellixity.sqlgrammar.spi.sql.Dialect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Quotes column and table references.
 *
 * Handles {@code x as y} aliases, dotted {@code schema.table.column} names and
 * {@code column->path} JSON selectors; the quoting of a single segment is the dialect's.
 */
final class IdentifierWrapper {
  private static final Pattern ALIAS = Pattern.compile("\\s+as\\s+", Pattern.CASE_INSENSITIVE);

  private final Grammar grammar;
  private final Dialect dialect;
  private final String tablePrefix;

  IdentifierWrapper(Grammar grammar, Dialect dialect, String tablePrefix) {
    this.grammar = grammar;
    this.dialect = dialect;
    this.tablePrefix = tablePrefix == null ? "" : tablePrefix;
  }

  String wrap(Object value) {
    Objects.requireNonNull(value, "identifier");
    if (value instanceof Expression e) return e.value(grammar);
    String s = value.toString();
    if (hasAlias(s)) {
      String[] parts = ALIAS.split(s, 2);
      return wrap(parts[0]) + " as " + wrapValue(parts[1]);
    }
    if (JsonPath.isSelector(s)) {
      return dialect.wrapJsonSelector(grammar, JsonPath.parse(s));
    }
    return wrapSegments(s.split("\\.", -1));
  }

  String wrapTable(Object table) {
    Objects.requireNonNull(table, "table");
    if (table instanceof Expression e) return e.value(grammar);
    String s = table.toString();
    if (hasAlias(s)) {
      String[] parts = ALIAS.split(s, 2);
      return wrapTable(parts[0]) + " as " + wrapValue(tablePrefix + parts[1]);
    }
    int dot = s.lastIndexOf('.');
    if (dot >= 0) {
      // prefix goes onto the table segment, not the schema
      String prefixed = s.substring(0, dot) + "." + tablePrefix + s.substring(dot + 1);
      List<String> out = new ArrayList<>();
      for (String seg : prefixed.split("\\.", -1)) out.add(wrapValue(seg));
      return String.join(".", out);
    }
    return wrapValue(tablePrefix + s);
  }

  String wrapValue(String segment) {
    if ("*".equals(segment)) return segment;
    return dialect.wrapValue(segment);
  }

  String columnize(Collection<?> columns) {
    List<String> out = new ArrayList<>(columns.size());
    for (Object c : columns) out.add(wrap(c));
    return String.join(", ", out);
  }

  private String wrapSegments(String[] segments) {
    List<String> out = new ArrayList<>(segments.length);
    for (int i = 0; i < segments.length; i++) {
      out.add(i == 0 && segments.length > 1 ? wrapTable(segments[i]) : wrapValue(segments[i]));
    }
    return String.join(".", out);
  }

  private static boolean hasAlias(String s) {
    return s.toLowerCase(Locale.ROOT).contains(" as ");
  }
}
