package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.spi.sql.Dialect;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Inlines escaped binding values into SQL text, for logging and debugging only.
 *
 * Placeholders inside single-quoted literals are left alone. The pairs {@code \'}, {@code ''}
 * and {@code ??} are copied as-is.
 */
final class RawSqlSubstitutor {
  private final Dialect dialect;

  RawSqlSubstitutor(Dialect dialect) {
    this.dialect = dialect;
  }

  String substitute(String sql, List<?> bindings) {
    Deque<String> escaped = new ArrayDeque<>(bindings.size());
    for (Object b : bindings) escaped.add(dialect.escape(b, b instanceof byte[]));

    StringBuilder out = new StringBuilder(sql.length() + 16 * bindings.size());
    boolean inLiteral = false;
    for (int i = 0; i < sql.length(); i++) {
      char c = sql.charAt(i);
      char next = i + 1 < sql.length() ? sql.charAt(i + 1) : 0;
      if ((c == '\\' && next == '\'') || (c == '\'' && next == '\'') || (c == '?' && next == '?')) {
        out.append(c).append(next);
        i++;
      } else if (c == '\'') {
        out.append(c);
        inLiteral = !inLiteral;
      } else if (c == '?' && !inLiteral) {
        String v = escaped.poll();
        out.append(v == null ? "?" : v);
      } else {
        out.append(c);
      }
    }
    return out.toString();
  }
}
