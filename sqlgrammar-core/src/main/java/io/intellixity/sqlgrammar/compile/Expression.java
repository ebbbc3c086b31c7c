package io.intellixity.sqlgrammar.compile;

import java.util.Objects;

/**
 * SQL text that is emitted as-is instead of being quoted or parameterized.
 * <p>
 * Implementations may render themselves against the active {@link Grammar}, e.g. to wrap
 * the column names they reference.
 */
@FunctionalInterface
public interface Expression {
  String value(Grammar grammar);

  static Expression raw(String sql) {
    return new Raw(sql);
  }

  record Raw(String sql) implements Expression {
    public Raw {
      Objects.requireNonNull(sql, "sql");
    }

    @Override
    public String value(Grammar grammar) {
      return sql;
    }
  }
}
