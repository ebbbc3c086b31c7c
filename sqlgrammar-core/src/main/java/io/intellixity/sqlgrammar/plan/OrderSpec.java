package io.intellixity.sqlgrammar.plan;

import java.util.Locale;
import java.util.Objects;

/** One {@code order by} entry: a column with a direction, or a precompiled fragment. */
public sealed interface OrderSpec {

  record Column(Object column, Direction direction) implements OrderSpec {
    public Column {
      Objects.requireNonNull(column, "column");
      direction = (direction == null) ? Direction.ASC : direction;
    }
  }

  record Raw(String sql) implements OrderSpec {
    public Raw {
      Objects.requireNonNull(sql, "sql");
    }
  }

  enum Direction {
    ASC, DESC;

    public String keyword() { return name().toLowerCase(Locale.ROOT); }
  }

  static OrderSpec asc(Object column) { return new Column(column, Direction.ASC); }
  static OrderSpec desc(Object column) { return new Column(column, Direction.DESC); }
  static OrderSpec raw(String sql) { return new Raw(sql); }
}
