package io.intellixity.sqlgrammar.plan;

import java.util.List;
import java.util.Objects;

/** Aggregate function applied over the selected rows, e.g. {@code count(*)}. */
public record Aggregate(String function, List<Object> columns) {
  public Aggregate {
    Objects.requireNonNull(function, "function");
    columns = List.copyOf(columns == null || columns.isEmpty() ? List.of("*") : columns);
  }

  public static Aggregate of(String function, Object... columns) {
    return new Aggregate(function, List.of(columns));
  }
}
