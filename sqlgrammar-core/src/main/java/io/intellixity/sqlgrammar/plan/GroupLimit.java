package io.intellixity.sqlgrammar.plan;

import java.util.Objects;

/** Caps the number of rows per partition of {@code column}. */
public record GroupLimit(Object column, int value) {
  public GroupLimit {
    Objects.requireNonNull(column, "column");
    if (value < 0) throw new IllegalArgumentException("group limit must be >= 0");
  }
}
