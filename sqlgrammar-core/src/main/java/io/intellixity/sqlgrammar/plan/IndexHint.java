package io.intellixity.sqlgrammar.plan;

import java.util.Objects;

/** Index hint such as {@code force index (idx)}; only dialects with hint syntax render it. */
public record IndexHint(Type type, String index) {
  public IndexHint {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(index, "index");
  }

  public enum Type { HINT, FORCE, IGNORE }
}
