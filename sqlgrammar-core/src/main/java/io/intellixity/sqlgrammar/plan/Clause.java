package io.intellixity.sqlgrammar.plan;

import java.util.Locale;

/** Conjunction joining a predicate to the one before it. Ignored on the first predicate of a list. */
public enum Clause {
  AND,
  OR;

  public String keyword() {
    return name().toLowerCase(Locale.ROOT);
  }
}
