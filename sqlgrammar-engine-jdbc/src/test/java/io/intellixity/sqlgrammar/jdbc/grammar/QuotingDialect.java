package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.spi.sql.Dialect;

/** Minimal dialect that double-quotes identifiers. */
final class QuotingDialect implements Dialect {
  @Override public String id() { return "quoting"; }

  @Override
  public String wrapValue(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }
}
