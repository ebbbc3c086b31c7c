package io.intellixity.sqlgrammar.spi.sql;

/** Dialect with every hook left at its {@link Dialect} default: no quoting, no optional features. */
public final class DefaultDialect implements Dialect {
  public static final String ID = "default";

  @Override public String id() { return ID; }
}
