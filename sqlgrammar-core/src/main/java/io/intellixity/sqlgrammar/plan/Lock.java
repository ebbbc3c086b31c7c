package io.intellixity.sqlgrammar.plan;

import java.util.Objects;

/**
 * Row lock requested by a select.
 * <p>
 * {@link Mode#UPDATE} and {@link Mode#SHARED} are translated by the dialect;
 * {@link Mode#RAW} carries the literal lock clause to append.
 */
public record Lock(Mode mode, String sql) {
  public Lock {
    Objects.requireNonNull(mode, "mode");
    if (mode == Mode.RAW && (sql == null || sql.isBlank())) {
      throw new IllegalArgumentException("RAW lock requires sql");
    }
  }

  public enum Mode { UPDATE, SHARED, RAW }

  public static Lock forUpdate() { return new Lock(Mode.UPDATE, null); }
  public static Lock shared() { return new Lock(Mode.SHARED, null); }
  public static Lock raw(String sql) { return new Lock(Mode.RAW, sql); }
}
