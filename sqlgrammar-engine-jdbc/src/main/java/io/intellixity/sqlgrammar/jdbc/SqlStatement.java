package io.intellixity.sqlgrammar.jdbc;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** Compiled SQL with its positional {@code ?} bindings, in placeholder order. */
public record SqlStatement(String sql, List<Object> bindings, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery(). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate() (no generated keys). */
    UPDATE,
    /** Execute via PreparedStatement.executeUpdate() + getGeneratedKeys(). */
    UPDATE_GENERATED_KEYS,
    /** Execute via PreparedStatement.executeQuery() and read the first column of the first row (RETURNING). */
    QUERY_ONE_VALUE
  }

  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    // null is a legal binding value, so no List.copyOf here
    bindings = bindings == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(bindings));
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Object> bindings) {
    this(sql, bindings, ExecKind.QUERY);
  }
}
