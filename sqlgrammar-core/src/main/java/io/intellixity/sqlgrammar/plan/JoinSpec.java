package io.intellixity.sqlgrammar.plan;

import java.util.List;
import java.util.Objects;

/**
 * A join target and its {@code on} predicates.
 * <p>
 * {@code joins} is null for a plain table; when present the table and those joins are
 * rendered as one parenthesized group. A lateral join's table is normally an
 * {@link io.intellixity.sqlgrammar.compile.Expression} holding {@code (subquery) as alias}.
 */
public record JoinSpec(Object table, String type, List<Predicate> wheres, List<JoinSpec> joins, boolean lateral) {
  public JoinSpec {
    Objects.requireNonNull(table, "table");
    type = (type == null || type.isBlank()) ? "inner" : type;
    wheres = List.copyOf(wheres == null ? List.of() : wheres);
    joins = (joins == null) ? null : List.copyOf(joins);
  }

  public static JoinSpec of(String type, Object table, Predicate... wheres) {
    return new JoinSpec(table, type, List.of(wheres), null, false);
  }

  public static JoinSpec lateral(String type, Object table) {
    return new JoinSpec(table, type, List.of(), null, true);
  }

  public JoinSpec withJoins(List<JoinSpec> nested) {
    return new JoinSpec(table, type, wheres, nested, lateral);
  }
}
