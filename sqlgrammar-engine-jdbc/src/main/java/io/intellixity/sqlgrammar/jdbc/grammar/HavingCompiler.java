package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.plan.HavingPredicate;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;

import java.util.ArrayList;
import java.util.List;

/** Compiles a having list into a {@code having ...} fragment. */
final class HavingCompiler implements HavingPredicate.Visitor<String> {
  private static final String PREFIX = "having ";

  private final Grammar g;

  HavingCompiler(Grammar g) {
    this.g = g;
  }

  String compile(List<HavingPredicate> havings) {
    if (havings.isEmpty()) return "";
    List<String> parts = new ArrayList<>(havings.size());
    for (HavingPredicate h : havings) parts.add(h.clause().keyword() + " " + h.accept(this));
    return PREFIX + WhereCompiler.removeLeadingBoolean(String.join(" ", parts));
  }

  @Override
  public String visitRaw(HavingPredicate.Raw having) {
    return having.sql();
  }

  @Override
  public String visitBasic(HavingPredicate.Basic having) {
    return g.wrap(having.column()) + " " + having.operator() + " " + g.parameter(having.value());
  }

  @Override
  public String visitBetween(HavingPredicate.Between having) {
    if (having.values().size() != 2) {
      throw new MalformedPlanException("having between on '" + having.column() + "' needs exactly 2 bounds, got "
          + having.values().size());
    }
    return g.wrap(having.column()) + (having.not() ? " not between " : " between ")
        + g.parameter(having.values().get(0)) + " and " + g.parameter(having.values().get(1));
  }

  @Override
  public String visitNull(HavingPredicate.Null having) {
    return g.wrap(having.column()) + " is null";
  }

  @Override
  public String visitNotNull(HavingPredicate.NotNull having) {
    return g.wrap(having.column()) + " is not null";
  }

  @Override
  public String visitBit(HavingPredicate.Bit having) {
    return "(" + g.wrap(having.column()) + " " + having.operator() + " " + g.parameter(having.value()) + ") != 0";
  }

  @Override
  public String visitExpression(HavingPredicate.OfExpression having) {
    return having.expression().value(g);
  }

  @Override
  public String visitNested(HavingPredicate.Nested having) {
    String inner = compile(having.query().havings());
    if (!inner.startsWith(PREFIX)) throw new MalformedPlanException("Nested having group is empty");
    return "(" + inner.substring(PREFIX.length()) + ")";
  }
}
