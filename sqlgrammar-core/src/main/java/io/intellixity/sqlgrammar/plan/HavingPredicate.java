package io.intellixity.sqlgrammar.plan;

import io.intellixity.sqlgrammar.compile.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/** One condition of a {@code having} list. Same conjunction rules as {@link Predicate}. */
public sealed interface HavingPredicate {
  Clause clause();

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitRaw(Raw having);
    R visitBasic(Basic having);
    R visitBetween(Between having);
    R visitNull(Null having);
    R visitNotNull(NotNull having);
    R visitBit(Bit having);
    R visitExpression(OfExpression having);
    R visitNested(Nested having);
  }

  record Raw(String sql, Clause clause) implements HavingPredicate {
    public Raw {
      Objects.requireNonNull(sql, "sql");
      clause = clause == null ? Clause.AND : clause;
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitRaw(this); }
  }

  record Basic(Object column, String operator, Object value, Clause clause) implements HavingPredicate {
    public Basic {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      clause = clause == null ? Clause.AND : clause;
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitBasic(this); }
  }

  record Between(Object column, List<?> values, boolean not, Clause clause) implements HavingPredicate {
    public Between {
      Objects.requireNonNull(column, "column");
      values = values == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(values));
      clause = clause == null ? Clause.AND : clause;
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitBetween(this); }
  }

  record Null(Object column, Clause clause) implements HavingPredicate {
    public Null {
      Objects.requireNonNull(column, "column");
      clause = clause == null ? Clause.AND : clause;
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitNull(this); }
  }

  record NotNull(Object column, Clause clause) implements HavingPredicate {
    public NotNull {
      Objects.requireNonNull(column, "column");
      clause = clause == null ? Clause.AND : clause;
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitNotNull(this); }
  }

  /** {@code (column op ?) != 0}. */
  record Bit(Object column, String operator, Object value, Clause clause) implements HavingPredicate {
    public Bit {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      clause = clause == null ? Clause.AND : clause;
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitBit(this); }
  }

  record OfExpression(Expression expression, Clause clause) implements HavingPredicate {
    public OfExpression {
      Objects.requireNonNull(expression, "expression");
      clause = clause == null ? Clause.AND : clause;
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitExpression(this); }
  }

  /** A parenthesized group built from the {@code havings} of {@code query}. */
  record Nested(QueryPlan query, Clause clause) implements HavingPredicate {
    public Nested {
      Objects.requireNonNull(query, "query");
      clause = clause == null ? Clause.AND : clause;
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitNested(this); }
  }
}
