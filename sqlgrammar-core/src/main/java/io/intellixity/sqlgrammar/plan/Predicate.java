package io.intellixity.sqlgrammar.plan;

import io.intellixity.sqlgrammar.compile.Expression;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * One filter condition of a {@code where} or join {@code on} list.
 * <p>
 * Closed set of variants. Every variant dispatches through {@link Visitor}, so a new
 * variant cannot be added without every compiler growing a case for it.
 * Columns are {@code String} names or {@link Expression}s.
 */
public sealed interface Predicate {
  Clause clause();

  <R> R accept(Visitor<R> visitor);

  interface Visitor<R> {
    R visitRaw(Raw where);
    R visitBasic(Basic where);
    R visitBitwise(Bitwise where);
    R visitLike(Like where);
    R visitIn(In where);
    R visitNotIn(NotIn where);
    R visitInRaw(InRaw where);
    R visitNotInRaw(NotInRaw where);
    R visitNull(Null where);
    R visitNotNull(NotNull where);
    R visitBetween(Between where);
    R visitBetweenColumns(BetweenColumns where);
    R visitValueBetween(ValueBetween where);
    R visitDateBased(DateBased where);
    R visitColumn(Column where);
    R visitNested(Nested where);
    R visitSub(Sub where);
    R visitExists(Exists where);
    R visitRowValues(RowValues where);
    R visitJsonBoolean(JsonBoolean where);
    R visitJsonContains(JsonContains where);
    R visitJsonOverlaps(JsonOverlaps where);
    R visitJsonContainsKey(JsonContainsKey where);
    R visitJsonLength(JsonLength where);
    R visitFullText(FullText where);
    R visitExpression(OfExpression where);
  }

  enum DatePart {
    DATE, TIME, DAY, MONTH, YEAR;

    public String function() { return name().toLowerCase(Locale.ROOT); }
  }

  record Raw(String sql, Clause clause) implements Predicate {
    public Raw {
      Objects.requireNonNull(sql, "sql");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitRaw(this); }
  }

  record Basic(Object column, String operator, Object value, Clause clause) implements Predicate {
    public Basic {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitBasic(this); }
  }

  record Bitwise(Object column, String operator, Object value, Clause clause) implements Predicate {
    public Bitwise {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitBitwise(this); }
  }

  record Like(Object column, Object value, boolean not, boolean caseSensitive, Clause clause) implements Predicate {
    public Like {
      Objects.requireNonNull(column, "column");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitLike(this); }
  }

  record In(Object column, List<?> values, Clause clause) implements Predicate {
    public In {
      Objects.requireNonNull(column, "column");
      values = copyOf(values);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitIn(this); }
  }

  record NotIn(Object column, List<?> values, Clause clause) implements Predicate {
    public NotIn {
      Objects.requireNonNull(column, "column");
      values = copyOf(values);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitNotIn(this); }
  }

  /** Values are inlined into the SQL text; the dialect validates they are integers. */
  record InRaw(Object column, List<?> values, Clause clause) implements Predicate {
    public InRaw {
      Objects.requireNonNull(column, "column");
      values = copyOf(values);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitInRaw(this); }
  }

  /** Values are inlined into the SQL text; the dialect validates they are integers. */
  record NotInRaw(Object column, List<?> values, Clause clause) implements Predicate {
    public NotInRaw {
      Objects.requireNonNull(column, "column");
      values = copyOf(values);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitNotInRaw(this); }
  }

  record Null(Object column, Clause clause) implements Predicate {
    public Null {
      Objects.requireNonNull(column, "column");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitNull(this); }
  }

  record NotNull(Object column, Clause clause) implements Predicate {
    public NotNull {
      Objects.requireNonNull(column, "column");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitNotNull(this); }
  }

  record Between(Object column, List<?> values, boolean not, Clause clause) implements Predicate {
    public Between {
      Objects.requireNonNull(column, "column");
      values = copyOf(values);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitBetween(this); }
  }

  record BetweenColumns(Object column, List<?> columns, boolean not, Clause clause) implements Predicate {
    public BetweenColumns {
      Objects.requireNonNull(column, "column");
      columns = copyOf(columns);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitBetweenColumns(this); }
  }

  /** A fixed value between two columns: {@code ? between a and b}. */
  record ValueBetween(Object value, List<?> columns, boolean not, Clause clause) implements Predicate {
    public ValueBetween {
      columns = copyOf(columns);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitValueBetween(this); }
  }

  record DateBased(DatePart part, Object column, String operator, Object value, Clause clause) implements Predicate {
    public DateBased {
      Objects.requireNonNull(part, "part");
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitDateBased(this); }
  }

  record Column(Object first, String operator, Object second, Clause clause) implements Predicate {
    public Column {
      Objects.requireNonNull(first, "first");
      Objects.requireNonNull(operator, "operator");
      Objects.requireNonNull(second, "second");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitColumn(this); }
  }

  /** A parenthesized group: only the {@code wheres} of {@code query} are used. */
  record Nested(QueryPlan query, Clause clause) implements Predicate {
    public Nested {
      Objects.requireNonNull(query, "query");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitNested(this); }
  }

  record Sub(Object column, String operator, QueryPlan query, Clause clause) implements Predicate {
    public Sub {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      Objects.requireNonNull(query, "query");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitSub(this); }
  }

  record Exists(QueryPlan query, boolean not, Clause clause) implements Predicate {
    public Exists {
      Objects.requireNonNull(query, "query");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitExists(this); }
  }

  record RowValues(List<?> columns, String operator, List<?> values, Clause clause) implements Predicate {
    public RowValues {
      columns = copyOf(columns);
      Objects.requireNonNull(operator, "operator");
      values = copyOf(values);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitRowValues(this); }
  }

  record JsonBoolean(String column, String operator, Object value, Clause clause) implements Predicate {
    public JsonBoolean {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitJsonBoolean(this); }
  }

  record JsonContains(String column, Object value, boolean not, Clause clause) implements Predicate {
    public JsonContains {
      Objects.requireNonNull(column, "column");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitJsonContains(this); }
  }

  record JsonOverlaps(String column, Object value, boolean not, Clause clause) implements Predicate {
    public JsonOverlaps {
      Objects.requireNonNull(column, "column");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitJsonOverlaps(this); }
  }

  record JsonContainsKey(String column, boolean not, Clause clause) implements Predicate {
    public JsonContainsKey {
      Objects.requireNonNull(column, "column");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitJsonContainsKey(this); }
  }

  record JsonLength(String column, String operator, Object value, Clause clause) implements Predicate {
    public JsonLength {
      Objects.requireNonNull(column, "column");
      Objects.requireNonNull(operator, "operator");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitJsonLength(this); }
  }

  /** Options are dialect specific, e.g. {@code language} and {@code mode} for Postgres. */
  record FullText(List<?> columns, Object value, Map<String, Object> options, Clause clause) implements Predicate {
    public FullText {
      columns = copyOf(columns);
      options = Map.copyOf(options == null ? Map.of() : options);
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitFullText(this); }
  }

  record OfExpression(Expression expression, Clause clause) implements Predicate {
    public OfExpression {
      Objects.requireNonNull(expression, "expression");
      clause = orAnd(clause);
    }
    @Override public <R> R accept(Visitor<R> v) { return v.visitExpression(this); }
  }

  private static Clause orAnd(Clause c) {
    return c == null ? Clause.AND : c;
  }

  // List.copyOf rejects null elements; null is a legal binding value.
  private static List<?> copyOf(List<?> values) {
    if (values == null) return List.of();
    return Collections.unmodifiableList(new ArrayList<>(values));
  }
}
