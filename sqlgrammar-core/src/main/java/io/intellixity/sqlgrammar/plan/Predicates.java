package io.intellixity.sqlgrammar.plan;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/** Shorthand constructors for the common predicate shapes (AND conjunction unless stated). */
public final class Predicates {
  private Predicates() {}

  public static Predicate.Basic where(Object column, String operator, Object value) {
    return new Predicate.Basic(column, operator, value, Clause.AND);
  }

  public static Predicate.Basic orWhere(Object column, String operator, Object value) {
    return new Predicate.Basic(column, operator, value, Clause.OR);
  }

  public static Predicate.Raw raw(String sql) { return new Predicate.Raw(sql, Clause.AND); }

  public static Predicate.In in(Object column, List<?> values) { return new Predicate.In(column, values, Clause.AND); }
  public static Predicate.NotIn notIn(Object column, List<?> values) { return new Predicate.NotIn(column, values, Clause.AND); }
  public static Predicate.InRaw integerIn(Object column, List<?> values) { return new Predicate.InRaw(column, values, Clause.AND); }
  public static Predicate.NotInRaw integerNotIn(Object column, List<?> values) { return new Predicate.NotInRaw(column, values, Clause.AND); }

  public static Predicate.Null isNull(Object column) { return new Predicate.Null(column, Clause.AND); }
  public static Predicate.NotNull notNull(Object column) { return new Predicate.NotNull(column, Clause.AND); }

  public static Predicate.Between between(Object column, Object min, Object max) {
    return new Predicate.Between(column, Arrays.asList(min, max), false, Clause.AND);
  }

  public static Predicate.Like like(Object column, Object value) {
    return new Predicate.Like(column, value, false, false, Clause.AND);
  }

  public static Predicate.Column columns(Object first, String operator, Object second) {
    return new Predicate.Column(first, operator, second, Clause.AND);
  }

  public static Predicate.Nested nested(QueryPlan group) { return new Predicate.Nested(group, Clause.AND); }
  public static Predicate.Exists exists(QueryPlan query) { return new Predicate.Exists(query, false, Clause.AND); }

  public static Predicate.JsonContains jsonContains(String column, Object value) {
    return new Predicate.JsonContains(column, value, false, Clause.AND);
  }

  public static Predicate.FullText fullText(List<?> columns, Object value, Map<String, Object> options) {
    return new Predicate.FullText(columns, value, options, Clause.AND);
  }

  /** Plan holding only predicates, for {@link Predicate.Nested} groups. */
  public static QueryPlan group(Predicate... wheres) {
    QueryPlan q = new QueryPlan();
    for (Predicate p : wheres) q.where(p);
    return q;
  }
}
