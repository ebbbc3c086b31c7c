package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Expression;
import io.intellixity.sqlgrammar.plan.*;
import io.intellixity.sqlgrammar.spi.sql.DefaultDialect;
import io.intellixity.sqlgrammar.spi.sql.UnsupportedFeatureException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

import static io.intellixity.sqlgrammar.plan.Predicates.*;
import static org.junit.jupiter.api.Assertions.*;

final class WhereCompilerTest {
  private final QueryGrammar g = new QueryGrammar(new DefaultDialect());

  private String wheres(Predicate... ps) {
    QueryPlan q = QueryPlan.from("t");
    for (Predicate p : ps) q.where(p);
    return g.compileWheres(q);
  }

  @Test
  void emptyListCompilesToEmptyString() {
    assertEquals("", g.compileWheres(QueryPlan.from("t")));
  }

  @Test
  void conjunctionsAndLeadingBoolean() {
    assertEquals("where a = ? or b = ?", wheres(where("a", "=", 1), orWhere("b", "=", 2)));
    assertEquals("where a = ? and b = ?", wheres(orWhere("a", "=", 1), where("b", "=", 2)));
  }

  @Test
  void questionMarkInOperatorIsDoubled() {
    assertEquals("where data ??| ?", wheres(where("data", "?|", List.of("a"))));
  }

  @Test
  void expressionValuesAreInlined() {
    assertEquals("where created_at < now()", wheres(where("created_at", "<", Expression.raw("now()"))));
  }

  @Test
  void inLists() {
    assertEquals("where id in (?, ?, ?)", wheres(in("id", List.of(1, 2, 3))));
    assertEquals("where id not in (?)", wheres(notIn("id", List.of(1))));
    assertEquals("where 0 = 1", wheres(in("id", List.of())));
    assertEquals("where 1 = 1", wheres(notIn("id", List.of())));
  }

  @Test
  void rawInListsInlineIntegers() {
    assertEquals("where id in (1, 2, 3)", wheres(integerIn("id", List.of(1, 2L, 3))));
    assertEquals("where id not in (4)", wheres(integerNotIn("id", List.of(4))));
    assertEquals("where 0 = 1", wheres(integerIn("id", List.of())));
    assertThrows(MalformedPlanException.class, () -> wheres(integerIn("id", List.of("1; drop table t"))));
  }

  @Test
  void nullChecks() {
    assertEquals("where a is null and b is not null", wheres(isNull("a"), notNull("b")));
  }

  @Test
  void betweenVariants() {
    assertEquals("where age between ? and ?", wheres(between("age", 18, 65)));
    assertEquals("where age not between ? and ?",
        wheres(new Predicate.Between("age", List.of(1, 2), true, Clause.AND)));
    assertEquals("where x between lo and hi",
        wheres(new Predicate.BetweenColumns("x", List.of("lo", "hi"), false, Clause.AND)));
    assertEquals("where ? not between lo and hi",
        wheres(new Predicate.ValueBetween(5, List.of("lo", "hi"), true, Clause.AND)));
  }

  @Test
  void betweenNeedsTwoBounds() {
    assertThrows(MalformedPlanException.class,
        () -> wheres(new Predicate.Between("age", List.of(1, 2, 3), false, Clause.AND)));
    assertThrows(MalformedPlanException.class,
        () -> wheres(new Predicate.BetweenColumns("x", List.of("lo"), false, Clause.AND)));
  }

  @Test
  void nullBoundsStayPlaceholders() {
    assertEquals("where age between ? and ?",
        wheres(new Predicate.Between("age", Arrays.asList(null, 9), false, Clause.AND)));
  }

  @Test
  void dateBasedUsesFunctionCall() {
    assertEquals("where day(created_at) = ?",
        wheres(new Predicate.DateBased(Predicate.DatePart.DAY, "created_at", "=", 3, Clause.AND)));
    assertEquals("where date(created_at) >= ?",
        wheres(new Predicate.DateBased(Predicate.DatePart.DATE, "created_at", ">=", "2024-01-01", Clause.AND)));
  }

  @Test
  void columnComparison() {
    assertEquals("where a.x = b.y", wheres(columns("a.x", "=", "b.y")));
  }

  @Test
  void nestedGroupIsParenthesized() {
    QueryPlan group = group(where("b", "=", 2), orWhere("c", "=", 3));
    assertEquals("where a = ? or (b = ? or c = ?)",
        wheres(where("a", "=", 1), new Predicate.Nested(group, Clause.OR)));
  }

  @Test
  void nestedGroupInsideNestedGroup() {
    QueryPlan inner = group(where("c", "=", 3), orWhere("d", "=", 4));
    QueryPlan outer = group(where("b", "=", 2), nested(inner));
    assertEquals("where (b = ? and (c = ? or d = ?))", wheres(nested(outer)));
  }

  @Test
  void emptyNestedGroupIsRejected() {
    assertThrows(MalformedPlanException.class, () -> wheres(nested(group())));
  }

  @Test
  void subSelectAndExists() {
    QueryPlan sub = QueryPlan.from("orders").select("user_id");
    assertEquals("where id in (select user_id from orders)",
        wheres(new Predicate.Sub("id", "in", sub, Clause.AND)));
    assertEquals("where exists (select * from orders)", wheres(exists(QueryPlan.from("orders"))));
    assertEquals("where not exists (select * from orders)",
        wheres(new Predicate.Exists(QueryPlan.from("orders"), true, Clause.AND)));
  }

  @Test
  void rowValues() {
    assertEquals("where (a, b) > (?, ?)",
        wheres(new Predicate.RowValues(List.of("a", "b"), ">", List.of(1, 2), Clause.AND)));
    assertThrows(MalformedPlanException.class,
        () -> wheres(new Predicate.RowValues(List.of("a", "b"), ">", List.of(1), Clause.AND)));
  }

  @Test
  void likeOnDefaultDialect() {
    assertEquals("where name like ?", wheres(like("name", "%a%")));
    assertEquals("where name not like ?", wheres(new Predicate.Like("name", "%a%", true, false, Clause.AND)));
    UnsupportedFeatureException ex = assertThrows(UnsupportedFeatureException.class,
        () -> wheres(new Predicate.Like("name", "%a%", false, true, Clause.AND)));
    assertTrue(ex.getMessage().contains("case sensitive like"));
  }

  @Test
  void bitwiseFallsBackToBasic() {
    assertEquals("where flags & ?", wheres(new Predicate.Bitwise("flags", "&", 4, Clause.AND)));
  }

  @Test
  void jsonAndFullTextNeedDialectSupport() {
    assertThrows(UnsupportedFeatureException.class, () -> wheres(jsonContains("meta->tags", "[]")));
    assertThrows(UnsupportedFeatureException.class,
        () -> wheres(new Predicate.JsonOverlaps("meta->tags", "[]", false, Clause.AND)));
    assertThrows(UnsupportedFeatureException.class,
        () -> wheres(new Predicate.JsonContainsKey("meta->a", false, Clause.AND)));
    assertThrows(UnsupportedFeatureException.class,
        () -> wheres(new Predicate.JsonLength("meta->a", ">", 1, Clause.AND)));
    assertThrows(UnsupportedFeatureException.class,
        () -> wheres(new Predicate.JsonBoolean("meta->on", "=", true, Clause.AND)));
    assertThrows(UnsupportedFeatureException.class,
        () -> wheres(fullText(List.of("body"), "cat", Map.of())));
  }

  @Test
  void rawAndExpressionPredicates() {
    assertEquals("where a > 1 or b < 2",
        wheres(raw("a > 1"), new Predicate.OfExpression(Expression.raw("b < 2"), Clause.OR)));
    assertEquals("where upper(name) = ?",
        wheres(new Predicate.OfExpression(gr -> "upper(" + gr.wrap("name") + ") = ?", Clause.AND)));
  }

  @Test
  void joinConditionsUseOn() {
    JoinSpec j = JoinSpec.of("inner", "b", columns("a.id", "=", "b.a_id"),
        nested(group(where("b.x", "=", 1), orWhere("b.y", "=", 2))));
    assertEquals("on a.id = b.a_id and (b.x = ? or b.y = ?)", g.compileWheres(j));
  }
}
