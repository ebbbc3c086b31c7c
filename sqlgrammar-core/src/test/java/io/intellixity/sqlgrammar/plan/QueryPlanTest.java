package io.intellixity.sqlgrammar.plan;

import io.intellixity.sqlgrammar.compile.BindingType;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class QueryPlanTest {
  @Test
  void copyDoesNotShareMutableState() {
    QueryPlan q = QueryPlan.from("users")
        .where(Predicates.where("id", "=", 1))
        .orderBy(OrderSpec.asc("name"))
        .withOffset(3)
        .addBinding(BindingType.WHERE, 1);

    QueryPlan c = q.copy()
        .select("id")
        .where(Predicates.isNull("deleted_at"))
        .withOffset(null)
        .addBinding(BindingType.ORDER, "x");

    assertNull(q.columns());
    assertEquals(1, q.wheres().size());
    assertEquals(3, q.offset());
    assertEquals(List.of(1), q.bindings().flatten());

    assertEquals(List.of("id"), c.columns());
    assertEquals(2, c.wheres().size());
    assertNull(c.offset());
    assertEquals(List.of(1, "x"), c.bindings().flatten());
  }

  @Test
  void distinctOnImpliesDistinct() {
    QueryPlan q = QueryPlan.from("users").withDistinctOn(List.of("email"));
    assertTrue(q.distinct());
    assertEquals(List.of("email"), q.distinctOn());
  }

  @Test
  void predicatesDefaultToAndConjunction() {
    assertEquals(Clause.AND, new Predicate.Null("a", null).clause());
    assertEquals(Clause.OR, Predicates.orWhere("a", "=", 1).clause());
    assertEquals("or", Clause.OR.keyword());
  }

  @Test
  void predicateListsAcceptNullValues() {
    Predicate.In in = Predicates.in("a", java.util.Arrays.asList(1, null));
    assertEquals(2, in.values().size());
    assertNull(in.values().get(1));
  }
}
