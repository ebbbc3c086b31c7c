package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.BindingType;
import io.intellixity.sqlgrammar.jdbc.GrammarOptions;
import io.intellixity.sqlgrammar.jdbc.SqlStatement;
import io.intellixity.sqlgrammar.plan.Aggregate;
import io.intellixity.sqlgrammar.plan.GroupLimit;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import io.intellixity.sqlgrammar.plan.QueryPlan;
import io.intellixity.sqlgrammar.spi.sql.DefaultDialect;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static io.intellixity.sqlgrammar.plan.Predicates.where;
import static org.junit.jupiter.api.Assertions.*;

final class QueryGrammarTest {
  private final QueryGrammar g = new QueryGrammar(new DefaultDialect());

  @Test
  void selectStatementCarriesOrderedBindings() {
    QueryPlan q = QueryPlan.from("users").where(where("id", "=", 1)).addBinding(BindingType.WHERE, 1);
    SqlStatement ss = g.select(q);
    assertEquals("select * from users where id = ?", ss.sql());
    assertEquals(List.of(1), ss.bindings());
    assertEquals(SqlStatement.ExecKind.QUERY, ss.execKind());
  }

  @Test
  void existsReadsOneValue() {
    SqlStatement ss = g.exists(QueryPlan.from("users"));
    assertEquals("select exists(select * from users) as exists", ss.sql());
    assertEquals(SqlStatement.ExecKind.QUERY_ONE_VALUE, ss.execKind());
  }

  @Test
  void placeholderCountMatchesBindings() {
    QueryPlan q = QueryPlan.from("posts")
        .where(where("a", "=", 1))
        .withGroupLimit(new GroupLimit("user_id", 3))
        .addBinding(BindingType.WHERE, 1);
    SqlStatement ss = g.select(q);
    assertEquals(ss.bindings().size(), ss.sql().chars().filter(c -> c == '?').count());
  }

  @Test
  void jsonContainsBindingIsJsonText() {
    assertEquals("[\"a\",\"b\"]", g.prepareBindingForJsonContains(List.of("a", "b")));
    assertEquals("{\"k\":1}", g.prepareBindingForJsonContains(Map.of("k", 1)));
    assertEquals("\"é\"", g.prepareBindingForJsonContains("é"));
    assertThrows(MalformedPlanException.class, () -> g.prepareBindingForJsonContains(new Object()));
  }

  @Test
  void tablePrefixAndUnionAliasFromOptions() {
    QueryGrammar prefixed = new QueryGrammar(new DefaultDialect(),
        new GrammarOptions("default", "app_", null, null, "u_all"));
    QueryPlan q = QueryPlan.from("users").withAggregate(Aggregate.of("count")).union(QueryPlan.from("admins"), true);
    assertEquals("select count(*) as aggregate from ((select * from app_users) union all (select * from app_admins)) "
        + "as app_u_all", prefixed.compileSelect(q));
  }

  @Test
  void dialectPassThroughs() {
    assertTrue(g.supportsSavepoints());
    assertEquals("SAVEPOINT s1", g.compileSavepoint("s1"));
    assertEquals("ROLLBACK TO SAVEPOINT s1", g.compileSavepointRollBack("s1"));
    assertNull(g.compileThreadCount());
    assertEquals("RANDOM()", g.compileRandom(""));
    assertEquals("yyyy-MM-dd HH:mm:ss", g.dateFormat());
    assertEquals("'x'", g.escape("x"));
  }
}
