package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.plan.Clause;
import io.intellixity.sqlgrammar.plan.Predicate;
import io.intellixity.sqlgrammar.plan.Predicates;
import io.intellixity.sqlgrammar.plan.QueryPlan;
import io.intellixity.sqlgrammar.spi.sql.DefaultDialect;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

final class RawSqlSubstitutorTest {
  private final QueryGrammar g = new QueryGrammar(new DefaultDialect());

  @Test
  void placeholdersInsideLiteralsAreKept() {
    String sql = "select * from t where a = ? and b = '??' and c = 'it''s'";
    assertEquals("select * from t where a = 5 and b = '??' and c = 'it''s'",
        g.substituteBindingsIntoRawSql(sql, List.of(5)));
  }

  @Test
  void backslashEscapedQuoteDoesNotCloseLiteral() {
    assertEquals("select 'a\\'?', 'x'", g.substituteBindingsIntoRawSql("select 'a\\'?', ?", List.of("x")));
  }

  @Test
  void doubledPlaceholderOutsideLiteralIsCopied() {
    assertEquals("select * from t where data ?? 'k' and id = 1",
        g.substituteBindingsIntoRawSql("select * from t where data ?? 'k' and id = ?", List.of(1)));
  }

  @Test
  void exhaustedBindingsLeavePlaceholder() {
    assertEquals("a = 1 and b = ?", g.substituteBindingsIntoRawSql("a = ? and b = ?", List.of(1)));
  }

  @Test
  void valuesAreEscapedByDialect() {
    assertEquals("insert into t values ('O''Brien', null, 1)",
        g.substituteBindingsIntoRawSql("insert into t values (?, ?, ?)", Arrays.asList("O'Brien", null, true)));
  }

  @Test
  void roundTripsCompiledPredicates() {
    String sql = g.compileSelect(QueryPlan.from("t").where(Predicates.between("age", 18, 65)));
    assertEquals("select * from t where age between 18 and 65", g.substituteBindingsIntoRawSql(sql, List.of(18, 65)));
  }

  static Stream<Arguments> predicates() {
    return Stream.of(
        Arguments.of(Predicates.in("id", List.of(1, 2, 3)), List.of(1, 2, 3), "id in (1, 2, 3)"),
        Arguments.of(Predicates.notIn("name", List.of("a", "b")), List.of("a", "b"), "name not in ('a', 'b')"),
        Arguments.of(new Predicate.RowValues(List.of("a", "b"), ">", List.of(1, "x"), Clause.AND), List.of(1, "x"),
            "(a, b) > (1, 'x')"),
        Arguments.of(new Predicate.ValueBetween(5, List.of("lo", "hi"), true, Clause.AND), List.of(5),
            "5 not between lo and hi"),
        Arguments.of(new Predicate.DateBased(Predicate.DatePart.YEAR, "created_at", "=", 2024, Clause.AND), List.of(2024),
            "year(created_at) = 2024"),
        Arguments.of(new Predicate.Bitwise("flags", "&", 4, Clause.AND), List.of(4), "flags & 4"),
        Arguments.of(Predicates.like("name", "it's%"), List.of("it's%"), "name like 'it''s%'"));
  }

  @ParameterizedTest
  @MethodSource("predicates")
  void substitutesEveryPlaceholderOfCompiledPredicate(Predicate where, List<Object> bindings, String expected) {
    String sql = g.compileSelect(QueryPlan.from("t").where(where));
    assertEquals("select * from t where " + expected, g.substituteBindingsIntoRawSql(sql, bindings));
  }
}
