package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Expression;
import io.intellixity.sqlgrammar.jdbc.GrammarOptions;
import io.intellixity.sqlgrammar.spi.sql.DefaultDialect;
import io.intellixity.sqlgrammar.spi.sql.UnsupportedFeatureException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class IdentifierWrapperTest {
  private final QueryGrammar g = new QueryGrammar(new QuotingDialect(), GrammarOptions.defaults().withTablePrefix("p_"));

  @Test
  void qualifiedColumnPrefixesTableSegment() {
    assertEquals("\"p_users\".\"id\"", g.wrap("users.id"));
    assertEquals("\"id\"", g.wrap("id"));
  }

  @Test
  void starIsNeverQuoted() {
    assertEquals("*", g.wrap("*"));
    assertEquals("\"p_users\".*", g.wrap("users.*"));
  }

  @Test
  void aliasesAreCaseInsensitive() {
    assertEquals("\"name\" as \"n\"", g.wrap("name as n"));
    assertEquals("\"Name\" as \"N\"", g.wrap("Name AS N"));
  }

  @Test
  void tableAliasAlsoGetsPrefix() {
    assertEquals("\"p_users\" as \"p_u\"", g.wrapTable("users as u"));
  }

  @Test
  void schemaQualifiedTablePrefixesLastSegment() {
    assertEquals("\"public\".\"p_users\"", g.wrapTable("public.users"));
  }

  @Test
  void expressionsPassThrough() {
    assertEquals("(select 1) x", g.wrapTable(Expression.raw("(select 1) x")));
    assertEquals("count(*)", g.wrap(Expression.raw("count(*)")));
  }

  @Test
  void embeddedQuotesAreDoubled() {
    assertEquals("\"a\"\"b\"", g.wrapValue("a\"b"));
  }

  @Test
  void columnizeJoinsWithComma() {
    assertEquals("\"a\", \"p_t\".\"b\"", g.columnize(List.of("a", "t.b")));
  }

  @Test
  void jsonSelectorNeedsDialectSupport() {
    UnsupportedFeatureException ex = assertThrows(UnsupportedFeatureException.class, () -> g.wrap("meta->tags"));
    assertEquals("quoting", ex.dialectId());
  }

  @Test
  void defaultDialectDoesNotQuote() {
    QueryGrammar plain = new QueryGrammar(new DefaultDialect());
    assertEquals("users.id", plain.wrap("users.id"));
    assertEquals("users as u", plain.wrapTable("users as u"));
  }

  @Test
  void parametersAndExpressions() {
    assertEquals("?", g.parameter(5));
    assertEquals("now()", g.parameter(Expression.raw("now()")));
    assertEquals("?, now(), ?", g.parameterize(List.of(1, Expression.raw("now()"), 2)));
    assertEquals("'abc'", g.quoteString("abc"));
  }
}
