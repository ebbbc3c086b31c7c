package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.compile.JsonPath;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import io.intellixity.sqlgrammar.plan.Predicate;
import io.intellixity.sqlgrammar.spi.sql.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Compiles a predicate list into a {@code where ...} or {@code on ...} fragment.
 *
 * One instance per keyword. Nested groups are compiled by the same instance, so a group inside
 * a join condition is stripped of {@code on } and a group inside a filter of {@code where }.
 */
final class WhereCompiler implements Predicate.Visitor<String> {
  static final String WHERE = "where";
  static final String ON = "on";

  private static final Pattern LEADING_BOOLEAN = Pattern.compile("^(and|or) ", Pattern.CASE_INSENSITIVE);

  private final Grammar g;
  private final Dialect dialect;
  private final String keyword;

  WhereCompiler(Grammar g, Dialect dialect, String keyword) {
    this.g = g;
    this.dialect = dialect;
    this.keyword = keyword;
  }

  /** Empty list compiles to {@code ""}. */
  String compile(List<Predicate> wheres) {
    if (wheres.isEmpty()) return "";
    List<String> parts = new ArrayList<>(wheres.size());
    for (Predicate p : wheres) parts.add(p.clause().keyword() + " " + p.accept(this));
    return keyword + " " + removeLeadingBoolean(String.join(" ", parts));
  }

  static String removeLeadingBoolean(String sql) {
    return LEADING_BOOLEAN.matcher(sql).replaceFirst("");
  }

  @Override
  public String visitRaw(Predicate.Raw where) {
    return where.sql();
  }

  @Override
  public String visitBasic(Predicate.Basic where) {
    // a literal '?' inside an operator (e.g. jsonb '?|') must not read as a placeholder
    String operator = where.operator().replace("?", "??");
    return g.wrap(where.column()) + " " + operator + " " + g.parameter(where.value());
  }

  @Override
  public String visitBitwise(Predicate.Bitwise where) {
    return dialect.compileBitwise(g, where);
  }

  @Override
  public String visitLike(Predicate.Like where) {
    return dialect.compileLike(g, where);
  }

  @Override
  public String visitIn(Predicate.In where) {
    if (where.values().isEmpty()) return "0 = 1";
    return g.wrap(where.column()) + " in (" + g.parameterize(where.values()) + ")";
  }

  @Override
  public String visitNotIn(Predicate.NotIn where) {
    if (where.values().isEmpty()) return "1 = 1";
    return g.wrap(where.column()) + " not in (" + g.parameterize(where.values()) + ")";
  }

  @Override
  public String visitInRaw(Predicate.InRaw where) {
    if (where.values().isEmpty()) return "0 = 1";
    dialect.validateRawIntegers(where.column(), where.values());
    return g.wrap(where.column()) + " in (" + inline(where.values()) + ")";
  }

  @Override
  public String visitNotInRaw(Predicate.NotInRaw where) {
    if (where.values().isEmpty()) return "1 = 1";
    dialect.validateRawIntegers(where.column(), where.values());
    return g.wrap(where.column()) + " not in (" + inline(where.values()) + ")";
  }

  @Override
  public String visitNull(Predicate.Null where) {
    return g.wrap(where.column()) + " is null";
  }

  @Override
  public String visitNotNull(Predicate.NotNull where) {
    return g.wrap(where.column()) + " is not null";
  }

  @Override
  public String visitBetween(Predicate.Between where) {
    requirePair(where.values(), "between", where.column());
    return g.wrap(where.column()) + " " + between(where.not()) + " "
        + g.parameter(where.values().get(0)) + " and " + g.parameter(where.values().get(1));
  }

  @Override
  public String visitBetweenColumns(Predicate.BetweenColumns where) {
    requirePair(where.columns(), "between columns", where.column());
    return g.wrap(where.column()) + " " + between(where.not()) + " "
        + g.wrap(where.columns().get(0)) + " and " + g.wrap(where.columns().get(1));
  }

  @Override
  public String visitValueBetween(Predicate.ValueBetween where) {
    requirePair(where.columns(), "value between", where.value());
    return g.parameter(where.value()) + " " + between(where.not()) + " "
        + g.wrap(where.columns().get(0)) + " and " + g.wrap(where.columns().get(1));
  }

  @Override
  public String visitDateBased(Predicate.DateBased where) {
    return dialect.compileDateBased(g, where);
  }

  @Override
  public String visitColumn(Predicate.Column where) {
    return g.wrap(where.first()) + " " + where.operator() + " " + g.wrap(where.second());
  }

  @Override
  public String visitNested(Predicate.Nested where) {
    String inner = compile(where.query().wheres());
    String prefix = keyword + " ";
    if (!inner.startsWith(prefix)) {
      throw new MalformedPlanException("Nested predicate group is empty");
    }
    return "(" + inner.substring(prefix.length()) + ")";
  }

  @Override
  public String visitSub(Predicate.Sub where) {
    return g.wrap(where.column()) + " " + where.operator() + " (" + g.compileSelect(where.query()) + ")";
  }

  @Override
  public String visitExists(Predicate.Exists where) {
    return (where.not() ? "not exists (" : "exists (") + g.compileSelect(where.query()) + ")";
  }

  @Override
  public String visitRowValues(Predicate.RowValues where) {
    if (where.columns().size() != where.values().size()) {
      throw new MalformedPlanException("Row values: " + where.columns().size() + " columns but "
          + where.values().size() + " values");
    }
    return "(" + g.columnize(where.columns()) + ") " + where.operator() + " (" + g.parameterize(where.values()) + ")";
  }

  @Override
  public String visitJsonBoolean(Predicate.JsonBoolean where) {
    String column = dialect.wrapJsonBooleanSelector(g, JsonPath.parse(where.column()));
    String value = dialect.wrapJsonBooleanValue(g.parameter(where.value()));
    return column + " " + where.operator() + " " + value;
  }

  @Override
  public String visitJsonContains(Predicate.JsonContains where) {
    return not(where.not()) + dialect.compileJsonContains(g, where.column(), g.parameter(where.value()));
  }

  @Override
  public String visitJsonOverlaps(Predicate.JsonOverlaps where) {
    return not(where.not()) + dialect.compileJsonOverlaps(g, where.column(), g.parameter(where.value()));
  }

  @Override
  public String visitJsonContainsKey(Predicate.JsonContainsKey where) {
    return not(where.not()) + dialect.compileJsonContainsKey(g, where.column());
  }

  @Override
  public String visitJsonLength(Predicate.JsonLength where) {
    return dialect.compileJsonLength(g, where.column(), where.operator(), g.parameter(where.value()));
  }

  @Override
  public String visitFullText(Predicate.FullText where) {
    return dialect.compileFullText(g, where);
  }

  @Override
  public String visitExpression(Predicate.OfExpression where) {
    return where.expression().value(g);
  }

  private static String between(boolean not) {
    return not ? "not between" : "between";
  }

  private static String not(boolean not) {
    return not ? "not " : "";
  }

  private static String inline(List<?> values) {
    List<String> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(String.valueOf(v));
    return String.join(", ", out);
  }

  private static void requirePair(List<?> values, String what, Object subject) {
    if (values.size() != 2) {
      throw new MalformedPlanException(what + " on '" + subject + "' needs exactly 2 bounds, got " + values.size());
    }
  }
}
