package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.jdbc.GrammarOptions;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import io.intellixity.sqlgrammar.plan.QueryPlan;
import io.intellixity.sqlgrammar.plan.UnionSpec;

import java.util.EnumMap;
import java.util.List;

/**
 * Select and exists statements.
 *
 * Every rewrite (default columns, dropped aggregate, folded offset) is applied to a copy of the
 * caller's plan.
 */
final class SelectCompiler {
  private final Grammar g;
  private final ClauseAssembler clauses;
  private final GrammarOptions options;

  SelectCompiler(Grammar g, ClauseAssembler clauses, GrammarOptions options) {
    this.g = g;
    this.clauses = clauses;
    this.options = options;
  }

  String compileSelect(QueryPlan plan) {
    QueryPlan q = plan.copy();
    if ((q.hasUnions() || q.hasHavings()) && q.aggregate() != null) {
      return compileUnionAggregate(q);
    }
    if (q.columns() == null) q.withColumns(List.of("*"));
    if (q.groupLimit() != null) {
      return compileGroupLimit(q);
    }

    String sql = ClauseAssembler.concatenate(clauses.compileComponents(q).values()).trim();
    if (q.hasUnions()) {
      sql = "(" + sql + ") " + compileUnions(q);
    }
    return sql;
  }

  String compileExists(QueryPlan plan) {
    return "select exists(" + compileSelect(plan) + ") as " + g.wrap("exists");
  }

  private String compileUnionAggregate(QueryPlan q) {
    String sql = clauses.compileAggregate(q, q.aggregate());
    q.withAggregate(null);
    return sql + " from (" + compileSelect(q) + ") as " + g.wrapTable(options.unionAlias());
  }

  /** Per-partition limit emulated with row_number(); the offset is folded into the bounds. */
  private String compileGroupLimit(QueryPlan q) {
    int limit = q.groupLimit().value();
    Integer offset = q.offset();
    if (offset != null) {
      try {
        limit = Math.addExact(limit, offset);
      } catch (ArithmeticException e) {
        throw new MalformedPlanException("Group limit " + limit + " plus offset " + offset + " overflows", e);
      }
      q.withOffset(null);
    }

    EnumMap<SelectComponent, String> components = clauses.compileComponents(q);
    String orders = components.remove(SelectComponent.ORDERS);
    String columns = components.getOrDefault(SelectComponent.COLUMNS, "");
    components.put(SelectComponent.COLUMNS, columns + compileRowNumber(q.groupLimit().column(), orders == null ? "" : orders));

    String table = g.wrap(options.tableAlias());
    String row = g.wrap(options.rowAlias());
    StringBuilder sql = new StringBuilder("select * from (")
        .append(ClauseAssembler.concatenate(components.values()))
        .append(") as ").append(table)
        .append(" where ").append(row).append(" <= ").append(limit);
    if (offset != null) sql.append(" and ").append(row).append(" > ").append(offset);
    return sql.append(" order by ").append(row).toString();
  }

  private String compileRowNumber(Object partition, String orders) {
    String over = ("partition by " + g.wrap(partition) + " " + orders).trim();
    return ", row_number() over (" + over + ") as " + g.wrap(options.rowAlias());
  }

  private String compileUnions(QueryPlan q) {
    StringBuilder sql = new StringBuilder();
    for (UnionSpec u : q.unions()) {
      sql.append(u.all() ? " union all " : " union ").append("(").append(compileSelect(u.query())).append(")");
    }
    if (!q.unionOrders().isEmpty()) sql.append(' ').append(clauses.compileOrders(q.unionOrders()));
    if (q.unionLimit() != null) sql.append(" limit ").append(q.unionLimit());
    if (q.unionOffset() != null) sql.append(" offset ").append(q.unionOffset());
    return sql.toString().stripLeading();
  }
}
