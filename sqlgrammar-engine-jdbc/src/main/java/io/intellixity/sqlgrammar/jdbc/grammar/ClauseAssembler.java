package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.plan.Aggregate;
import io.intellixity.sqlgrammar.plan.JoinSpec;
import io.intellixity.sqlgrammar.plan.OrderSpec;
import io.intellixity.sqlgrammar.plan.QueryPlan;
import io.intellixity.sqlgrammar.spi.sql.Dialect;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;

/** Renders each {@link SelectComponent} of a plan on its own. */
final class ClauseAssembler {
  private final Grammar g;
  private final Dialect dialect;
  private final WhereCompiler wheres;
  private final WhereCompiler joinConditions;
  private final HavingCompiler havings;

  ClauseAssembler(Grammar g, Dialect dialect, WhereCompiler wheres, WhereCompiler joinConditions, HavingCompiler havings) {
    this.g = g;
    this.dialect = dialect;
    this.wheres = wheres;
    this.joinConditions = joinConditions;
    this.havings = havings;
  }

  /** Fragments of the components present on {@code q}, in emission order. Values may be empty. */
  EnumMap<SelectComponent, String> compileComponents(QueryPlan q) {
    EnumMap<SelectComponent, String> out = new EnumMap<>(SelectComponent.class);
    if (q.aggregate() != null) out.put(SelectComponent.AGGREGATE, compileAggregate(q, q.aggregate()));
    if (q.columns() != null && q.aggregate() == null) out.put(SelectComponent.COLUMNS, compileColumns(q, q.columns()));
    if (q.from() != null) out.put(SelectComponent.FROM, "from " + g.wrapTable(q.from()));
    if (q.indexHint() != null) out.put(SelectComponent.INDEX_HINT, dialect.compileIndexHint(g, q, q.indexHint()));
    if (q.hasJoins()) out.put(SelectComponent.JOINS, compileJoins(q.joins()));
    if (!q.wheres().isEmpty()) out.put(SelectComponent.WHERES, wheres.compile(q.wheres()));
    if (!q.groups().isEmpty()) out.put(SelectComponent.GROUPS, "group by " + g.columnize(q.groups()));
    if (q.hasHavings()) out.put(SelectComponent.HAVINGS, havings.compile(q.havings()));
    if (!q.orders().isEmpty()) out.put(SelectComponent.ORDERS, compileOrders(q.orders()));
    if (q.limit() != null) out.put(SelectComponent.LIMIT, "limit " + q.limit());
    if (q.offset() != null) out.put(SelectComponent.OFFSET, "offset " + q.offset());
    if (q.lock() != null) out.put(SelectComponent.LOCK, dialect.compileLock(g, q, q.lock()));
    return out;
  }

  String compileAggregate(QueryPlan q, Aggregate aggregate) {
    String column = g.columnize(aggregate.columns());
    if (q.distinctOn() != null) {
      column = "distinct " + g.columnize(q.distinctOn());
    } else if (q.distinct() && !"*".equals(column)) {
      column = "distinct " + column;
    }
    return "select " + aggregate.function() + "(" + column + ") as aggregate";
  }

  String compileColumns(QueryPlan q, List<Object> columns) {
    if (q.distinctOn() != null) return "select " + dialect.compileDistinctOn(g, q.distinctOn()) + " " + g.columnize(columns);
    return (q.distinct() ? "select distinct " : "select ") + g.columnize(columns);
  }

  String compileJoins(List<JoinSpec> joins) {
    List<String> out = new ArrayList<>(joins.size());
    for (JoinSpec j : joins) {
      String table = g.wrapTable(j.table());
      String target = table;
      if (j.joins() != null) {
        String nested = compileJoins(j.joins());
        target = "(" + table + (nested.isEmpty() ? "" : " " + nested) + ")";
      }
      if (j.lateral()) {
        out.add(dialect.compileJoinLateral(g, j, target));
      } else {
        out.add((j.type() + " join " + target + " " + joinConditions.compile(j.wheres())).trim());
      }
    }
    return String.join(" ", out);
  }

  String compileOrders(List<OrderSpec> orders) {
    if (orders.isEmpty()) return "";
    List<String> out = new ArrayList<>(orders.size());
    for (OrderSpec o : orders) {
      if (o instanceof OrderSpec.Raw r) out.add(r.sql());
      else {
        OrderSpec.Column c = (OrderSpec.Column) o;
        out.add(g.wrap(c.column()) + " " + c.direction().keyword());
      }
    }
    return "order by " + String.join(", ", out);
  }

  /** Non-empty fragments joined by one space. */
  static String concatenate(Collection<String> fragments) {
    List<String> out = new ArrayList<>(fragments.size());
    for (String f : fragments) {
      if (f != null && !f.isEmpty()) out.add(f);
    }
    return String.join(" ", out);
  }
}
