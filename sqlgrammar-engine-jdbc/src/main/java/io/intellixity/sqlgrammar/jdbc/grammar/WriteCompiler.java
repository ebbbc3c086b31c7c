package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import io.intellixity.sqlgrammar.plan.QueryPlan;
import io.intellixity.sqlgrammar.spi.sql.Dialect;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Insert, update and delete statements. */
final class WriteCompiler {
  private final Grammar g;
  private final Dialect dialect;
  private final ClauseAssembler clauses;
  private final WhereCompiler wheres;

  WriteCompiler(Grammar g, Dialect dialect, ClauseAssembler clauses, WhereCompiler wheres) {
    this.g = g;
    this.dialect = dialect;
    this.clauses = clauses;
    this.wheres = wheres;
  }

  String compileInsert(QueryPlan q, List<Map<String, Object>> records) {
    String table = g.wrapTable(q.from());
    if (records == null || records.isEmpty()) return "insert into " + table + " default values";

    List<String> columns = insertColumns(records);
    List<String> rows = new ArrayList<>(records.size());
    for (Map<String, Object> r : records) {
      List<Object> ordered = new ArrayList<>(columns.size());
      for (String c : columns) ordered.add(r.get(c));
      rows.add("(" + g.parameterize(ordered) + ")");
    }
    return "insert into " + table + " (" + g.columnize(columns) + ") values " + String.join(", ", rows);
  }

  String compileInsertUsing(QueryPlan q, List<?> columns, String sql) {
    String table = g.wrapTable(q.from());
    if (columns == null || columns.isEmpty() || List.of("*").equals(columns)) {
      return "insert into " + table + " " + sql;
    }
    return "insert into " + table + " (" + g.columnize(columns) + ") " + sql;
  }

  String compileUpdate(QueryPlan q, Map<String, Object> values) {
    String table = g.wrapTable(q.from());
    String columns = compileUpdateColumns(values);
    String where = wheres.compile(q.wheres());
    if (q.hasJoins()) {
      return dialect.compileUpdateWithJoins(g, q, table, clauses.compileJoins(q.joins()), columns, where);
    }
    return ("update " + table + " set " + columns + " " + where).trim();
  }

  String compileUpdateColumns(Map<String, Object> values) {
    List<String> out = new ArrayList<>(values.size());
    for (Map.Entry<String, Object> e : values.entrySet()) {
      out.add(g.wrap(e.getKey()) + " = " + g.parameter(e.getValue()));
    }
    return String.join(", ", out);
  }

  String compileDelete(QueryPlan q) {
    String table = g.wrapTable(q.from());
    String where = wheres.compile(q.wheres());
    if (q.hasJoins()) {
      return dialect.compileDeleteWithJoins(g, q, table, clauses.compileJoins(q.joins()), where);
    }
    return ("delete from " + table + " " + where).trim();
  }

  /** Column order of the first record; every other record must carry the same keys. */
  static List<String> insertColumns(List<Map<String, Object>> records) {
    Map<String, Object> first = records.get(0);
    Set<String> keys = first.keySet();
    for (int i = 1; i < records.size(); i++) {
      if (!records.get(i).keySet().equals(keys)) {
        throw new MalformedPlanException("Insert record " + i + " has columns " + records.get(i).keySet()
            + ", expected " + keys);
      }
    }
    return new ArrayList<>(keys);
  }
}
