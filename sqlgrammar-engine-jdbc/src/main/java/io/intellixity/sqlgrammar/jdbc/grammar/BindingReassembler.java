package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.BindingGroups;
import io.intellixity.sqlgrammar.compile.BindingType;
import io.intellixity.sqlgrammar.compile.Expression;
import io.intellixity.sqlgrammar.plan.QueryPlan;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Orders binding values to match the placeholders of a compiled statement.
 *
 * {@link Expression} values are inlined by the compiler and never appear in the output.
 */
final class BindingReassembler {
  private BindingReassembler() {}

  static List<Object> forSelect(QueryPlan q) {
    BindingGroups b = q.bindings();
    if (q.groupLimit() == null) return withoutExpressions(b.flatten());
    // order placeholders move into the row_number() window, right after the select list
    List<Object> out = new ArrayList<>(b.get(BindingType.SELECT));
    out.addAll(b.get(BindingType.ORDER));
    out.addAll(b.flattenExcept(EnumSet.of(BindingType.SELECT, BindingType.ORDER)));
    return withoutExpressions(out);
  }

  static List<Object> forInsert(List<Map<String, Object>> records) {
    List<Object> out = new ArrayList<>();
    if (records == null || records.isEmpty()) return out;
    List<String> columns = WriteCompiler.insertColumns(records);
    for (Map<String, Object> r : records) {
      for (String c : columns) out.add(r.get(c));
    }
    return withoutExpressions(out);
  }

  /** Join, set-list, then the rest; or set-list first when {@code valuesFirst}. */
  static List<Object> forUpdate(BindingGroups groups, Map<String, Object> values, boolean valuesFirst) {
    List<Object> out = new ArrayList<>();
    if (!valuesFirst) out.addAll(groups.get(BindingType.JOIN));
    for (Object v : values.values()) flattenInto(out, resolve(v));
    if (valuesFirst) out.addAll(groups.get(BindingType.JOIN));
    out.addAll(groups.flattenExcept(EnumSet.of(BindingType.SELECT, BindingType.JOIN)));
    return withoutExpressions(out);
  }

  static List<Object> forDelete(BindingGroups groups) {
    return withoutExpressions(groups.flattenExcept(EnumSet.of(BindingType.SELECT)));
  }

  private static Object resolve(Object v) {
    return (v instanceof Supplier<?> s) ? s.get() : v;
  }

  private static void flattenInto(List<Object> out, Object v) {
    if (v instanceof Collection<?> c) {
      for (Object o : c) flattenInto(out, o);
    } else if (v instanceof Object[] arr) {
      for (Object o : arr) flattenInto(out, o);
    } else {
      out.add(v);
    }
  }

  private static List<Object> withoutExpressions(List<Object> values) {
    values.removeIf(v -> v instanceof Expression);
    return values;
  }
}
