package io.intellixity.sqlgrammar.jdbc.grammar;

import io.intellixity.sqlgrammar.compile.Expression;
import io.intellixity.sqlgrammar.compile.Grammar;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/** Turns values into placeholders; expressions are inlined as their SQL text. */
final class ValueParameterizer {
  private final Grammar grammar;

  ValueParameterizer(Grammar grammar) {
    this.grammar = grammar;
  }

  String parameter(Object value) {
    return (value instanceof Expression e) ? e.value(grammar) : "?";
  }

  String parameterize(Collection<?> values) {
    List<String> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(parameter(v));
    return String.join(", ", out);
  }

  String quoteString(String value) {
    return "'" + value + "'";
  }
}
