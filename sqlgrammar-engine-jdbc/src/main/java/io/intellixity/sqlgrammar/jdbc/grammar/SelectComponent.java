package io.intellixity.sqlgrammar.jdbc.grammar;

/** Parts of a select, in the order they are emitted. */
public enum SelectComponent {
  AGGREGATE,
  COLUMNS,
  FROM,
  INDEX_HINT,
  JOINS,
  WHERES,
  GROUPS,
  HAVINGS,
  ORDERS,
  LIMIT,
  OFFSET,
  LOCK
}
