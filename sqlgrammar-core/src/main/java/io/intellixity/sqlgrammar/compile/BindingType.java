package io.intellixity.sqlgrammar.compile;

/** Clause kinds that own placeholders, in the order their SQL appears in a select. */
public enum BindingType {
  SELECT,
  FROM,
  JOIN,
  WHERE,
  GROUP_BY,
  HAVING,
  ORDER,
  UNION,
  UNION_ORDER
}
