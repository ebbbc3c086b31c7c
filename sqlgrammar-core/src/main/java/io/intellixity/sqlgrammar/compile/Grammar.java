package io.intellixity.sqlgrammar.compile;

import io.intellixity.sqlgrammar.plan.QueryPlan;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Rendering helpers a compiler exposes to dialect hooks and self-rendering {@link Expression}s.
 */
public interface Grammar {
  /** Quotes a column reference, honouring {@code table.column}, {@code x as y} and JSON selectors. */
  String wrap(Object value);

  /** Quotes a table reference, applying the configured table prefix. */
  String wrapTable(Object table);

  /** Quotes one identifier segment; {@code *} is never quoted. */
  String wrapValue(String segment);

  String columnize(Collection<?> columns);

  /** {@code ?} for a value, or the literal text of an {@link Expression}. */
  String parameter(Object value);

  String parameterize(Collection<?> values);

  String quoteString(String value);

  String compileSelect(QueryPlan query);

  String compileInsert(QueryPlan query, List<Map<String, Object>> values);

  /** {@code insert into t (cols) <sql>}; columns may be empty or {@code ["*"]}. */
  String compileInsertUsing(QueryPlan query, List<?> columns, String sql);
}
