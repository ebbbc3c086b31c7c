package io.intellixity.sqlgrammar.jdbc.postgres;

import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.compile.JsonPath;
import io.intellixity.sqlgrammar.plan.JoinSpec;
import io.intellixity.sqlgrammar.plan.Lock;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import io.intellixity.sqlgrammar.plan.Predicate;
import io.intellixity.sqlgrammar.plan.QueryPlan;
import io.intellixity.sqlgrammar.spi.sql.Dialect;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Postgres dialect.
 *
 * Keeps only Postgres-specific overrides; generic rendering lives in the grammar.
 * JSON selectors compile to {@code ->}/{@code ->>} chains and are cast to {@code jsonb}
 * wherever an operator needs it.
 */
public final class PostgresDialect implements Dialect {
  public static final String ID = "postgres";

  private static final List<String> OPERATORS = List.of(
      "=", "<", ">", "<=", ">=", "<>", "!=",
      "like", "not like", "between", "ilike", "not ilike",
      "~", "&", "|", "#", "<<", ">>", "<<=", ">>=",
      "&&", "@>", "<@", "?", "?|", "?&", "||", "-", "@?", "@@", "#-",
      "is distinct from", "is not distinct from"
  );

  private static final List<String> BITWISE_OPERATORS = List.of("~", "&", "|", "#", "<<", ">>", "<<=", ">>=");

  private static final Set<String> FULL_TEXT_LANGUAGES = Set.of(
      "simple", "arabic", "danish", "dutch", "english", "finnish", "french", "german", "hungarian",
      "indonesian", "irish", "italian", "lithuanian", "nepali", "norwegian", "portuguese", "romanian",
      "russian", "spanish", "swedish", "tamil", "turkish"
  );

  private static final char[] HEX = "0123456789abcdef".toCharArray();

  @Override public String id() { return ID; }

  @Override
  public String wrapValue(String identifier) {
    return "\"" + identifier.replace("\"", "\"\"") + "\"";
  }

  /** {@code meta->a->b} becomes {@code "meta"->'a'->>'b'}; array indexes stay unquoted. */
  @Override
  public String wrapJsonSelector(Grammar g, JsonPath path) {
    String field = g.wrap(path.column());
    List<String> attrs = new ArrayList<>(path.segments().size());
    for (JsonPath.Segment s : path.segments()) {
      if (s instanceof JsonPath.Segment.Key k) attrs.add("'" + k.name().replace("'", "''") + "'");
      else attrs.add(Integer.toString(((JsonPath.Segment.Index) s).position()));
    }
    if (attrs.isEmpty()) return field;
    String last = attrs.remove(attrs.size() - 1);
    if (attrs.isEmpty()) return field + "->>" + last;
    return field + "->" + String.join("->", attrs) + "->>" + last;
  }

  @Override
  public String wrapJsonBooleanSelector(Grammar g, JsonPath path) {
    return "(" + wrapJsonSelector(g, path).replace("->>", "->") + ")::jsonb";
  }

  @Override
  public String wrapJsonBooleanValue(String value) {
    return "'" + value + "'::jsonb";
  }

  @Override
  public String compileJsonContains(Grammar g, String column, String value) {
    return "(" + jsonb(g, column) + ")::jsonb @> " + value;
  }

  @Override
  public String compileJsonContainsKey(Grammar g, String column) {
    JsonPath path = JsonPath.parse(column);
    JsonPath.Segment last = path.last();
    String parent = jsonb(g, path.parent().selector());

    if (last instanceof JsonPath.Segment.Index idx) {
      int i = idx.position();
      int minLength = i < 0 ? Math.abs(i) : i + 1;
      return "case when jsonb_typeof((" + parent + ")::jsonb) = 'array' then jsonb_array_length((" + parent
          + ")::jsonb) >= " + minLength + " else false end";
    }
    String key = ((JsonPath.Segment.Key) last).name().replace("'", "''");
    // ?? survives placeholder parsing as a literal ? (jsonb key-exists)
    return "coalesce((" + parent + ")::jsonb ?? '" + key + "', false)";
  }

  @Override
  public String compileJsonLength(Grammar g, String column, String operator, String value) {
    return "jsonb_array_length((" + jsonb(g, column) + ")::jsonb) " + operator + " " + value;
  }

  @Override
  public String compileFullText(Grammar g, Predicate.FullText where) {
    Object lang = where.options().get("language");
    String language = (lang != null && FULL_TEXT_LANGUAGES.contains(lang.toString())) ? lang.toString() : "english";

    List<String> vectors = new ArrayList<>(where.columns().size());
    for (Object c : where.columns()) vectors.add("to_tsvector('" + language + "', " + g.wrap(c) + ")");

    String mode = "plainto_tsquery";
    Object m = where.options().get("mode");
    if ("phrase".equals(m)) mode = "phraseto_tsquery";
    else if ("websearch".equals(m)) mode = "websearch_to_tsquery";
    else if ("raw".equals(m)) mode = "to_tsquery";

    return "(" + String.join(" || ", vectors) + ") @@ " + mode + "('" + language + "', " + g.parameter(where.value()) + ")";
  }

  @Override
  public String compileLike(Grammar g, Predicate.Like where) {
    String op = (where.not() ? "not " : "") + (where.caseSensitive() ? "like" : "ilike");
    return g.wrap(where.column()) + "::text " + op + " " + g.parameter(where.value());
  }

  @Override
  public String compileBitwise(Grammar g, Predicate.Bitwise where) {
    return "(" + g.wrap(where.column()) + " " + where.operator().replace("?", "??") + " " + g.parameter(where.value()) + ")::bool";
  }

  @Override
  public String compileDateBased(Grammar g, Predicate.DateBased where) {
    String column = g.wrap(where.column());
    String tail = " " + where.operator() + " " + g.parameter(where.value());
    switch (where.part()) {
      case DATE: return column + "::date" + tail;
      case TIME: return column + "::time" + tail;
      default: return "extract(" + where.part().function() + " from " + column + ")" + tail;
    }
  }

  @Override
  public String compileJoinLateral(Grammar g, JoinSpec join, String expression) {
    return (join.type() + " join lateral " + expression + " on true").trim();
  }

  @Override
  public String compileDistinctOn(Grammar g, List<?> columns) {
    return "distinct on (" + g.columnize(columns) + ")";
  }

  @Override
  public String compileLock(Grammar g, QueryPlan query, Lock lock) {
    switch (lock.mode()) {
      case UPDATE: return "for update";
      case SHARED: return "for share";
      default: return lock.sql();
    }
  }

  @Override
  public String compileInsertOrIgnore(Grammar g, QueryPlan query, List<Map<String, Object>> values) {
    return g.compileInsert(query, values) + " on conflict do nothing";
  }

  @Override
  public String compileInsertOrIgnoreUsing(Grammar g, QueryPlan query, List<?> columns, String sql) {
    return g.compileInsertUsing(query, columns, sql) + " on conflict do nothing";
  }

  @Override
  public String compileInsertGetId(Grammar g, QueryPlan query, List<Map<String, Object>> values, String sequence) {
    String key = (sequence == null || sequence.isBlank()) ? "id" : sequence;
    return g.compileInsert(query, values) + " returning " + g.wrap(key);
  }

  @Override
  public boolean insertReturnsGeneratedId() {
    return true;
  }

  @Override
  public String compileUpsert(Grammar g, QueryPlan query, List<Map<String, Object>> values,
                              List<String> uniqueBy, List<String> update) {
    if (uniqueBy == null || uniqueBy.isEmpty()) throw new MalformedPlanException("Upsert has no conflict columns");
    if (values == null || values.isEmpty()) throw new MalformedPlanException("Upsert has no records");
    // no explicit update list: every inserted column is refreshed
    List<String> target = (update == null || update.isEmpty()) ? new ArrayList<>(values.get(0).keySet()) : update;
    List<String> sets = new ArrayList<>(target.size());
    for (String c : target) sets.add(g.wrap(c) + " = " + g.wrapValue("excluded") + "." + g.wrapValue(c));
    return g.compileInsert(query, values) + " on conflict (" + g.columnize(uniqueBy) + ") do update set "
        + String.join(", ", sets);
  }

  /** Joined updates become {@code update t set ... where ctid in (select alias.ctid from t <joins> <where>)}. */
  @Override
  public String compileUpdateWithJoins(Grammar g, QueryPlan query, String table, String joins,
                                       String columns, String where) {
    return "update " + table + " set " + columns + " where " + g.wrap("ctid") + " in (" + ctidSelect(g, query) + ")";
  }

  @Override
  public boolean bindsUpdateValuesFirst() {
    return true;
  }

  @Override
  public String compileDeleteWithJoins(Grammar g, QueryPlan query, String table, String joins, String where) {
    return "delete from " + table + " where " + g.wrap("ctid") + " in (" + ctidSelect(g, query) + ")";
  }

  @Override
  public Map<String, List<Object>> compileTruncate(Grammar g, QueryPlan query) {
    Map<String, List<Object>> out = new LinkedHashMap<>();
    out.put("truncate " + g.wrapTable(query.from()) + " restart identity cascade", List.of());
    return out;
  }

  @Override
  public String compileThreadCount() {
    return "select count(*) as \"Value\" from pg_stat_activity";
  }

  @Override
  public String escapeBool(boolean value) {
    return value ? "true" : "false";
  }

  @Override
  public String escapeBinary(byte[] value) {
    StringBuilder sb = new StringBuilder(value.length * 2 + 12).append("'\\x");
    for (byte b : value) sb.append(HEX[(b >> 4) & 0xF]).append(HEX[b & 0xF]);
    return sb.append("'::bytea").toString();
  }

  @Override public List<String> operators() { return OPERATORS; }
  @Override public List<String> bitwiseOperators() { return BITWISE_OPERATORS; }

  private static String ctidSelect(Grammar g, QueryPlan query) {
    String[] parts = String.valueOf(query.from()).split("(?i)\\s+as\\s+");
    return g.compileSelect(query.copy().withColumns(List.of(parts[parts.length - 1] + ".ctid")));
  }

  private static String jsonb(Grammar g, String column) {
    return g.wrap(column).replace("->>", "->");
  }
}
