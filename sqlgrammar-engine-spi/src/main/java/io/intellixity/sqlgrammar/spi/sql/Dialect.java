package io.intellixity.sqlgrammar.spi.sql;

import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.compile.JsonPath;
import io.intellixity.sqlgrammar.plan.IndexHint;
import io.intellixity.sqlgrammar.plan.JoinSpec;
import io.intellixity.sqlgrammar.plan.Lock;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import io.intellixity.sqlgrammar.plan.Predicate;
import io.intellixity.sqlgrammar.plan.QueryPlan;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Collection;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Database-specific override points of the grammar compiler.
 *
 * Every member has a default. Optional capabilities (JSON predicates, full text, lateral joins,
 * upserts, ...) default to throwing {@link UnsupportedFeatureException}; dialects override the
 * ones their engine supports. Hooks receive the active {@link Grammar} so they can reuse its
 * quoting and parameter rendering.
 */
public interface Dialect {
  String id();

  // ---------------------------------------------------------------- identifiers

  /** Quotes one identifier segment. Never called with {@code *}. Default: unchanged. */
  default String wrapValue(String identifier) {
    return identifier;
  }

  /** Renders a {@code column->path} selector. */
  default String wrapJsonSelector(Grammar g, JsonPath path) {
    throw unsupported("JSON operations");
  }

  default String wrapJsonBooleanSelector(Grammar g, JsonPath path) {
    return wrapJsonSelector(g, path);
  }

  /** Renders the right-hand side of a JSON boolean comparison (already a placeholder or literal). */
  default String wrapJsonBooleanValue(String value) {
    return value;
  }

  // ---------------------------------------------------------------- predicates

  /** {@code column} is the raw selector, {@code value} the rendered parameter. */
  default String compileJsonContains(Grammar g, String column, String value) {
    throw unsupported("JSON contains operations");
  }

  default String compileJsonOverlaps(Grammar g, String column, String value) {
    throw unsupported("JSON overlaps operations");
  }

  default String compileJsonContainsKey(Grammar g, String column) {
    throw unsupported("JSON contains key operations");
  }

  default String compileJsonLength(Grammar g, String column, String operator, String value) {
    throw unsupported("JSON length operations");
  }

  default String compileFullText(Grammar g, Predicate.FullText where) {
    throw unsupported("fulltext search");
  }

  default String compileLike(Grammar g, Predicate.Like where) {
    if (where.caseSensitive()) throw unsupported("case sensitive like operations");
    return g.wrap(where.column()) + (where.not() ? " not like " : " like ") + g.parameter(where.value());
  }

  default String compileBitwise(Grammar g, Predicate.Bitwise where) {
    return g.wrap(where.column()) + " " + where.operator().replace("?", "??") + " " + g.parameter(where.value());
  }

  default String compileDateBased(Grammar g, Predicate.DateBased where) {
    return where.part().function() + "(" + g.wrap(where.column()) + ") " + where.operator() + " "
        + g.parameter(where.value());
  }

  /** Values of a raw in-list are inlined into SQL text, so only integers are accepted. */
  default void validateRawIntegers(Object column, List<?> values) {
    for (Object v : values) {
      if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte
          || v instanceof BigInteger) {
        continue;
      }
      throw new MalformedPlanException("Raw in-list on '" + column + "' accepts integers only, got: "
          + (v == null ? "null" : v.getClass().getName()));
    }
  }

  // ---------------------------------------------------------------- clauses

  /** {@code expression} is the already wrapped join target. */
  default String compileJoinLateral(Grammar g, JoinSpec join, String expression) {
    throw unsupported("lateral joins");
  }

  /** Prefix of a select list restricted to rows distinct on {@code columns}. */
  default String compileDistinctOn(Grammar g, List<?> columns) {
    throw unsupported("distinct on columns");
  }

  default String compileIndexHint(Grammar g, QueryPlan query, IndexHint hint) {
    return "";
  }

  default String compileLock(Grammar g, QueryPlan query, Lock lock) {
    return lock.mode() == Lock.Mode.RAW ? lock.sql() : "";
  }

  default String compileRandom(String seed) {
    return "RANDOM()";
  }

  // ---------------------------------------------------------------- write statements

  default String compileInsertOrIgnore(Grammar g, QueryPlan query, List<Map<String, Object>> values) {
    throw unsupported("inserting while ignoring errors");
  }

  default String compileInsertOrIgnoreUsing(Grammar g, QueryPlan query, List<?> columns, String sql) {
    throw unsupported("inserting while ignoring errors");
  }

  /** Insert that yields the generated key; see {@link #insertReturnsGeneratedId()}. */
  default String compileInsertGetId(Grammar g, QueryPlan query, List<Map<String, Object>> values, String sequence) {
    return g.compileInsert(query, values);
  }

  /** True when {@link #compileInsertGetId} returns the key as a result row instead of via generated keys. */
  default boolean insertReturnsGeneratedId() {
    return false;
  }

  default String compileUpsert(Grammar g, QueryPlan query, List<Map<String, Object>> values,
                               List<String> uniqueBy, List<String> update) {
    throw unsupported("upserts");
  }

  /**
   * Update of a plan that carries joins. {@code table}, {@code joins}, {@code columns} and
   * {@code where} arrive rendered. Default: {@code update t <joins> set ... <where>}.
   */
  default String compileUpdateWithJoins(Grammar g, QueryPlan query, String table, String joins,
                                        String columns, String where) {
    return ("update " + table + " " + joins + " set " + columns + " " + where).trim();
  }

  /** True when the set-list placeholders precede the join placeholders in an update. */
  default boolean bindsUpdateValuesFirst() {
    return false;
  }

  /** Delete of a plan that carries joins. Default: {@code delete <alias> from t <joins> <where>}. */
  default String compileDeleteWithJoins(Grammar g, QueryPlan query, String table, String joins, String where) {
    String[] parts = table.split("(?i)\\s+as\\s+");
    String alias = parts[parts.length - 1];
    return ("delete " + alias + " from " + table + " " + joins + " " + where).trim();
  }

  /** Statements to run, in order, each mapped to its bindings. */
  default Map<String, List<Object>> compileTruncate(Grammar g, QueryPlan query) {
    Map<String, List<Object>> out = new LinkedHashMap<>();
    out.put("truncate table " + g.wrapTable(query.from()), List.of());
    return out;
  }

  // ---------------------------------------------------------------- transactions / monitoring

  default boolean supportsSavepoints() {
    return true;
  }

  default String compileSavepoint(String name) {
    return "SAVEPOINT " + name;
  }

  default String compileSavepointRollBack(String name) {
    return "ROLLBACK TO SAVEPOINT " + name;
  }

  /** Query returning the number of open connections, or null when the engine has none. */
  default String compileThreadCount() {
    return null;
  }

  // ---------------------------------------------------------------- literals

  /**
   * Renders {@code value} as an inline SQL literal.
   *
   * @param binary treat {@code value} as raw bytes
   */
  default String escape(Object value, boolean binary) {
    if (value == null) return "null";
    if (binary || value instanceof byte[]) {
      if (!(value instanceof byte[] bytes)) {
        throw new MalformedPlanException("Binary escaping requires byte[], got: " + value.getClass().getName());
      }
      return escapeBinary(bytes);
    }
    if (value instanceof Boolean b) return escapeBool(b);
    if (value instanceof BigDecimal d) return d.toPlainString();
    if (value instanceof Number) return value.toString();
    if (value instanceof Collection<?> || value instanceof Map<?, ?> || value.getClass().isArray()) {
      throw new MalformedPlanException("The database connection does not support escaping "
          + value.getClass().getSimpleName() + " values");
    }

    String s = formatTemporal(value);
    if (s == null) s = (value instanceof Enum<?> e) ? e.name() : value.toString();
    if (s.indexOf('\0') >= 0) {
      throw new MalformedPlanException("Strings with null bytes cannot be escaped. Use the binary escape option.");
    }
    return "'" + s.replace("'", "''") + "'";
  }

  default String escapeBinary(byte[] value) {
    throw unsupported("escaping binary values");
  }

  default String escapeBool(boolean value) {
    return value ? "1" : "0";
  }

  /** {@link DateTimeFormatter} pattern for temporal literals. */
  default String dateFormat() {
    return "yyyy-MM-dd HH:mm:ss";
  }

  /** Engine-specific comparison operators accepted on top of the standard ones. */
  default List<String> operators() {
    return List.of();
  }

  /** Operators compiled as bitwise predicates. */
  default List<String> bitwiseOperators() {
    return List.of();
  }

  private String formatTemporal(Object value) {
    LocalDateTime t;
    if (value instanceof LocalDateTime ldt) t = ldt;
    else if (value instanceof LocalDate ld) t = ld.atStartOfDay();
    else if (value instanceof OffsetDateTime odt) t = odt.toLocalDateTime();
    else if (value instanceof ZonedDateTime zdt) t = zdt.toLocalDateTime();
    else if (value instanceof Instant i) t = LocalDateTime.ofInstant(i, ZoneOffset.UTC);
    else if (value instanceof Date d) t = LocalDateTime.ofInstant(Instant.ofEpochMilli(d.getTime()), ZoneOffset.UTC);
    else return null;
    return DateTimeFormatter.ofPattern(dateFormat()).format(t);
  }

  private UnsupportedFeatureException unsupported(String feature) {
    return new UnsupportedFeatureException(id(), feature);
  }
}
