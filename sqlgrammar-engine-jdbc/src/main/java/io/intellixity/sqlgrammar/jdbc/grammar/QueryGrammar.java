package io.intellixity.sqlgrammar.jdbc.grammar;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sqlgrammar.compile.BindingGroups;
import io.intellixity.sqlgrammar.compile.Grammar;
import io.intellixity.sqlgrammar.jdbc.GrammarOptions;
import io.intellixity.sqlgrammar.jdbc.SqlStatement;
import io.intellixity.sqlgrammar.jdbc.SqlStatement.ExecKind;
import io.intellixity.sqlgrammar.plan.JoinSpec;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import io.intellixity.sqlgrammar.plan.OrderSpec;
import io.intellixity.sqlgrammar.plan.QueryPlan;
import io.intellixity.sqlgrammar.spi.sql.Dialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Compiles {@link QueryPlan}s into SQL with positional {@code ?} placeholders.
 *
 * Generic rendering lives here; everything engine-specific goes through the {@link Dialect}.
 * Instances hold no mutable state and may be shared across threads.
 *
 * Two layers of API:
 * - {@code compileX} returns SQL text only, binding order is the caller's concern;
 * - {@link #select}, {@link #insert}, {@link #update}, ... return a {@link SqlStatement} with the
 *   bindings already in placeholder order.
 */
public final class QueryGrammar implements Grammar {
  private static final Logger log = LoggerFactory.getLogger(QueryGrammar.class);
  private static final ObjectMapper JSON = new ObjectMapper();

  private final Dialect dialect;
  private final GrammarOptions options;
  private final IdentifierWrapper identifiers;
  private final ValueParameterizer parameters;
  private final WhereCompiler wheres;
  private final WhereCompiler joinConditions;
  private final HavingCompiler havings;
  private final ClauseAssembler clauses;
  private final SelectCompiler selects;
  private final WriteCompiler writes;
  private final RawSqlSubstitutor substitutor;

  public QueryGrammar(Dialect dialect) {
    this(dialect, GrammarOptions.defaults().withDialect(dialect.id()));
  }

  public QueryGrammar(Dialect dialect, GrammarOptions options) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.options = Objects.requireNonNull(options, "options");
    this.identifiers = new IdentifierWrapper(this, dialect, options.tablePrefix());
    this.parameters = new ValueParameterizer(this);
    this.wheres = new WhereCompiler(this, dialect, WhereCompiler.WHERE);
    this.joinConditions = new WhereCompiler(this, dialect, WhereCompiler.ON);
    this.havings = new HavingCompiler(this);
    this.clauses = new ClauseAssembler(this, dialect, wheres, joinConditions, havings);
    this.selects = new SelectCompiler(this, clauses, options);
    this.writes = new WriteCompiler(this, dialect, clauses, wheres);
    this.substitutor = new RawSqlSubstitutor(dialect);
  }

  public Dialect dialect() { return dialect; }
  public GrammarOptions options() { return options; }

  // ---------------------------------------------------------------- identifiers / values

  @Override public String wrap(Object value) { return identifiers.wrap(value); }
  @Override public String wrapTable(Object table) { return identifiers.wrapTable(table); }
  @Override public String wrapValue(String segment) { return identifiers.wrapValue(segment); }
  @Override public String columnize(Collection<?> columns) { return identifiers.columnize(columns); }
  @Override public String parameter(Object value) { return parameters.parameter(value); }
  @Override public String parameterize(Collection<?> values) { return parameters.parameterize(values); }
  @Override public String quoteString(String value) { return parameters.quoteString(value); }

  // ---------------------------------------------------------------- clauses

  public String compileWheres(QueryPlan query) {
    return wheres.compile(query.wheres());
  }

  /** The {@code on ...} condition of a join. */
  public String compileWheres(JoinSpec join) {
    return joinConditions.compile(join.wheres());
  }

  public String compileHavings(QueryPlan query) {
    return havings.compile(query.havings());
  }

  public String compileJoins(List<JoinSpec> joins) {
    return clauses.compileJoins(joins);
  }

  public String compileOrders(List<OrderSpec> orders) {
    return clauses.compileOrders(orders);
  }

  /** Rendered fragment per present component, in emission order. */
  public Map<SelectComponent, String> compileComponents(QueryPlan query) {
    return Collections.unmodifiableMap(clauses.compileComponents(query));
  }

  // ---------------------------------------------------------------- statements

  @Override
  public String compileSelect(QueryPlan query) {
    return selects.compileSelect(query);
  }

  public String compileExists(QueryPlan query) {
    return selects.compileExists(query);
  }

  @Override
  public String compileInsert(QueryPlan query, List<Map<String, Object>> values) {
    return writes.compileInsert(query, values);
  }

  public String compileInsert(QueryPlan query, Map<String, Object> values) {
    return writes.compileInsert(query, values == null || values.isEmpty() ? List.of() : List.of(values));
  }

  @Override
  public String compileInsertUsing(QueryPlan query, List<?> columns, String sql) {
    return writes.compileInsertUsing(query, columns, sql);
  }

  public String compileInsertOrIgnore(QueryPlan query, List<Map<String, Object>> values) {
    return dialect.compileInsertOrIgnore(this, query, values);
  }

  public String compileInsertOrIgnoreUsing(QueryPlan query, List<?> columns, String sql) {
    return dialect.compileInsertOrIgnoreUsing(this, query, columns, sql);
  }

  public String compileInsertGetId(QueryPlan query, List<Map<String, Object>> values, String sequence) {
    return dialect.compileInsertGetId(this, query, values, sequence);
  }

  public String compileUpdate(QueryPlan query, Map<String, Object> values) {
    return writes.compileUpdate(query, values);
  }

  public String compileDelete(QueryPlan query) {
    return writes.compileDelete(query);
  }

  public String compileUpsert(QueryPlan query, List<Map<String, Object>> values, List<String> uniqueBy, List<String> update) {
    return dialect.compileUpsert(this, query, values, uniqueBy, update);
  }

  /** Statements in execution order, each with its bindings. */
  public Map<String, List<Object>> compileTruncate(QueryPlan query) {
    return dialect.compileTruncate(this, query);
  }

  public String compileRandom(String seed) { return dialect.compileRandom(seed); }
  public boolean supportsSavepoints() { return dialect.supportsSavepoints(); }
  public String compileSavepoint(String name) { return dialect.compileSavepoint(name); }
  public String compileSavepointRollBack(String name) { return dialect.compileSavepointRollBack(name); }
  /** Null when the dialect cannot count connections. */
  public String compileThreadCount() { return dialect.compileThreadCount(); }
  public List<String> operators() { return dialect.operators(); }
  public List<String> bitwiseOperators() { return dialect.bitwiseOperators(); }
  public String dateFormat() { return dialect.dateFormat(); }

  // ---------------------------------------------------------------- bindings

  public List<Object> prepareBindingsForSelect(QueryPlan query) {
    return BindingReassembler.forSelect(query);
  }

  public List<Object> prepareBindingsForInsert(List<Map<String, Object>> values) {
    return BindingReassembler.forInsert(values);
  }

  public List<Object> prepareBindingsForUpdate(BindingGroups bindings, Map<String, Object> values) {
    return BindingReassembler.forUpdate(bindings, values, dialect.bindsUpdateValuesFirst());
  }

  public List<Object> prepareBindingsForDelete(BindingGroups bindings) {
    return BindingReassembler.forDelete(bindings);
  }

  /** JSON text bound to the placeholder of a JSON-contains predicate. */
  public String prepareBindingForJsonContains(Object value) {
    try {
      return JSON.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new MalformedPlanException("Failed to JSON-encode value", e);
    }
  }

  /** Inline literal, as the dialect escapes it. */
  public String escape(Object value) {
    return dialect.escape(value, value instanceof byte[]);
  }

  /** Debug rendering of a statement with its bindings inlined. Never execute the result. */
  public String substituteBindingsIntoRawSql(String sql, List<?> bindings) {
    return substitutor.substitute(sql, bindings == null ? List.of() : bindings);
  }

  // ---------------------------------------------------------------- statement façade

  public SqlStatement select(QueryPlan query) {
    return done("select", new SqlStatement(compileSelect(query), prepareBindingsForSelect(query), ExecKind.QUERY));
  }

  public SqlStatement exists(QueryPlan query) {
    return done("exists", new SqlStatement(compileExists(query), prepareBindingsForSelect(query), ExecKind.QUERY_ONE_VALUE));
  }

  public SqlStatement insert(QueryPlan query, List<Map<String, Object>> values) {
    return done("insert", new SqlStatement(compileInsert(query, values), prepareBindingsForInsert(values), ExecKind.UPDATE));
  }

  public SqlStatement insertGetId(QueryPlan query, Map<String, Object> values, String sequence) {
    List<Map<String, Object>> records = List.of(values);
    ExecKind kind = dialect.insertReturnsGeneratedId() ? ExecKind.QUERY_ONE_VALUE : ExecKind.UPDATE_GENERATED_KEYS;
    return done("insertGetId", new SqlStatement(compileInsertGetId(query, records, sequence),
        prepareBindingsForInsert(records), kind));
  }

  public SqlStatement insertOrIgnore(QueryPlan query, List<Map<String, Object>> values) {
    return done("insertOrIgnore", new SqlStatement(compileInsertOrIgnore(query, values),
        prepareBindingsForInsert(values), ExecKind.UPDATE));
  }

  public SqlStatement update(QueryPlan query, Map<String, Object> values) {
    return done("update", new SqlStatement(compileUpdate(query, values),
        prepareBindingsForUpdate(query.bindings(), values), ExecKind.UPDATE));
  }

  public SqlStatement delete(QueryPlan query) {
    return done("delete", new SqlStatement(compileDelete(query), prepareBindingsForDelete(query.bindings()), ExecKind.UPDATE));
  }

  public SqlStatement upsert(QueryPlan query, List<Map<String, Object>> values, List<String> uniqueBy, List<String> update) {
    return done("upsert", new SqlStatement(compileUpsert(query, values, uniqueBy, update),
        prepareBindingsForInsert(values), ExecKind.UPDATE));
  }

  public List<SqlStatement> truncate(QueryPlan query) {
    List<SqlStatement> out = new ArrayList<>();
    for (Map.Entry<String, List<Object>> e : compileTruncate(query).entrySet()) {
      out.add(done("truncate", new SqlStatement(e.getKey(), e.getValue(), ExecKind.UPDATE)));
    }
    return out;
  }

  private SqlStatement done(String op, SqlStatement ss) {
    if (!log.isDebugEnabled()) return ss;
    log.debug("sqlgrammar.compile op={} execKind={} dialect={} bindCount={} sql={}",
        op, ss.execKind(), dialect.id(), ss.bindings().size(), ss.sql());
    if (log.isTraceEnabled()) {
      int i = 1;
      for (Object v : ss.bindings()) {
        log.trace("sqlgrammar.compile bind index={} valueType={}", i++, v == null ? "null" : v.getClass().getName());
      }
    }
    return ss;
  }
}
