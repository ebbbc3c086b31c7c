package io.intellixity.sqlgrammar.plan;

import io.intellixity.sqlgrammar.compile.BindingGroups;
import io.intellixity.sqlgrammar.compile.BindingType;

import java.util.*;

/**
 * Dialect-neutral description of one query, filled in by a query builder.
 * <p>
 * Compilers treat a plan as a snapshot: they never write to it and work on {@link #copy()}
 * whenever a rewrite is needed. Parameter values live in {@link #bindings()}, grouped by the
 * clause that owns their placeholders.
 */
public final class QueryPlan {
  private Aggregate aggregate;
  private List<Object> columns;
  private boolean distinct;
  private List<Object> distinctOn;
  private Object from;
  private IndexHint indexHint;
  private List<JoinSpec> joins = new ArrayList<>();
  private List<Predicate> wheres = new ArrayList<>();
  private List<Object> groups = new ArrayList<>();
  private List<HavingPredicate> havings = new ArrayList<>();
  private List<OrderSpec> orders = new ArrayList<>();
  private Integer limit;
  private Integer offset;
  private GroupLimit groupLimit;
  private List<UnionSpec> unions = new ArrayList<>();
  private List<OrderSpec> unionOrders = new ArrayList<>();
  private Integer unionLimit;
  private Integer unionOffset;
  private Lock lock;
  private BindingGroups bindings = new BindingGroups();

  public QueryPlan() {}

  public static QueryPlan from(Object table) {
    return new QueryPlan().withFrom(table);
  }

  public Aggregate aggregate() { return aggregate; }
  /** Selected columns, or null when none were set (compiled as {@code *}). */
  public List<Object> columns() { return columns == null ? null : Collections.unmodifiableList(columns); }
  public boolean distinct() { return distinct || distinctOn != null; }
  /** Explicit distinct column list, or null for a plain {@code distinct} flag. */
  public List<Object> distinctOn() { return distinctOn == null ? null : Collections.unmodifiableList(distinctOn); }
  public Object from() { return from; }
  public IndexHint indexHint() { return indexHint; }
  public List<JoinSpec> joins() { return Collections.unmodifiableList(joins); }
  public List<Predicate> wheres() { return Collections.unmodifiableList(wheres); }
  public List<Object> groups() { return Collections.unmodifiableList(groups); }
  public List<HavingPredicate> havings() { return Collections.unmodifiableList(havings); }
  public List<OrderSpec> orders() { return Collections.unmodifiableList(orders); }
  public Integer limit() { return limit; }
  public Integer offset() { return offset; }
  public GroupLimit groupLimit() { return groupLimit; }
  public List<UnionSpec> unions() { return Collections.unmodifiableList(unions); }
  public List<OrderSpec> unionOrders() { return Collections.unmodifiableList(unionOrders); }
  public Integer unionLimit() { return unionLimit; }
  public Integer unionOffset() { return unionOffset; }
  public Lock lock() { return lock; }
  public BindingGroups bindings() { return bindings; }

  public boolean hasJoins() { return !joins.isEmpty(); }
  public boolean hasUnions() { return !unions.isEmpty(); }
  public boolean hasHavings() { return !havings.isEmpty(); }

  public QueryPlan withAggregate(Aggregate aggregate) { this.aggregate = aggregate; return this; }
  public QueryPlan withColumns(List<?> columns) { this.columns = columns == null ? null : new ArrayList<>(columns); return this; }
  public QueryPlan select(Object... columns) { return withColumns(List.of(columns)); }
  public QueryPlan withDistinct(boolean distinct) { this.distinct = distinct; return this; }
  public QueryPlan withDistinctOn(List<?> columns) { this.distinctOn = columns == null ? null : new ArrayList<>(columns); return this; }
  public QueryPlan withFrom(Object from) { this.from = from; return this; }
  public QueryPlan withIndexHint(IndexHint indexHint) { this.indexHint = indexHint; return this; }
  public QueryPlan withGroups(List<?> groups) { this.groups = new ArrayList<>(groups == null ? List.of() : groups); return this; }
  public QueryPlan groupBy(Object... groups) { return withGroups(List.of(groups)); }
  public QueryPlan withLimit(Integer limit) { this.limit = limit; return this; }
  public QueryPlan withOffset(Integer offset) { this.offset = offset; return this; }
  public QueryPlan withGroupLimit(GroupLimit groupLimit) { this.groupLimit = groupLimit; return this; }
  public QueryPlan withUnionLimit(Integer unionLimit) { this.unionLimit = unionLimit; return this; }
  public QueryPlan withUnionOffset(Integer unionOffset) { this.unionOffset = unionOffset; return this; }
  public QueryPlan withLock(Lock lock) { this.lock = lock; return this; }

  public QueryPlan join(JoinSpec join) { this.joins.add(Objects.requireNonNull(join, "join")); return this; }
  public QueryPlan where(Predicate where) { this.wheres.add(Objects.requireNonNull(where, "where")); return this; }
  public QueryPlan having(HavingPredicate having) { this.havings.add(Objects.requireNonNull(having, "having")); return this; }
  public QueryPlan orderBy(OrderSpec order) { this.orders.add(Objects.requireNonNull(order, "order")); return this; }
  public QueryPlan union(QueryPlan query, boolean all) { this.unions.add(new UnionSpec(query, all)); return this; }
  public QueryPlan unionOrderBy(OrderSpec order) { this.unionOrders.add(Objects.requireNonNull(order, "order")); return this; }

  public QueryPlan withOrders(List<OrderSpec> orders) {
    this.orders = new ArrayList<>(orders == null ? List.of() : orders);
    return this;
  }

  public QueryPlan withBindings(BindingGroups bindings) {
    this.bindings = bindings == null ? new BindingGroups() : bindings;
    return this;
  }

  /** Records a parameter value for a placeholder owned by {@code type}. */
  public QueryPlan addBinding(BindingType type, Object value) {
    bindings.add(type, value);
    return this;
  }

  /**
   * Independent copy: lists and binding groups are duplicated, nested plans and values are shared.
   */
  public QueryPlan copy() {
    QueryPlan c = new QueryPlan();
    c.aggregate = aggregate;
    c.columns = columns == null ? null : new ArrayList<>(columns);
    c.distinct = distinct;
    c.distinctOn = distinctOn == null ? null : new ArrayList<>(distinctOn);
    c.from = from;
    c.indexHint = indexHint;
    c.joins = new ArrayList<>(joins);
    c.wheres = new ArrayList<>(wheres);
    c.groups = new ArrayList<>(groups);
    c.havings = new ArrayList<>(havings);
    c.orders = new ArrayList<>(orders);
    c.limit = limit;
    c.offset = offset;
    c.groupLimit = groupLimit;
    c.unions = new ArrayList<>(unions);
    c.unionOrders = new ArrayList<>(unionOrders);
    c.unionLimit = unionLimit;
    c.unionOffset = unionOffset;
    c.lock = lock;
    c.bindings = bindings.copy();
    return c;
  }
}
