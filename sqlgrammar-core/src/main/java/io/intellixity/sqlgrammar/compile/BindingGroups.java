package io.intellixity.sqlgrammar.compile;

import java.util.*;

/**
 * Parameter values collected per {@link BindingType}.
 * <p>
 * Kept apart until the statement kind is known, because select, update and delete
 * need different positional orders.
 */
public final class BindingGroups {
  private final EnumMap<BindingType, List<Object>> groups = new EnumMap<>(BindingType.class);

  public BindingGroups() {
    for (BindingType t : BindingType.values()) groups.put(t, new ArrayList<>());
  }

  public BindingGroups add(BindingType type, Object value) {
    groups.get(Objects.requireNonNull(type, "type")).add(value);
    return this;
  }

  public BindingGroups addAll(BindingType type, Collection<?> values) {
    groups.get(Objects.requireNonNull(type, "type")).addAll(values);
    return this;
  }

  public BindingGroups set(BindingType type, Collection<?> values) {
    List<Object> l = groups.get(Objects.requireNonNull(type, "type"));
    l.clear();
    if (values != null) l.addAll(values);
    return this;
  }

  public List<Object> get(BindingType type) {
    return Collections.unmodifiableList(groups.get(type));
  }

  /** All values in {@link BindingType} order. */
  public List<Object> flatten() {
    return flattenExcept(EnumSet.noneOf(BindingType.class));
  }

  public List<Object> flattenExcept(Set<BindingType> excluded) {
    List<Object> out = new ArrayList<>();
    for (var e : groups.entrySet()) {
      if (excluded.contains(e.getKey())) continue;
      out.addAll(e.getValue());
    }
    return out;
  }

  public int size() {
    int n = 0;
    for (List<Object> l : groups.values()) n += l.size();
    return n;
  }

  public BindingGroups copy() {
    BindingGroups c = new BindingGroups();
    for (var e : groups.entrySet()) c.groups.get(e.getKey()).addAll(e.getValue());
    return c;
  }

  @Override
  public String toString() {
    return groups.toString();
  }
}
