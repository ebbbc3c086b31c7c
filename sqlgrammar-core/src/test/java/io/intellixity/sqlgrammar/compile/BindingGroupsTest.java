package io.intellixity.sqlgrammar.compile;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class BindingGroupsTest {
  @Test
  void flattensInClauseOrderRegardlessOfInsertionOrder() {
    BindingGroups g = new BindingGroups()
        .add(BindingType.ORDER, "o")
        .add(BindingType.WHERE, "w1")
        .add(BindingType.SELECT, "s")
        .add(BindingType.JOIN, "j")
        .add(BindingType.WHERE, "w2");

    assertEquals(List.of("s", "j", "w1", "w2", "o"), g.flatten());
    assertEquals(List.of("j", "w1", "w2"), g.flattenExcept(EnumSet.of(BindingType.SELECT, BindingType.ORDER)));
    assertEquals(5, g.size());
  }

  @Test
  void keepsNullValues() {
    BindingGroups g = new BindingGroups().add(BindingType.WHERE, null);
    assertEquals(Arrays.asList((Object) null), g.flatten());
  }

  @Test
  void copyIsIndependent() {
    BindingGroups g = new BindingGroups().add(BindingType.WHERE, 1);
    BindingGroups c = g.copy();
    c.add(BindingType.WHERE, 2).set(BindingType.SELECT, List.of(0));

    assertEquals(List.of(1), g.flatten());
    assertEquals(List.of(0, 1, 2), c.flatten());
  }
}
