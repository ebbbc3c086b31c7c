package io.intellixity.sqlgrammar.compile;

import io.intellixity.sqlgrammar.compile.JsonPath.Segment;
import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class JsonPathTest {
  @Test
  void splitsColumnKeysAndIndexes() {
    JsonPath p = JsonPath.parse("users.meta->tags[0][2]->name->3");
    assertEquals("users.meta", p.column());
    assertEquals(List.of(
        new Segment.Key("tags"),
        new Segment.Index(0),
        new Segment.Index(2),
        new Segment.Key("name"),
        new Segment.Index(3)
    ), p.segments());
  }

  @Test
  void bracketOnlySegmentHasNoKey() {
    JsonPath p = JsonPath.parse("meta->[1]");
    assertEquals(List.of(new Segment.Index(1)), p.segments());
  }

  @Test
  void parentDropsLastSegmentAndRoundTripsSelector() {
    JsonPath p = JsonPath.parse("meta->a->b");
    assertEquals(new Segment.Key("b"), p.last());
    assertEquals("meta->a", p.parent().selector());
    assertEquals("meta", p.parent().parent().selector());
  }

  @Test
  void detectsSelectors() {
    assertTrue(JsonPath.isSelector("meta->a"));
    assertFalse(JsonPath.isSelector("users.meta"));
  }

  @Test
  void rejectsEmptySegment() {
    assertThrows(MalformedPlanException.class, () -> JsonPath.parse("meta->->a"));
    assertThrows(MalformedPlanException.class, () -> JsonPath.parse("meta").last());
  }
}
