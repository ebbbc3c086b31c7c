package io.intellixity.sqlgrammar.spi.sql;

import io.intellixity.sqlgrammar.plan.MalformedPlanException;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class DefaultDialectTest {
  private final Dialect d = new DefaultDialect();

  @Test
  void leavesIdentifiersUnquoted() {
    assertEquals("users", d.wrapValue("users"));
  }

  @Test
  void optionalFeaturesAreUnsupported() {
    UnsupportedFeatureException ex = assertThrows(UnsupportedFeatureException.class,
        () -> d.compileJsonContains(null, "meta->tags", "?"));
    assertEquals("This database engine does not support JSON contains operations (dialect: default)", ex.getMessage());
    assertEquals("default", ex.dialectId());

    assertThrows(UnsupportedFeatureException.class, () -> d.compileJsonLength(null, "a->b", ">", "?"));
    assertThrows(UnsupportedFeatureException.class, () -> d.compileJoinLateral(null, null, "x"));
    assertThrows(UnsupportedFeatureException.class, () -> d.compileUpsert(null, null, List.of(), List.of(), List.of()));
    assertThrows(UnsupportedFeatureException.class, () -> d.escapeBinary(new byte[] {1}));
  }

  @Test
  void transactionAndMonitoringDefaults() {
    assertTrue(d.supportsSavepoints());
    assertEquals("SAVEPOINT trans2", d.compileSavepoint("trans2"));
    assertEquals("ROLLBACK TO SAVEPOINT trans2", d.compileSavepointRollBack("trans2"));
    assertNull(d.compileThreadCount());
    assertEquals("RANDOM()", d.compileRandom(""));
    assertFalse(d.insertReturnsGeneratedId());
    assertTrue(d.operators().isEmpty());
  }

  @Test
  void rawIntegerValidation() {
    d.validateRawIntegers("id", List.of(1, 2L, BigInteger.TEN));
    MalformedPlanException ex = assertThrows(MalformedPlanException.class,
        () -> d.validateRawIntegers("id", List.of(1, "2")));
    assertTrue(ex.getMessage().contains("java.lang.String"));
    assertThrows(MalformedPlanException.class, () -> d.validateRawIntegers("id", Arrays.asList(1, null)));
  }

  @Test
  void escapesLiterals() {
    assertEquals("null", d.escape(null, false));
    assertEquals("42", d.escape(42, false));
    assertEquals("1.50", d.escape(new BigDecimal("1.50"), false));
    assertEquals("1", d.escape(true, false));
    assertEquals("0", d.escape(false, false));
    assertEquals("'O''Brien'", d.escape("O'Brien", false));
    assertEquals("'2024-03-01 10:15:30'", d.escape(LocalDateTime.of(2024, 3, 1, 10, 15, 30), false));
    assertEquals("'2024-03-01 00:00:00'", d.escape(LocalDate.of(2024, 3, 1), false));
  }

  @Test
  void refusesUnescapableValues() {
    assertThrows(MalformedPlanException.class, () -> d.escape("a\0b", false));
    assertThrows(MalformedPlanException.class, () -> d.escape(List.of(1), false));
    assertThrows(MalformedPlanException.class, () -> d.escape("abc", true));
  }
}
