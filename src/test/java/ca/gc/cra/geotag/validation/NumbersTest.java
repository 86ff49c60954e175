package ca.gc.cra.geotag.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class NumbersTest {
  @Test
  void requireRangeIsInclusive() {
    assertEquals(1, Numbers.requireRange("queueCapacity", 1, 1, 1024));
    assertEquals(1024, Numbers.requireRange("queueCapacity", 1024, 1, 1024));
  }

  @Test
  void requireRangeNamesTheValue() {
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireRange("queueCapacity", 0, 1, 1024));
    assertTrue(ex.getMessage().startsWith("queueCapacity must be between 1 and 1024"));
  }

  @Test
  void requireNonNegativeRejectsNegativeAndNonFinite() {
    assertEquals(0d, Numbers.requireNonNegative("maxDistance", 0d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("maxDistance", -0.5d));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireNonNegative("maxDistance", Double.NaN));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireNonNegative(null, Double.POSITIVE_INFINITY));
  }
}
