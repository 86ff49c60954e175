package ca.gc.cra.geotag.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {
  @Test
  void shortValuesAreUnchanged() {
    assertEquals("IMG_0001.jpg", Logs.truncate("IMG_0001.jpg", 64));
  }

  @Test
  void truncatesAtCodePointBoundary() {
    // each e-acute is two bytes in UTF-8
    String value = "ééé";
    String truncated = Logs.truncate(value, 3);
    assertTrue(truncated.startsWith("é..."));
    assertTrue(truncated.endsWith("(truncated, 2 of 6 bytes)"));
  }

  @Test
  void nullIsPlaceholder() {
    assertEquals("<null>", Logs.truncate(null, 8));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("x", 0));
  }

  @Test
  void redactHidesValues() {
    assertEquals("[REDACTED]", Logs.redact("account"));
    assertEquals("<unset>", Logs.redact(" "));
    assertEquals("<unset>", Logs.redact(null));
  }
}
