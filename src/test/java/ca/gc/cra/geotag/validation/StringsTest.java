package ca.gc.cra.geotag.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankStripsWhitespace() {
    assertEquals("demo", Strings.requireNonBlank("geonamesUser", "  demo  "));
  }

  @Test
  void requireNonBlankRejectsBlankAndNull() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("geonamesUser", "   "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("geonamesUser", null));
  }

  @Test
  void requireNonBlankRejectsControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("photos", "bad\u0001"));
  }

  @Test
  void requirePrintableAsciiRejectsNonAscii() {
    assertThrows(IllegalArgumentException.class,
        () -> Strings.requirePrintableAscii("geonamesUser", "café", 16));
  }

  @Test
  void requirePrintableAsciiRejectsExcessLength() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("geonamesUser", "abc", 2));
  }
}
