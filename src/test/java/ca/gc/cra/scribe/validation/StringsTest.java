package ca.gc.cra.scribe.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class StringsTest {
  @Test
  void trimsAndRejectsBlank() {
    assertEquals("x", Strings.requireNonBlank("out", "  x "));
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("out", "   "));
    assertTrue(ex.getMessage().startsWith("out "));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("out", null));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("out", "a\u0007b"));
  }

  @Test
  void printableAsciiEnforcesLengthAndRange() {
    assertEquals("SCRIBE_PASS", Strings.requirePrintableAscii("passphraseEnv", "SCRIBE_PASS", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("passphraseEnv", "ABCDEFGH", 4));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("passphraseEnv", "PASSÉ", 16));
  }
}
