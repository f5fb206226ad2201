package org.cellpainting.loaddata.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("plate", Strings.requireNonBlank("key", "  plate "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    IllegalArgumentException blank =
        assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("out", "   "));
    assertEquals("out must not be blank", blank.getMessage());
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("out", "a\tb"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("out", null));
  }

  @Test
  void requireIdentifierAllowsFileNameSafeCharacters() {
    assertEquals("screen_7.v-2", Strings.requireIdentifier("prefix", "screen_7.v-2"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("prefix", "a/b"));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireIdentifier("prefix", "a b"));
  }

  @Test
  void requirePrintableAsciiEnforcesLength() {
    assertEquals("env=lab", Strings.requirePrintableAscii("attrs", "env=lab", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=lab", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "env=läb", 16));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "x", -1));
  }
}
