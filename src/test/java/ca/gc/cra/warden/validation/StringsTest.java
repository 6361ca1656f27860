package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import org.junit.jupiter.api.Test;

class StringsTest {

  @Test
  void requireNonBlankTrims() {
    assertEquals("value", Strings.requireNonBlank("name", "  value "));
  }

  @Test
  void requireNonBlankRejectsBlankAndControlCharacters() {
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "   "));
    assertThrows(IllegalArgumentException.class, () -> Strings.requireNonBlank("name", "a\u0007b"));
    assertThrows(NullPointerException.class, () -> Strings.requireNonBlank("name", null));
  }

  @Test
  void printableAsciiEnforcesLengthAndCharset() {
    assertEquals("service.name=warden", Strings.requirePrintableAscii("attrs", "service.name=warden", 64));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "abcdef", 3));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "café", 10));
    assertThrows(IllegalArgumentException.class, () -> Strings.requirePrintableAscii("attrs", "a", 0));
  }

  @Test
  void splitListTrimsAndDropsBlanks() {
    assertEquals(List.of("a.example.com", "*.b.example.com"), Strings.splitList(" a.example.com, ,*.b.example.com,"));
    assertEquals(List.of(), Strings.splitList(null));
    assertEquals(List.of(), Strings.splitList("  "));
  }
}
