package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1, Numbers.requireRange("workers", 1, 1, 256));
    assertEquals(256, Numbers.requireRange("workers", 256, 1, 256));
  }

  @Test
  void requireRangeRejectsOutside() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 0, 1, 256));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("workers", 257, 1, 256));
  }

  @Test
  void parseIntInRangeParsesTrimmedText() {
    assertEquals(8, Numbers.parseIntInRange("workers", " 8 ", 1, 256));
  }

  @Test
  void parseIntInRangeRejectsGarbage() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("workers", "eight", 1, 256));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("workers", "", 1, 256));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("workers", "999", 1, 256));
  }
}
