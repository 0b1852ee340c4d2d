package ca.gc.cra.xlog.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(0L, Numbers.requireRange("count", 0, 0, 10));
    assertEquals(10L, Numbers.requireRange("count", 10, 0, 10));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("count", 11, 0, 10));
    assertEquals("count must be between 0 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseRangeRejectsNonIntegers() {
    assertEquals(42L, Numbers.parseRange("port", " 42 ", 1, 65535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("port", "4.2", 1, 65535));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseRange("port", "", 1, 65535));
  }
}
