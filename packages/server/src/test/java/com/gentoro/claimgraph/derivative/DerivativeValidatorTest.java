package com.gentoro.claimgraph.derivative;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.claimgraph.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class DerivativeValidatorTest {

  private static List<String> claims(int count) {
    List<String> items = new ArrayList<>();
    for (int i = 1; i <= count; i++) {
      items.add("Derivative claim number " + i);
    }
    return items;
  }

  @Test
  @DisplayName("whitespace is collapsed and case-insensitive duplicates dropped")
  void normalizesAndDedupes() {
    List<String> raw = new ArrayList<>(claims(6));
    raw.add(0, "  Derivative   claim\tnumber 1  ");
    raw.add("DERIVATIVE CLAIM NUMBER 2");

    List<String> cleaned = DerivativeValidator.validate(raw);

    assertEquals(6, cleaned.size());
    assertEquals("Derivative claim number 1", cleaned.get(0));
    assertEquals("Derivative claim number 2", cleaned.get(1));
  }

  @Test
  @DisplayName("claims shorter than 12 or longer than 220 characters are dropped")
  void lengthBounds() {
    List<String> raw = new ArrayList<>(claims(6));
    raw.add("too short");
    raw.add("x".repeat(221));
    raw.add("y".repeat(220));
    raw.add("z".repeat(12));

    List<String> cleaned = DerivativeValidator.validate(raw);

    assertEquals(8, cleaned.size());
    assertFalse(cleaned.contains("too short"));
    assertTrue(cleaned.contains("y".repeat(220)));
    assertTrue(cleaned.contains("z".repeat(12)));
  }

  @Test
  void rejectsTooFewAfterCleaning() {
    List<String> raw = new ArrayList<>(claims(5));
    raw.add("short");

    assertThrows(ValidationException.class, () -> DerivativeValidator.validate(raw));
  }

  @Test
  void rejectsTooMany() {
    assertEquals(15, DerivativeValidator.validate(claims(15)).size());
    assertThrows(ValidationException.class, () -> DerivativeValidator.validate(claims(16)));
  }
}
