package com.gentoro.claimgraph.derivative;

import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.utility.StringUtility;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Cleans one derivative set: whitespace is normalized, claims outside 12 to 220 characters are
 * dropped, and case-insensitive duplicates are removed (first occurrence kept). The cleaned set
 * must hold 6 to 15 claims.
 */
public final class DerivativeValidator {
  public static final int MIN_LENGTH = 12;
  public static final int MAX_LENGTH = 220;
  public static final int MIN_ITEMS = 6;
  public static final int MAX_ITEMS = 15;

  private DerivativeValidator() {}

  public static List<String> validate(List<String> raw) {
    Set<String> seen = new HashSet<>();
    List<String> cleaned = new ArrayList<>();
    for (String item : raw) {
      String normalized = StringUtility.normalizeWhitespace(item);
      if (normalized.length() < MIN_LENGTH || normalized.length() > MAX_LENGTH) {
        continue;
      }
      if (seen.add(StringUtility.dedupeKey(normalized))) {
        cleaned.add(normalized);
      }
    }
    if (cleaned.size() < MIN_ITEMS || cleaned.size() > MAX_ITEMS) {
      throw new ValidationException(
          "Derivative set must hold %d to %d claims after validation, got %d"
              .formatted(MIN_ITEMS, MAX_ITEMS, cleaned.size()),
          Map.of("raw", raw.size(), "valid", cleaned.size()));
    }
    return List.copyOf(cleaned);
  }
}
