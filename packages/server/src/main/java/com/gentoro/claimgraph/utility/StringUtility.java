package com.gentoro.claimgraph.utility;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class StringUtility {
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  /** Trim and collapse every whitespace run into a single space. */
  public static String normalizeWhitespace(String input) {
    if (input == null) return "";
    return WHITESPACE.matcher(input.trim()).replaceAll(" ");
  }

  /**
   * Equality key for exact-match deduplication of claims: lower-cased and whitespace-normalized.
   */
  public static String dedupeKey(String label) {
    return normalizeWhitespace(label).toLowerCase(Locale.ROOT);
  }

  public static String truncate(String input, int maxLength) {
    if (input == null) return "";
    if (maxLength < 0 || input.length() <= maxLength) return input;
    return input.substring(0, maxLength);
  }

  /** Shortened form for log lines. */
  public static String preview(String input, int maxLength) {
    if (input == null) return "";
    return input.length() > maxLength ? input.substring(0, maxLength) + "…" : input;
  }

  public static String extractSnippet(String text, String type) {
    if (text == null || text.isEmpty()) {
      return null;
    }

    // fenced block, e.g. ```json ... ```
    String regex = "(?s)(?:```%s\\s*)(.+?)(?:\\s*```)".formatted(type);
    Pattern pattern = Pattern.compile(regex);
    Matcher matcher = pattern.matcher(text);

    if (matcher.find()) {
      return matcher.group(1).trim();
    }

    return null;
  }

  /** JSON payload of an LLM answer: the fenced json block if present, the raw text otherwise. */
  public static String extractJson(String text) {
    String snippet = extractSnippet(text, "json");
    if (snippet != null) return snippet;
    return text == null ? "" : text.trim();
  }
}
