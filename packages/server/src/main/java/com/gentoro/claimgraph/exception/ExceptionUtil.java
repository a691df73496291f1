package com.gentoro.claimgraph.exception;

import java.time.Instant;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or event payloads. If the
   * throwable is a {@link ClaimGraphException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    Throwable root = unwrap(t);
    if (root instanceof ClaimGraphException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        root.getClass().getSimpleName(),
        safeMessage(root.getMessage()),
        ClaimGraphErrorCode.UNKNOWN,
        null,
        Instant.now());
  }

  /** Strip the wrappers added by futures so callers see the failure raised inside the task. */
  public static Throwable unwrap(Throwable t) {
    Throwable current = t;
    while ((current instanceof CompletionException || current instanceof ExecutionException)
        && current.getCause() != null) {
      current = current.getCause();
    }
    return current;
  }

  /** Error code of a failure, {@link ClaimGraphErrorCode#UNKNOWN} for foreign exceptions. */
  public static ClaimGraphErrorCode codeOf(Throwable t) {
    Throwable root = unwrap(t);
    if (root instanceof ClaimGraphException ex) {
      return ex.getCode();
    }
    return ClaimGraphErrorCode.UNKNOWN;
  }

  /**
   * Produce a compact, single-line representation of a throwable's top stack frames, e.g. {@code
   * com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}.
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }

  /**
   * Return the failure as a {@link ClaimGraphException}: unwraps future wrappers, passes claim
   * graph exceptions through and converts anything else with {@code supplier}.
   */
  public static ClaimGraphException rethrowIfUnchecked(
      Throwable t, Function<Throwable, ClaimGraphException> supplier) {
    Throwable root = unwrap(t);
    if (root instanceof ClaimGraphException ex) {
      return ex;
    }
    return supplier.apply(root);
  }
}
