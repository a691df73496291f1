package com.gentoro.claimgraph.utility;

import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.exception.ValidationException;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Bounded retry with exponential backoff for calls into external collaborators. When all
 * attempts fail the last failure is reported as an {@link UpstreamException}.
 */
public final class RetryPolicy {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(RetryPolicy.class);

  private final int maxAttempts;
  private final long initialDelayMs;
  private final long maxDelayMs;

  public RetryPolicy(int maxAttempts, long initialDelayMs, long maxDelayMs) {
    if (maxAttempts < 1) {
      throw new ValidationException("maxAttempts must be at least 1");
    }
    this.maxAttempts = maxAttempts;
    this.initialDelayMs = Math.max(0, initialDelayMs);
    this.maxDelayMs = Math.max(this.initialDelayMs, maxDelayMs);
  }

  /** Three attempts, 500ms doubling up to 4s. */
  public static RetryPolicy standard() {
    return new RetryPolicy(3, 500, 4000);
  }

  public static RetryPolicy none() {
    return new RetryPolicy(1, 0, 0);
  }

  public <T> T call(String operation, Callable<T> callable) {
    long delay = initialDelayMs;
    Exception last = null;
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      try {
        return callable.call();
      } catch (ValidationException e) {
        // malformed input will not get better on retry
        throw e;
      } catch (Exception e) {
        last = e;
        if (attempt < maxAttempts) {
          log.warn(
              "{} failed (attempt {}/{}): {}; retrying in {} ms",
              operation,
              attempt,
              maxAttempts,
              e.getMessage(),
              delay);
          sleep(delay);
          delay = Math.min(maxDelayMs, delay * 2);
        }
      }
    }
    if (last instanceof UpstreamException upstream) {
      throw upstream;
    }
    throw new UpstreamException(
        "%s failed after %d attempt(s)".formatted(operation, maxAttempts),
        Map.of("operation", operation, "attempts", maxAttempts),
        last);
  }

  private static void sleep(long ms) {
    if (ms <= 0) return;
    try {
      Thread.sleep(ms);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new UpstreamException("Interrupted while waiting to retry", e);
    }
  }
}
