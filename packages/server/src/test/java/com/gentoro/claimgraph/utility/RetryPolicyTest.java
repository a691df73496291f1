package com.gentoro.claimgraph.utility;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.exception.ValidationException;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class RetryPolicyTest {
  private final RetryPolicy policy = new RetryPolicy(3, 1, 2);

  @Test
  void succeedsAfterTransientFailures() {
    AtomicInteger attempts = new AtomicInteger();

    String result =
        policy.call(
            "flaky",
            () -> {
              if (attempts.incrementAndGet() < 3) throw new IOException("reset");
              return "ok";
            });

    assertEquals("ok", result);
    assertEquals(3, attempts.get());
  }

  @Test
  @DisplayName("exhaustion raises an upstream error carrying the last cause")
  void exhaustion() {
    AtomicInteger attempts = new AtomicInteger();

    UpstreamException e =
        assertThrows(
            UpstreamException.class,
            () ->
                policy.call(
                    "search",
                    () -> {
                      attempts.incrementAndGet();
                      throw new IOException("timeout");
                    }));

    assertEquals(3, attempts.get());
    assertInstanceOf(IOException.class, e.getCause());
    assertEquals("search", e.getContext().get("operation"));
  }

  @Test
  @DisplayName("validation failures are not retried")
  void validationIsNotRetried() {
    AtomicInteger attempts = new AtomicInteger();

    assertThrows(
        ValidationException.class,
        () ->
            policy.call(
                "validate",
                () -> {
                  attempts.incrementAndGet();
                  throw new ValidationException("bad input");
                }));
    assertEquals(1, attempts.get());
  }

  @Test
  void upstreamFailurePassesThroughUnwrapped() {
    UpstreamException original = new UpstreamException("HTTP 503");

    UpstreamException e =
        assertThrows(
            UpstreamException.class,
            () ->
                RetryPolicy.none()
                    .call(
                        "kalshi",
                        () -> {
                          throw original;
                        }));

    assertSame(original, e);
  }
}
