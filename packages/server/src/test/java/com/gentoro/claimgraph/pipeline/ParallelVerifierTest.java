package com.gentoro.claimgraph.pipeline;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.concurrent.MdcAwareExecutor;
import com.gentoro.claimgraph.events.BufferingEventSink;
import com.gentoro.claimgraph.events.GraphEvent;
import com.gentoro.claimgraph.events.GraphEventType;
import com.gentoro.claimgraph.exception.ClaimGraphErrorCode;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.model.ClaimStatus;
import com.gentoro.claimgraph.model.VerificationResult;
import com.gentoro.claimgraph.verification.VerificationAgent;
import com.gentoro.claimgraph.verification.VerificationOutcome;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ParallelVerifierTest {
  private final MdcAwareExecutor executor = new MdcAwareExecutor(8);
  private final BoundedFanOut fanOut = new BoundedFanOut(executor);

  @AfterEach
  void tearDown() {
    executor.close();
  }

  private static List<ClaimNode> generated(String... labels) {
    List<ClaimNode> nodes = new ArrayList<>();
    for (int i = 0; i < labels.length; i++) {
      nodes.add(new ClaimNode("claim-" + i, labels[i], ClaimStatus.GENERATED, 0.5, 1));
    }
    return nodes;
  }

  @Test
  @DisplayName("one failing verification marks only its own node failed")
  void failureIsLocal() {
    VerificationAgent agent =
        claim -> {
          if (claim.startsWith("bad")) {
            throw new UpstreamException("search down");
          }
          return new VerificationResult(0.7, "supported", List.of());
        };
    List<ClaimNode> nodes = generated("good claim one", "bad claim two", "good claim three");
    BufferingEventSink events = new BufferingEventSink();

    List<VerificationOutcome> outcomes =
        new ParallelVerifier(agent, fanOut, 8).verifyAll(nodes, events);

    assertEquals(ClaimStatus.VERIFIED, nodes.get(0).getStatus());
    assertEquals(ClaimStatus.FAILED, nodes.get(1).getStatus());
    assertEquals(ClaimStatus.VERIFIED, nodes.get(2).getStatus());
    assertEquals(0.7, nodes.get(0).getConfidence());
    assertEquals(0.0, nodes.get(1).getConfidence());
    assertTrue(nodes.get(1).getSources().isEmpty());

    assertInstanceOf(VerificationOutcome.Verified.class, outcomes.get(0));
    VerificationOutcome.Failed failed =
        assertInstanceOf(VerificationOutcome.Failed.class, outcomes.get(1));
    assertEquals(ClaimGraphErrorCode.UPSTREAM_ERROR, failed.code());
    assertEquals("search down", failed.message());
    assertEquals("claim-1", failed.nodeId());

    List<GraphEvent> verifying =
        events.events().stream().filter(e -> e.type() == GraphEventType.CLAIM_VERIFYING).toList();
    List<GraphEvent> verified =
        events.events().stream().filter(e -> e.type() == GraphEventType.CLAIM_VERIFIED).toList();
    assertEquals(3, verifying.size());
    assertEquals(3, verified.size());
    GraphEvent failedEvent =
        verified.stream().filter(e -> "claim-1".equals(e.nodeId())).findFirst().orElseThrow();
    assertEquals("UPSTREAM_ERROR", failedEvent.data().path("error").path("code").asText());
    assertFalse(failedEvent.data().has("verification"));
  }

  @Test
  @DisplayName("each node announces verifying before its result")
  void verifyingPrecedesResult() {
    List<ClaimNode> nodes = generated("claim a text", "claim b text", "claim c text", "claim d");
    BufferingEventSink events = new BufferingEventSink();

    new ParallelVerifier(claim -> new VerificationResult(0.5, "", List.of()), fanOut, 3)
        .verifyAll(nodes, events);

    List<GraphEvent> log = events.events();
    for (ClaimNode node : nodes) {
      int verifyingAt = -1;
      int verifiedAt = -1;
      for (int i = 0; i < log.size(); i++) {
        if (!node.getId().equals(log.get(i).nodeId())) continue;
        if (log.get(i).type() == GraphEventType.CLAIM_VERIFYING) verifyingAt = i;
        if (log.get(i).type() == GraphEventType.CLAIM_VERIFIED) verifiedAt = i;
      }
      assertTrue(verifyingAt >= 0 && verifyingAt < verifiedAt, node.getId());
    }
  }

  @Test
  @DisplayName("no more than the configured number of verifications run at once")
  void concurrencyIsBounded() {
    AtomicInteger inFlight = new AtomicInteger();
    AtomicInteger peak = new AtomicInteger();
    VerificationAgent agent =
        claim -> {
          int now = inFlight.incrementAndGet();
          peak.accumulateAndGet(now, Math::max);
          try {
            Thread.sleep(30);
          } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
          }
          inFlight.decrementAndGet();
          return new VerificationResult(0.5, "", List.of());
        };
    List<ClaimNode> nodes =
        generated("c1 claim", "c2 claim", "c3 claim", "c4 claim", "c5 claim", "c6 claim");

    new ParallelVerifier(agent, fanOut, 2).verifyAll(nodes, new BufferingEventSink());

    assertTrue(peak.get() <= 2, "peak was " + peak.get());
    assertTrue(nodes.stream().allMatch(n -> n.getStatus() == ClaimStatus.VERIFIED));
  }
}
