package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.events.EventSink;
import com.gentoro.claimgraph.events.GraphEvent;
import com.gentoro.claimgraph.exception.ClaimGraphErrorCode;
import com.gentoro.claimgraph.exception.ExceptionUtil;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.model.ClaimSource;
import com.gentoro.claimgraph.model.ClaimStatus;
import com.gentoro.claimgraph.model.VerificationResult;
import com.gentoro.claimgraph.verification.VerificationAgent;
import com.gentoro.claimgraph.verification.VerificationOutcome;
import java.util.List;
import java.util.Objects;

/**
 * Verifies generated nodes concurrently, at most {@code concurrency} at a time.
 *
 * <p>A failing verification marks only its own node {@link ClaimStatus#FAILED}; the stage
 * returns once every node is verified or failed.
 */
public class ParallelVerifier {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(ParallelVerifier.class);

  private final VerificationAgent agent;
  private final BoundedFanOut fanOut;
  private final int concurrency;

  public ParallelVerifier(VerificationAgent agent, BoundedFanOut fanOut, int concurrency) {
    this.agent = Objects.requireNonNull(agent, "agent");
    this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
    this.concurrency = concurrency;
  }

  /** Outcomes in input order. */
  public List<VerificationOutcome> verifyAll(List<ClaimNode> nodes, EventSink events) {
    List<VerificationOutcome> outcomes =
        fanOut.map("verify", nodes, concurrency, node -> verifyOne(node, events));
    long failed = outcomes.stream().filter(o -> o instanceof VerificationOutcome.Failed).count();
    log.info("Verified {} node(s), {} failed", outcomes.size() - failed, failed);
    return outcomes;
  }

  private VerificationOutcome verifyOne(ClaimNode node, EventSink events) {
    node.transitionTo(ClaimStatus.VERIFYING);
    events.emit(GraphEvent.claimVerifying(node.getId(), node.getLabel()));

    VerificationResult result;
    try {
      result = agent.verify(node.getLabel());
    } catch (RuntimeException e) {
      ClaimGraphErrorCode code = ExceptionUtil.codeOf(e);
      String message = ExceptionUtil.unwrap(e).getMessage();
      log.warn("Verification failed for {}: {}", node.getId(), message);
      node.transitionTo(ClaimStatus.FAILED);
      events.emit(GraphEvent.claimVerificationFailed(node.getId(), code, message));
      return new VerificationOutcome.Failed(node.getId(), code, message);
    }

    node.addSource(ClaimSource.ofVerification(result));
    node.transitionTo(ClaimStatus.VERIFIED);
    events.emit(GraphEvent.claimVerified(node.getId(), result));
    return new VerificationOutcome.Verified(node.getId(), result);
  }
}
