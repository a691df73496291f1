package com.gentoro.claimgraph.verification;

import com.gentoro.claimgraph.exception.ClaimGraphErrorCode;
import com.gentoro.claimgraph.model.VerificationResult;
import java.util.Objects;

/** Result of verifying one node: either a result or a typed failure. */
public sealed interface VerificationOutcome
    permits VerificationOutcome.Verified, VerificationOutcome.Failed {

  String nodeId();

  record Verified(String nodeId, VerificationResult result) implements VerificationOutcome {
    public Verified {
      Objects.requireNonNull(nodeId, "nodeId");
      Objects.requireNonNull(result, "result");
    }
  }

  record Failed(String nodeId, ClaimGraphErrorCode code, String message)
      implements VerificationOutcome {
    public Failed {
      Objects.requireNonNull(nodeId, "nodeId");
      Objects.requireNonNull(code, "code");
      message = message == null ? "" : message;
    }
  }
}
