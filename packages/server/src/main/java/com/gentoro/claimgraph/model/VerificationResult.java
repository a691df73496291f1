package com.gentoro.claimgraph.model;

import com.gentoro.claimgraph.exception.ValidationException;
import java.util.List;

/**
 * Outcome of verifying one claim against web evidence.
 *
 * @param confidence plausibility estimate in [0,1]
 * @param rationale short explanation of the score
 * @param evidence documents consulted, most relevant first
 */
public record VerificationResult(
    double confidence, String rationale, List<EvidenceSource> evidence) {
  public VerificationResult {
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new ValidationException("confidence must be within [0,1]: " + confidence);
    }
    rationale = rationale == null ? "" : rationale;
    evidence = evidence == null ? List.of() : List.copyOf(evidence);
  }
}
