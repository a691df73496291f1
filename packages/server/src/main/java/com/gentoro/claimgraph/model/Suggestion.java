package com.gentoro.claimgraph.model;

import com.gentoro.claimgraph.exception.ValidationException;
import java.util.Objects;

public record Suggestion(
    String nodeId, SuggestionAction action, double confidence, String rationale, String url) {
  public static final int MAX_RATIONALE_LENGTH = 500;

  public Suggestion {
    Objects.requireNonNull(nodeId, "nodeId");
    Objects.requireNonNull(action, "action");
    if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
      throw new ValidationException("confidence must be within [0,1]: " + confidence);
    }
    rationale = rationale == null ? "" : rationale.strip();
    if (rationale.length() > MAX_RATIONALE_LENGTH) {
      rationale = rationale.substring(0, MAX_RATIONALE_LENGTH);
    }
  }

  public Suggestion withUrl(String resolvedUrl) {
    return new Suggestion(nodeId, action, confidence, rationale, resolvedUrl);
  }
}
