package com.gentoro.claimgraph.model;

import com.gentoro.claimgraph.exception.ValidationException;
import java.util.Objects;

/** Directed edge between two claims; {@code weight} is the similarity that admitted it. */
public record ClaimEdge(String source, String target, EdgeType type, double weight) {
  public ClaimEdge {
    Objects.requireNonNull(source, "source");
    Objects.requireNonNull(target, "target");
    Objects.requireNonNull(type, "type");
    if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
      throw new ValidationException("weight must be within [0,1]: " + weight);
    }
  }
}
