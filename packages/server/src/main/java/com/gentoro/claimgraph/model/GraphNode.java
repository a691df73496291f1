package com.gentoro.claimgraph.model;

import com.gentoro.claimgraph.exception.StateException;

/**
 * Node of the candidate graph. {@code hop} is {@link #UNASSIGNED_HOP} until breadth-first search
 * reaches the node; it is assigned once, through {@link #withHop(int)}.
 */
public record GraphNode(
    String id, String label, String url, CandidateType type, double similarity, int hop) {
  public static final int UNASSIGNED_HOP = -1;

  public static GraphNode unassigned(Candidate candidate, double similarity) {
    return new GraphNode(
        candidate.id(),
        candidate.title(),
        candidate.url(),
        candidate.type(),
        similarity,
        UNASSIGNED_HOP);
  }

  public boolean hasHop() {
    return hop != UNASSIGNED_HOP;
  }

  public GraphNode withHop(int assigned) {
    if (hasHop()) {
      throw new StateException("Hop of %s already assigned (%d)".formatted(id, hop));
    }
    if (assigned < 0) {
      throw new StateException("Hop must not be negative: " + assigned);
    }
    return new GraphNode(id, label, url, type, similarity, assigned);
  }
}
