package com.gentoro.claimgraph.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.gentoro.claimgraph.exception.StateException;
import com.gentoro.claimgraph.exception.ValidationException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A claim in the graph.
 *
 * <p>Nodes are mutated in place by the verify and attach stages, each node by a single task at a
 * time. Accessors are synchronized so state written by one stage's worker is visible to the next
 * stage. {@link #seal()} is called once the final node list is built; any later mutation fails
 * with {@link StateException}.
 */
@JsonPropertyOrder({"id", "label", "status", "sources", "similarity", "hop"})
public final class ClaimNode {
  private final String id;
  private final String label;
  private final double similarity;
  private final int hop;
  private final List<ClaimSource> sources = new ArrayList<>();
  private ClaimStatus status;
  private boolean sealed;

  public ClaimNode(String id, String label, ClaimStatus status, double similarity, int hop) {
    this.id = Objects.requireNonNull(id, "id");
    this.label = Objects.requireNonNull(label, "label");
    this.status = Objects.requireNonNull(status, "status");
    if (Double.isNaN(similarity) || similarity < 0.0 || similarity > 1.0) {
      throw new ValidationException("similarity must be within [0,1]: " + similarity);
    }
    if (hop < 0) {
      throw new ValidationException("hop must not be negative: " + hop);
    }
    this.similarity = similarity;
    this.hop = hop;
  }

  public String getId() {
    return id;
  }

  public String getLabel() {
    return label;
  }

  public double getSimilarity() {
    return similarity;
  }

  public int getHop() {
    return hop;
  }

  public synchronized ClaimStatus getStatus() {
    return status;
  }

  public synchronized List<ClaimSource> getSources() {
    return List.copyOf(sources);
  }

  /** Verification confidence of the canonical source slot, 0.0 when there is none. */
  @JsonIgnore
  public synchronized double getConfidence() {
    if (sources.isEmpty() || sources.get(0).verification() == null) {
      return 0.0;
    }
    return sources.get(0).verification().confidence();
  }

  public synchronized void transitionTo(ClaimStatus next) {
    checkMutable();
    if (!status.canTransitionTo(next)) {
      throw new StateException(
          "Illegal status transition for %s: %s -> %s".formatted(id, status, next));
    }
    status = next;
  }

  public synchronized void addSource(ClaimSource source) {
    checkMutable();
    sources.add(Objects.requireNonNull(source, "source"));
  }

  /**
   * Attach a market to the canonical slot (index 0), keeping any verification stored there. Adds
   * the slot when the node has no sources yet.
   */
  public synchronized void attachMarket(MarketReference market) {
    checkMutable();
    Objects.requireNonNull(market, "market");
    if (sources.isEmpty()) {
      sources.add(new ClaimSource(null, market));
    } else {
      sources.set(0, sources.get(0).withMarket(market));
    }
  }

  /** Freeze the node. Only nodes whose verification is over may be sealed. */
  public synchronized void seal() {
    if (!status.isTerminal()) {
      throw new StateException("Claim node %s cannot be sealed while %s".formatted(id, status));
    }
    sealed = true;
  }

  @JsonIgnore
  public synchronized boolean isSealed() {
    return sealed;
  }

  private void checkMutable() {
    if (sealed) {
      throw new StateException("Claim node %s is sealed".formatted(id));
    }
  }

  @Override
  public synchronized String toString() {
    return "ClaimNode{id=%s, status=%s, similarity=%.3f, hop=%d, sources=%d}"
        .formatted(id, status, similarity, hop, sources.size());
  }
}
