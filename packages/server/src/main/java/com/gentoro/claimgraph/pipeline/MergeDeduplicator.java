package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.utility.StringUtility;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops exact duplicates (case-insensitive, whitespace-normalized labels; the first occurrence
 * wins), then keeps the {@code maxClaims} most confident nodes. Nodes without a verification count
 * as confidence 0.0; equal confidences keep their input order.
 */
public class MergeDeduplicator {

  public List<ClaimNode> merge(List<ClaimNode> nodes, int maxClaims) {
    if (maxClaims < 1) {
      throw new ValidationException("maxClaims must be at least 1: " + maxClaims);
    }
    Set<String> seen = new HashSet<>();
    List<ClaimNode> unique = new ArrayList<>();
    for (ClaimNode node : nodes) {
      if (seen.add(StringUtility.dedupeKey(node.getLabel()))) {
        unique.add(node);
      }
    }
    unique.sort(Comparator.comparingDouble(ClaimNode::getConfidence).reversed());
    return List.copyOf(unique.subList(0, Math.min(unique.size(), maxClaims)));
  }
}
