package com.gentoro.claimgraph.model;

import java.util.List;

/** Result of a worldview build: root first, then the surviving derivative claims. */
public record ClaimGraph(List<ClaimNode> nodes, List<ClaimEdge> edges, String coreId) {
  public ClaimGraph {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
  }
}
