package com.gentoro.claimgraph.model;

import java.util.List;

public record MarketGraph(List<GraphNode> nodes, List<GraphEdge> edges, String coreId) {
  public MarketGraph {
    nodes = List.copyOf(nodes);
    edges = List.copyOf(edges);
  }
}
