package com.gentoro.claimgraph.model;

import java.util.List;

/** Non-streaming build result: the candidate graph, trade suggestions and the derivatives used. */
public record MarketGraphResponse(
    MarketGraph graph, List<Suggestion> suggestions, List<String> derivatives) {
  public MarketGraphResponse {
    suggestions = List.copyOf(suggestions);
    derivatives = List.copyOf(derivatives);
  }
}
