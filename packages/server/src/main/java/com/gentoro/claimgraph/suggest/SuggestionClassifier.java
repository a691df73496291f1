package com.gentoro.claimgraph.suggest;

import com.gentoro.claimgraph.model.GraphNode;
import com.gentoro.claimgraph.model.Suggestion;
import java.util.List;

/**
 * Classifies how each market aligns with the worldview. Returned suggestions carry no url; the
 * caller resolves it from the node.
 */
@FunctionalInterface
public interface SuggestionClassifier {
  List<Suggestion> classify(String worldview, List<GraphNode> nodes);
}
