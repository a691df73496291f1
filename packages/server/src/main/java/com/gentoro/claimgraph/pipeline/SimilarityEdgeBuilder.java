package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.embedding.EmbeddingBatch;
import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.model.ClaimEdge;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.model.EdgeType;
import com.gentoro.claimgraph.similarity.CosineSimilarity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * All-pairs {@code similar_to} edges between nodes whose label embeddings are at least {@code
 * threshold} alike. Each label is embedded once per call.
 */
public class SimilarityEdgeBuilder {
  private final EmbeddingBatch embeddings;

  public SimilarityEdgeBuilder(EmbeddingBatch embeddings) {
    this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
  }

  public List<ClaimEdge> build(List<ClaimNode> nodes, double threshold) {
    if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
      throw new ValidationException("threshold must be within [0,1]: " + threshold);
    }
    List<float[]> vectors = embeddings.embedAll(nodes.stream().map(ClaimNode::getLabel).toList());

    List<ClaimEdge> edges = new ArrayList<>();
    for (int i = 0; i < nodes.size(); i++) {
      for (int j = i + 1; j < nodes.size(); j++) {
        double similarity = CosineSimilarity.between(vectors.get(i), vectors.get(j));
        if (similarity >= threshold) {
          edges.add(
              new ClaimEdge(
                  nodes.get(i).getId(), nodes.get(j).getId(), EdgeType.SIMILAR_TO, similarity));
        }
      }
    }
    return edges;
  }
}
