package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.embedding.EmbeddingBatch;
import com.gentoro.claimgraph.events.EventSink;
import com.gentoro.claimgraph.events.GraphEvent;
import com.gentoro.claimgraph.model.ClaimEdge;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.model.ClaimStatus;
import com.gentoro.claimgraph.model.EdgeType;
import com.gentoro.claimgraph.similarity.CosineSimilarity;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns derivative claim strings into hop-1 nodes, each linked from the root by a {@code
 * derives_from} edge weighted with the node's similarity to the worldview. Embedding failures are
 * fatal.
 */
public class ClaimNodeFactory {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(ClaimNodeFactory.class);

  private final EmbeddingBatch embeddings;

  public ClaimNodeFactory(EmbeddingBatch embeddings) {
    this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
  }

  public Created create(
      String worldview, List<String> derivatives, String rootId, EventSink events) {
    float[] worldviewVector = embeddings.embedder().embed(worldview);
    List<float[]> vectors = embeddings.embedAll(derivatives);

    List<ClaimNode> nodes = new ArrayList<>(derivatives.size());
    List<ClaimEdge> edges = new ArrayList<>(derivatives.size());
    for (int i = 0; i < derivatives.size(); i++) {
      double similarity = CosineSimilarity.between(worldviewVector, vectors.get(i));
      ClaimNode node =
          new ClaimNode(ClaimIds.next(), derivatives.get(i), ClaimStatus.GENERATED, similarity, 1);
      nodes.add(node);
      events.emit(GraphEvent.claimGenerated(node));
      edges.add(new ClaimEdge(rootId, node.getId(), EdgeType.DERIVES_FROM, similarity));
    }
    log.info("Created {} derivative node(s)", nodes.size());
    return new Created(nodes, edges);
  }

  public record Created(List<ClaimNode> nodes, List<ClaimEdge> edges) {
    public Created {
      nodes = List.copyOf(nodes);
      edges = List.copyOf(edges);
    }
  }
}
