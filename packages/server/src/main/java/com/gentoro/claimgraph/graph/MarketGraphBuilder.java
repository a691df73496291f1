package com.gentoro.claimgraph.graph;

import com.gentoro.claimgraph.embedding.EmbeddingBatch;
import com.gentoro.claimgraph.exception.StructuralException;
import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.model.Candidate;
import com.gentoro.claimgraph.model.GraphEdge;
import com.gentoro.claimgraph.model.GraphNode;
import com.gentoro.claimgraph.model.MarketGraph;
import com.gentoro.claimgraph.similarity.CosineSimilarity;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the candidate graph: candidates become nodes scored by similarity to the worldview, the
 * most similar one is the core, and breadth-first search from the core assigns hop distances over
 * the similarity edges.
 *
 * <p>A candidate whose embedding fails is skipped. Nodes unreachable from the core, or further
 * than {@code maxHops}, are dropped together with their edges.
 */
public class MarketGraphBuilder {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(MarketGraphBuilder.class);

  private final EmbeddingBatch embeddings;

  public MarketGraphBuilder(EmbeddingBatch embeddings) {
    this.embeddings = Objects.requireNonNull(embeddings, "embeddings");
  }

  /**
   * @param k accepted for symmetry with the claim graph; candidates arrive already limited
   * @param candidates search results, unique by id
   * @throws StructuralException when no candidate yields a node
   */
  public MarketGraph buildGraph(
      String worldview, int k, int maxHops, double threshold, List<Candidate> candidates) {
    if (maxHops < 0) {
      throw new ValidationException("maxHops must not be negative: " + maxHops);
    }
    if (candidates.isEmpty()) {
      throw new StructuralException("No candidates to build a graph from");
    }
    float[] worldviewVector = embeddings.embedder().embed(worldview);
    List<Optional<float[]>> vectors =
        embeddings.embedEach(candidates.stream().map(Candidate::embeddingText).toList());

    List<GraphNode> nodes = new ArrayList<>();
    List<float[]> nodeVectors = new ArrayList<>();
    for (int i = 0; i < candidates.size(); i++) {
      Optional<float[]> vector = vectors.get(i);
      if (vector.isEmpty()) continue;
      double similarity = CosineSimilarity.between(worldviewVector, vector.get());
      nodes.add(GraphNode.unassigned(candidates.get(i), similarity));
      nodeVectors.add(vector.get());
    }
    if (nodes.isEmpty()) {
      throw new StructuralException(
          "No valid nodes found among %d candidate(s)".formatted(candidates.size()));
    }

    int core = 0;
    for (int i = 1; i < nodes.size(); i++) {
      if (nodes.get(i).similarity() > nodes.get(core).similarity()) {
        core = i;
      }
    }
    String coreId = nodes.get(core).id();

    List<GraphEdge> edges = new ArrayList<>();
    Map<String, List<String>> adjacency = new HashMap<>();
    nodes.forEach(n -> adjacency.put(n.id(), new ArrayList<>()));
    for (int i = 0; i < nodes.size(); i++) {
      for (int j = i + 1; j < nodes.size(); j++) {
        double weight = CosineSimilarity.between(nodeVectors.get(i), nodeVectors.get(j));
        if (weight >= threshold) {
          String a = nodes.get(i).id();
          String b = nodes.get(j).id();
          edges.add(new GraphEdge(a, b, weight));
          adjacency.get(a).add(b);
          adjacency.get(b).add(a);
        }
      }
    }

    Map<String, Integer> hops = breadthFirstHops(coreId, adjacency);

    List<GraphNode> kept = new ArrayList<>();
    Set<String> keptIds = new HashSet<>();
    for (GraphNode node : nodes) {
      Integer hop = hops.get(node.id());
      if (hop == null || hop > maxHops) continue;
      kept.add(node.withHop(hop));
      keptIds.add(node.id());
    }
    List<GraphEdge> keptEdges =
        edges.stream()
            .filter(e -> keptIds.contains(e.source()) && keptIds.contains(e.target()))
            .toList();

    log.info(
        "Candidate graph: {} of {} node(s) within {} hop(s), {} edge(s), core {}",
        kept.size(),
        nodes.size(),
        maxHops,
        keptEdges.size(),
        coreId);
    return new MarketGraph(kept, keptEdges, coreId);
  }

  /** Shortest hop count from {@code start} to every reachable node; first discovery is final. */
  static Map<String, Integer> breadthFirstHops(
      String start, Map<String, List<String>> adjacency) {
    Map<String, Integer> hops = new HashMap<>();
    ArrayDeque<String> queue = new ArrayDeque<>();
    hops.put(start, 0);
    queue.add(start);
    while (!queue.isEmpty()) {
      String current = queue.poll();
      int next = hops.get(current) + 1;
      for (String neighbor : adjacency.getOrDefault(current, List.of())) {
        if (!hops.containsKey(neighbor)) {
          hops.put(neighbor, next);
          queue.add(neighbor);
        }
      }
    }
    return hops;
  }
}
