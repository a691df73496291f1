package com.gentoro.claimgraph.graph;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.claimgraph.exception.StructuralException;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.model.Candidate;
import com.gentoro.claimgraph.model.CandidateType;
import com.gentoro.claimgraph.model.GraphEdge;
import com.gentoro.claimgraph.model.GraphNode;
import com.gentoro.claimgraph.model.MarketGraph;
import com.gentoro.claimgraph.support.Direct;
import com.gentoro.claimgraph.support.MapEmbedder;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class MarketGraphBuilderTest {
  private static final String WORLDVIEW = "Bitcoin reaches new highs";

  private static Candidate market(String id) {
    return new Candidate("market:" + id, CandidateType.MARKET, id, null, "https://k/" + id);
  }

  /**
   * Chain core - b - c - d in 5 dimensions: neighbours share a component, others do not. e is
   * orthogonal to everything and therefore unreachable.
   */
  private MapEmbedder chain() {
    return new MapEmbedder(0f, 0f, 0f, 0f, 1f)
        .put(WORLDVIEW, 1f, 0f, 0f, 0f, 0f)
        .put("core", 1f, 0.2f, 0f, 0f, 0f)
        .put("b", 0.1f, 1f, 1f, 0f, 0f)
        .put("c", 0f, 0f, 1f, 1f, 0f)
        .put("d", 0f, 0f, 0f, 1f, 0f)
        .put("e", 0f, 0f, 0f, 0f, 1f);
  }

  private static Map<String, GraphNode> byId(MarketGraph graph) {
    return graph.nodes().stream().collect(Collectors.toMap(GraphNode::id, Function.identity()));
  }

  @Test
  @DisplayName("breadth-first hops from the most similar candidate, unreachable nodes dropped")
  void assignsHops() {
    List<Candidate> candidates =
        List.of(market("b"), market("core"), market("c"), market("d"), market("e"));

    MarketGraph graph =
        new MarketGraphBuilder(Direct.embeddings(chain()))
            .buildGraph(WORLDVIEW, 200, 6, 0.1, candidates);

    assertEquals("market:core", graph.coreId());
    Map<String, GraphNode> nodes = byId(graph);
    assertEquals(4, nodes.size());
    assertFalse(nodes.containsKey("market:e"));
    assertEquals(0, nodes.get("market:core").hop());
    assertEquals(1, nodes.get("market:b").hop());
    assertEquals(2, nodes.get("market:c").hop());
    assertEquals(3, nodes.get("market:d").hop());

    // every node beyond the core has a neighbour exactly one hop closer
    for (GraphNode node : graph.nodes()) {
      if (node.hop() == 0) continue;
      boolean hasParent =
          graph.edges().stream()
              .filter(e -> e.source().equals(node.id()) || e.target().equals(node.id()))
              .map(e -> e.source().equals(node.id()) ? e.target() : e.source())
              .anyMatch(other -> nodes.get(other).hop() == node.hop() - 1);
      assertTrue(hasParent, node.id());
    }
  }

  @Test
  @DisplayName("maxHops cuts nodes and the edges that touch them")
  void maxHopsFilter() {
    List<Candidate> candidates = List.of(market("core"), market("b"), market("c"), market("d"));

    MarketGraph graph =
        new MarketGraphBuilder(Direct.embeddings(chain()))
            .buildGraph(WORLDVIEW, 200, 1, 0.1, candidates);

    assertEquals(2, graph.nodes().size());
    for (GraphEdge edge : graph.edges()) {
      assertTrue(byId(graph).containsKey(edge.source()));
      assertTrue(byId(graph).containsKey(edge.target()));
    }
    assertEquals(1, graph.edges().size());
  }

  @Test
  @DisplayName("ties for the core go to the first candidate")
  void coreTieBreak() {
    MapEmbedder embedder = new MapEmbedder(1f, 0f).put(WORLDVIEW, 1f, 0f);

    MarketGraph graph =
        new MarketGraphBuilder(Direct.embeddings(embedder))
            .buildGraph(WORLDVIEW, 200, 3, 0.5, List.of(market("x"), market("y")));

    assertEquals("market:x", graph.coreId());
    assertEquals(0, byId(graph).get("market:x").hop());
    assertEquals(1, byId(graph).get("market:y").hop());
  }

  @Test
  @DisplayName("a candidate whose embedding fails is skipped")
  void skipsFailedCandidate() {
    MapEmbedder embedder = chain().failOn("b");

    MarketGraph graph =
        new MarketGraphBuilder(Direct.embeddings(embedder))
            .buildGraph(WORLDVIEW, 200, 6, 0.1, List.of(market("core"), market("b")));

    assertEquals(1, graph.nodes().size());
    assertEquals("market:core", graph.coreId());
    assertTrue(graph.edges().isEmpty());
  }

  @Test
  @DisplayName("empty candidate list is a structural error")
  void emptyInput() {
    MarketGraphBuilder builder = new MarketGraphBuilder(Direct.embeddings(chain()));

    assertThrows(
        StructuralException.class, () -> builder.buildGraph(WORLDVIEW, 200, 3, 0.5, List.of()));
  }

  @Test
  @DisplayName("no node survives embedding: structural error")
  void allEmbeddingsFail() {
    MarketGraphBuilder builder =
        new MarketGraphBuilder(Direct.embeddings(chain().failOn("b").failOn("c")));

    assertThrows(
        StructuralException.class,
        () -> builder.buildGraph(WORLDVIEW, 200, 3, 0.5, List.of(market("b"), market("c"))));
  }

  @Test
  @DisplayName("worldview embedding failure is fatal")
  void worldviewFailure() {
    MarketGraphBuilder builder =
        new MarketGraphBuilder(Direct.embeddings(chain().failOn(WORLDVIEW)));

    assertThrows(
        UpstreamException.class,
        () -> builder.buildGraph(WORLDVIEW, 200, 3, 0.5, List.of(market("core"))));
  }

  @Test
  void breadthFirstKeepsFirstDiscovery() {
    Map<String, List<String>> adjacency =
        Map.of(
            "a", List.of("b", "c"),
            "b", List.of("a", "d"),
            "c", List.of("a", "d"),
            "d", List.of("b", "c"),
            "z", List.of());

    Map<String, Integer> hops = MarketGraphBuilder.breadthFirstHops("a", adjacency);

    assertEquals(Map.of("a", 0, "b", 1, "c", 1, "d", 2), hops);
  }
}
