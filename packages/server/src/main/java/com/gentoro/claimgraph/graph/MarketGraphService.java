package com.gentoro.claimgraph.graph;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.derivative.DerivativeGenerator;
import com.gentoro.claimgraph.embedding.Embedder;
import com.gentoro.claimgraph.embedding.EmbeddingBatch;
import com.gentoro.claimgraph.embedding.MemoizingEmbedder;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.logging.LoggingService;
import com.gentoro.claimgraph.market.MarketSearch;
import com.gentoro.claimgraph.model.Candidate;
import com.gentoro.claimgraph.model.GraphNode;
import com.gentoro.claimgraph.model.GraphRequest;
import com.gentoro.claimgraph.model.MarketGraph;
import com.gentoro.claimgraph.model.MarketGraphResponse;
import com.gentoro.claimgraph.model.Suggestion;
import com.gentoro.claimgraph.pipeline.PipelineSettings;
import com.gentoro.claimgraph.suggest.SuggestionClassifier;
import com.gentoro.claimgraph.utility.StringUtility;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;
import org.slf4j.MDC;

/**
 * Non-streaming path: derivatives, market search per derivative, candidate graph and trade
 * suggestions for the closest markets.
 */
public class MarketGraphService {
  private static final org.slf4j.Logger log = LoggingService.getLogger(MarketGraphService.class);

  static final Comparator<GraphNode> CLOSEST_FIRST =
      Comparator.comparingInt(GraphNode::hop)
          .thenComparing(Comparator.comparingDouble(GraphNode::similarity).reversed());

  private final DerivativeGenerator derivativeGenerator;
  private final MarketSearch marketSearch;
  private final SuggestionClassifier classifier;
  private final Embedder embedder;
  private final BoundedFanOut fanOut;
  private final PipelineSettings settings;

  public MarketGraphService(
      DerivativeGenerator derivativeGenerator,
      MarketSearch marketSearch,
      SuggestionClassifier classifier,
      Embedder embedder,
      BoundedFanOut fanOut,
      PipelineSettings settings) {
    this.derivativeGenerator = Objects.requireNonNull(derivativeGenerator, "derivativeGenerator");
    this.marketSearch = Objects.requireNonNull(marketSearch, "marketSearch");
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.embedder = Objects.requireNonNull(embedder, "embedder");
    this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public MarketGraphResponse build(GraphRequest request) {
    String previousBuildId = MDC.get(LoggingService.BUILD_ID);
    MDC.put(LoggingService.BUILD_ID, UUID.randomUUID().toString().substring(0, 8));
    try {
      return doBuild(request);
    } finally {
      if (previousBuildId == null) {
        MDC.remove(LoggingService.BUILD_ID);
      } else {
        MDC.put(LoggingService.BUILD_ID, previousBuildId);
      }
    }
  }

  private MarketGraphResponse doBuild(GraphRequest request) {
    String worldview = request.worldview();
    List<String> derivatives =
        flatten(derivativeGenerator.generateSets(worldview, settings.derivativeSets()));

    List<List<Candidate>> results =
        fanOut.map(
            "search",
            derivatives,
            settings.searchConcurrency(),
            derivative -> searchQuietly(derivative, request.k()));
    Map<String, Candidate> unique = new LinkedHashMap<>();
    results.forEach(list -> list.forEach(c -> unique.put(c.id(), c)));
    if (unique.isEmpty()) {
      throw new UpstreamException("No market candidates found for the worldview");
    }
    log.info(
        "{} derivative(s) produced {} unique candidate(s)", derivatives.size(), unique.size());

    EmbeddingBatch embeddings =
        new EmbeddingBatch(new MemoizingEmbedder(embedder), fanOut, settings.embedConcurrency());
    MarketGraph graph =
        new MarketGraphBuilder(embeddings)
            .buildGraph(
                worldview,
                request.k(),
                request.maxHops(),
                request.threshold(),
                new ArrayList<>(unique.values()));

    List<GraphNode> closest =
        graph.nodes().stream().sorted(CLOSEST_FIRST).limit(request.topN()).toList();
    List<Suggestion> suggestions = resolveUrls(classifier.classify(worldview, closest), graph);

    return new MarketGraphResponse(graph, suggestions, derivatives);
  }

  private List<Candidate> searchQuietly(String derivative, int k) {
    try {
      return marketSearch.search(derivative, k);
    } catch (RuntimeException e) {
      log.warn(
          "Market search failed for '{}': {}",
          StringUtility.preview(derivative, 80),
          e.getMessage());
      return List.of();
    }
  }

  /** Suggestions whose node has no url are dropped. */
  static List<Suggestion> resolveUrls(List<Suggestion> raw, MarketGraph graph) {
    Map<String, String> urls = new HashMap<>();
    for (GraphNode node : graph.nodes()) {
      if (node.url() != null && !node.url().isBlank()) {
        urls.put(node.id(), node.url());
      }
    }
    List<Suggestion> resolved = new ArrayList<>();
    for (Suggestion suggestion : raw) {
      String url = urls.get(suggestion.nodeId());
      if (url == null) {
        log.debug("Dropping suggestion for {} without a url", suggestion.nodeId());
        continue;
      }
      resolved.add(suggestion.withUrl(url));
    }
    return resolved;
  }

  static List<String> flatten(List<List<String>> sets) {
    Map<String, String> unique = new LinkedHashMap<>();
    for (List<String> set : sets) {
      for (String derivative : set) {
        unique.putIfAbsent(StringUtility.dedupeKey(derivative), derivative);
      }
    }
    return List.copyOf(unique.values());
  }
}
