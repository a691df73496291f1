package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.derivative.DerivativeGenerator;
import com.gentoro.claimgraph.derivative.SelfConsistentDerivativeGenerator;
import com.gentoro.claimgraph.embedding.Embedder;
import com.gentoro.claimgraph.embedding.EmbeddingBatch;
import com.gentoro.claimgraph.embedding.MemoizingEmbedder;
import com.gentoro.claimgraph.events.EventSink;
import com.gentoro.claimgraph.events.NoOpEventSink;
import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.logging.LoggingService;
import com.gentoro.claimgraph.market.MarketSearch;
import com.gentoro.claimgraph.model.ClaimEdge;
import com.gentoro.claimgraph.model.ClaimGraph;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.utility.StringUtility;
import com.gentoro.claimgraph.verification.VerificationAgent;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import org.slf4j.MDC;

/**
 * Builds a claim graph from a worldview.
 *
 * <p>Stages run one after another, each fully parallel inside and joined before the next starts:
 *
 * <ol>
 *   <li>root claim
 *   <li>derivative sets, flattened
 *   <li>derivative nodes with {@code derives_from} edges
 *   <li>verification
 *   <li>deduplication and top-N by confidence
 *   <li>market attachment
 *   <li>{@code similar_to} edges between the surviving nodes
 * </ol>
 *
 * The result holds the root followed by the surviving nodes, all sealed. A null sink drops the
 * progress events. Every build uses its own embedding memo; a builder instance may serve
 * concurrent builds.
 */
public class ClaimGraphBuilder {
  private static final org.slf4j.Logger log = LoggingService.getLogger(ClaimGraphBuilder.class);

  private final DerivativeGenerator derivativeGenerator;
  private final Embedder embedder;
  private final VerificationAgent verificationAgent;
  private final MarketSearch marketSearch;
  private final BoundedFanOut fanOut;
  private final PipelineSettings settings;

  public ClaimGraphBuilder(
      DerivativeGenerator derivativeGenerator,
      Embedder embedder,
      VerificationAgent verificationAgent,
      MarketSearch marketSearch,
      BoundedFanOut fanOut,
      PipelineSettings settings) {
    this.derivativeGenerator = Objects.requireNonNull(derivativeGenerator, "derivativeGenerator");
    this.embedder = Objects.requireNonNull(embedder, "embedder");
    this.verificationAgent = Objects.requireNonNull(verificationAgent, "verificationAgent");
    this.marketSearch = Objects.requireNonNull(marketSearch, "marketSearch");
    this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  public ClaimGraph buildFromWorldview(
      String worldview,
      int k,
      int numDerivativeSets,
      int maxClaims,
      double threshold,
      EventSink sink) {
    EventSink events = sink == null ? new NoOpEventSink() : sink;
    String trimmed = worldview == null ? "" : worldview.trim();
    validate(trimmed, k, numDerivativeSets, maxClaims, threshold);

    String previousBuildId = MDC.get(LoggingService.BUILD_ID);
    MDC.put(LoggingService.BUILD_ID, UUID.randomUUID().toString().substring(0, 8));
    try {
      log.info("Building claim graph for '{}'", StringUtility.preview(trimmed, 80));
      long start = System.currentTimeMillis();

      MemoizingEmbedder memo = new MemoizingEmbedder(embedder);
      EmbeddingBatch embeddings = new EmbeddingBatch(memo, fanOut, settings.embedConcurrency());
      List<ClaimEdge> edges = Collections.synchronizedList(new ArrayList<>());

      ClaimNode root = new RootClaimInitializer().initialize(trimmed, events);

      List<String> derivatives = new ArrayList<>();
      derivativeGenerator.generateSets(trimmed, numDerivativeSets).forEach(derivatives::addAll);

      ClaimNodeFactory.Created created =
          new ClaimNodeFactory(embeddings).create(trimmed, derivatives, root.getId(), events);

      new ParallelVerifier(verificationAgent, fanOut, settings.verifyConcurrency())
          .verifyAll(created.nodes(), events);

      List<ClaimNode> survivors = new MergeDeduplicator().merge(created.nodes(), maxClaims);

      new SourceAttacher(
              marketSearch,
              fanOut,
              settings.attachConcurrency(),
              settings.marketLimit(),
              settings.marketRelevance())
          .attachAll(survivors, k, events);

      // Only edges into surviving nodes are appended: a derives_from edge of a claim cut by
      // the merge would point outside the graph. Every edge endpoint is a node of the result.
      Set<String> survivorIds = new HashSet<>();
      survivors.forEach(n -> survivorIds.add(n.getId()));
      created.edges().stream().filter(e -> survivorIds.contains(e.target())).forEach(edges::add);
      edges.addAll(new SimilarityEdgeBuilder(embeddings).build(survivors, threshold));

      List<ClaimNode> nodes = new ArrayList<>(survivors.size() + 1);
      nodes.add(root);
      nodes.addAll(survivors);
      nodes.forEach(ClaimNode::seal);

      log.info(
          "Claim graph built in {} ms: {} node(s), {} edge(s), {} distinct text(s) embedded",
          System.currentTimeMillis() - start,
          nodes.size(),
          edges.size(),
          memo.size());
      return new ClaimGraph(nodes, edges, root.getId());
    } finally {
      if (previousBuildId == null) {
        MDC.remove(LoggingService.BUILD_ID);
      } else {
        MDC.put(LoggingService.BUILD_ID, previousBuildId);
      }
    }
  }

  private static void validate(
      String worldview, int k, int numDerivativeSets, int maxClaims, double threshold) {
    if (worldview.isEmpty()) {
      throw new ValidationException("worldview is required");
    }
    if (k < 1) {
      throw new ValidationException("k must be at least 1: " + k);
    }
    if (numDerivativeSets < SelfConsistentDerivativeGenerator.MIN_SETS
        || numDerivativeSets > SelfConsistentDerivativeGenerator.MAX_SETS) {
      throw new ValidationException(
          "numDerivativeSets must be within [%d,%d]: %d"
              .formatted(
                  SelfConsistentDerivativeGenerator.MIN_SETS,
                  SelfConsistentDerivativeGenerator.MAX_SETS,
                  numDerivativeSets));
    }
    if (maxClaims < 1) {
      throw new ValidationException("maxClaims must be at least 1: " + maxClaims);
    }
    if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
      throw new ValidationException("threshold must be within [0,1]: " + threshold);
    }
  }
}
