package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.events.EventSink;
import com.gentoro.claimgraph.events.GraphEvent;
import com.gentoro.claimgraph.market.MarketSearch;
import com.gentoro.claimgraph.model.Candidate;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.model.MarketReference;
import java.util.List;
import java.util.Objects;

/**
 * Attaches the top market search result to each node's canonical source slot. Search failures
 * leave the node without a market.
 */
public class SourceAttacher {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(SourceAttacher.class);

  private final MarketSearch marketSearch;
  private final BoundedFanOut fanOut;
  private final int concurrency;
  private final int marketLimit;
  private final double relevance;

  public SourceAttacher(
      MarketSearch marketSearch,
      BoundedFanOut fanOut,
      int concurrency,
      int marketLimit,
      double relevance) {
    this.marketSearch = Objects.requireNonNull(marketSearch, "marketSearch");
    this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
    this.concurrency = concurrency;
    this.marketLimit = marketLimit;
    this.relevance = relevance;
  }

  /** @return number of nodes that received a market */
  public int attachAll(List<ClaimNode> nodes, int k, EventSink events) {
    int limit = Math.min(k, marketLimit);
    List<Boolean> attached =
        fanOut.map("attach", nodes, concurrency, node -> attachOne(node, limit, events));
    int count = (int) attached.stream().filter(Boolean::booleanValue).count();
    log.info("Attached markets to {} of {} node(s)", count, nodes.size());
    return count;
  }

  private boolean attachOne(ClaimNode node, int limit, EventSink events) {
    List<Candidate> candidates;
    try {
      candidates = marketSearch.search(node.getLabel(), limit);
    } catch (RuntimeException e) {
      log.warn("Market search failed for {}: {}", node.getId(), e.getMessage());
      return false;
    }
    if (candidates.isEmpty()) {
      return false;
    }
    Candidate top = candidates.get(0);
    MarketReference market =
        new MarketReference(top.id(), top.title(), top.url() == null ? "" : top.url(), relevance);
    node.attachMarket(market);
    events.emit(GraphEvent.sourcesFound(node.getId(), market));
    return true;
  }
}
