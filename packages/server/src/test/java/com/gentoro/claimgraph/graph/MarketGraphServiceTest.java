package com.gentoro.claimgraph.graph;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.gentoro.claimgraph.derivative.DerivativeGenerator;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.market.MarketSearch;
import com.gentoro.claimgraph.model.Candidate;
import com.gentoro.claimgraph.model.CandidateType;
import com.gentoro.claimgraph.model.GraphNode;
import com.gentoro.claimgraph.model.GraphRequest;
import com.gentoro.claimgraph.model.MarketGraphResponse;
import com.gentoro.claimgraph.model.Suggestion;
import com.gentoro.claimgraph.model.SuggestionAction;
import com.gentoro.claimgraph.pipeline.PipelineSettings;
import com.gentoro.claimgraph.suggest.SuggestionClassifier;
import com.gentoro.claimgraph.support.Direct;
import com.gentoro.claimgraph.support.MapEmbedder;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MarketGraphServiceTest {
  private static final String WORLDVIEW = "Housing prices keep rising";

  @Mock private DerivativeGenerator generator;
  @Mock private MarketSearch marketSearch;
  @Mock private SuggestionClassifier classifier;

  private final MapEmbedder embedder =
      new MapEmbedder(0f, 1f)
          .put(WORLDVIEW, 1f, 0f)
          .put("Mortgage rates", 1f, 0.1f)
          .put("Home sales", 1f, 0.3f)
          .put("Rent index", 1f, 0.6f);

  private MarketGraphService service() {
    return new MarketGraphService(
        generator, marketSearch, classifier, embedder, Direct.fanOut(), PipelineSettings.DEFAULTS);
  }

  private static Candidate candidate(String id, String title, String url) {
    return new Candidate(id, CandidateType.MARKET, title, null, url);
  }

  @Test
  @DisplayName("derivatives to candidates to graph to suggestions with resolved urls")
  void endToEnd() {
    when(generator.generateSets(WORLDVIEW, 4))
        .thenReturn(
            List.of(
                List.of("home prices rise further", "mortgage demand stays strong"),
                List.of("Home Prices Rise Further", "rents climb too")));
    when(marketSearch.search(eq("home prices rise further"), eq(200)))
        .thenReturn(
            List.of(
                candidate("market:MORT", "Mortgage rates", "https://k/mort"),
                candidate("market:HOME", "Home sales", null)));
    when(marketSearch.search(eq("mortgage demand stays strong"), eq(200)))
        .thenThrow(new UpstreamException("kalshi down"));
    when(marketSearch.search(eq("rents climb too"), eq(200)))
        .thenReturn(
            List.of(
                candidate("market:RENT", "Rent index", "https://k/rent"),
                candidate("market:MORT", "Mortgage rates", "https://k/mort")));
    when(classifier.classify(eq(WORLDVIEW), anyList()))
        .thenReturn(
            List.of(
                new Suggestion("market:MORT", SuggestionAction.YES, 0.7, "aligned", null),
                new Suggestion("market:HOME", SuggestionAction.NO, 0.6, "no url", null),
                new Suggestion("market:UNKNOWN", SuggestionAction.YES, 0.9, "unknown", null)));

    MarketGraphResponse response = service().build(new GraphRequest(WORLDVIEW, 200, 3, 0.5, 2));

    assertEquals(
        List.of("home prices rise further", "mortgage demand stays strong", "rents climb too"),
        response.derivatives());
    assertEquals("market:MORT", response.graph().coreId());
    assertEquals(3, response.graph().nodes().size());

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<GraphNode>> captor = ArgumentCaptor.forClass(List.class);
    verify(classifier).classify(eq(WORLDVIEW), captor.capture());
    List<GraphNode> top = captor.getValue();
    assertEquals(2, top.size());
    assertEquals("market:MORT", top.get(0).id());
    assertEquals("market:HOME", top.get(1).id());

    assertEquals(1, response.suggestions().size());
    Suggestion suggestion = response.suggestions().get(0);
    assertEquals("market:MORT", suggestion.nodeId());
    assertEquals("https://k/mort", suggestion.url());
  }

  @Test
  @DisplayName("no candidates at all is an upstream error")
  void noCandidates() {
    when(generator.generateSets(anyString(), anyInt()))
        .thenReturn(List.of(List.of("a derivative claim"), List.of("another derivative claim")));
    when(marketSearch.search(anyString(), anyInt())).thenReturn(List.of());

    MarketGraphService service = service();
    GraphRequest request = GraphRequest.of(WORLDVIEW);

    assertThrows(UpstreamException.class, () -> service.build(request));
  }

  @Test
  void closestFirstOrdersByHopThenSimilarity() {
    GraphNode far = new GraphNode("far", "far", null, CandidateType.MARKET, 0.99, 2);
    GraphNode nearLow = new GraphNode("nl", "nl", null, CandidateType.MARKET, 0.2, 1);
    GraphNode nearHigh = new GraphNode("nh", "nh", null, CandidateType.MARKET, 0.8, 1);

    List<GraphNode> sorted =
        List.of(far, nearLow, nearHigh).stream().sorted(MarketGraphService.CLOSEST_FIRST).toList();

    assertEquals(List.of(nearHigh, nearLow, far), sorted);
  }
}
