package com.gentoro.claimgraph.market;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.model.Candidate;
import com.gentoro.claimgraph.model.CandidateType;
import com.gentoro.claimgraph.support.StubHttp;
import com.gentoro.claimgraph.utility.RetryPolicy;
import java.util.ArrayList;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.Request;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class KalshiMarketSearchTest {
  private final List<Request> requests = new ArrayList<>();

  private KalshiMarketSearch search(int code, String body) {
    return new KalshiMarketSearch(
        StubHttp.respond(code, body, requests), "https://kalshi.test", RetryPolicy.none());
  }

  @Test
  @DisplayName("series first, then up to three embedded markets, then standalone markets")
  void parsesSeriesAndMarkets() {
    List<Candidate> candidates =
        search(200, StubHttp.fixture("kalshi-search-series.json")).search("fed cuts", 50);

    List<String> ids = candidates.stream().map(Candidate::id).toList();
    assertEquals(
        List.of(
            "series:KXFED",
            "market:KXFED-25MAR",
            "market:KXFED-25MAY",
            "market:KXFED-25JUN",
            "series:CPI",
            "market:RECESSION-25"),
        ids);

    Candidate series = candidates.get(0);
    assertEquals(CandidateType.SERIES, series.type());
    assertEquals("Fed rate decision", series.title());
    assertEquals("Federal funds target range after each meeting", series.description());
    assertEquals("https://kalshi.com/markets/kxfed", series.url());

    // duplicate id keeps its position, later value wins
    assertEquals("Cut in March (standalone)", candidates.get(1).title());
    assertEquals("https://kalshi.com/m/1b", candidates.get(1).url());
    assertEquals("Cut in June", candidates.get(3).title());
    assertEquals("CPI", candidates.get(4).title());
    assertNull(candidates.get(2).url());
  }

  @Test
  void truncatesToLimitAndBuildsQuery() {
    List<Candidate> candidates =
        search(200, StubHttp.fixture("kalshi-search-series.json")).search("fed cuts", 2);

    assertEquals(2, candidates.size());
    HttpUrl url = requests.get(0).url();
    assertEquals("/v1/search/series", url.encodedPath());
    assertEquals("true", url.queryParameter("embedding_search"));
    assertEquals("querymatch", url.queryParameter("order_by"));
    assertEquals("fed cuts", url.queryParameter("query"));
  }

  @Test
  void emptyPayloadIsAnEmptyResult() {
    assertTrue(search(200, "{}").search("anything", 3).isEmpty());
  }

  @Test
  void httpErrorIsUpstreamFailure() {
    KalshiMarketSearch search = search(503, "{}");

    UpstreamException e = assertThrows(UpstreamException.class, () -> search.search("q", 3));
    assertEquals(503, e.getContext().get("status"));
  }
}
