package com.gentoro.claimgraph.market;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.model.Candidate;
import com.gentoro.claimgraph.model.CandidateType;
import com.gentoro.claimgraph.utility.JacksonUtility;
import com.gentoro.claimgraph.utility.RetryPolicy;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * {@link MarketSearch} over the Kalshi series search endpoint.
 *
 * <p>Results are the matching series, each followed by up to {@link #MARKETS_PER_SERIES} of its
 * embedded markets, then any standalone markets. Duplicates by id keep their first position and
 * the last value seen.
 */
public class KalshiMarketSearch implements MarketSearch {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(KalshiMarketSearch.class);

  public static final String DEFAULT_BASE_URL = "https://api.elections.kalshi.com";
  static final int MARKETS_PER_SERIES = 3;

  private final OkHttpClient httpClient;
  private final HttpUrl searchUrl;
  private final RetryPolicy retryPolicy;

  public KalshiMarketSearch(OkHttpClient httpClient, String baseUrl, RetryPolicy retryPolicy) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    HttpUrl base = HttpUrl.parse(baseUrl == null ? DEFAULT_BASE_URL : baseUrl);
    if (base == null) {
      throw new ValidationException("Invalid Kalshi base url: " + baseUrl);
    }
    this.searchUrl = base.newBuilder().addPathSegments("v1/search/series").build();
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  @Override
  public List<Candidate> search(String query, int limit) {
    if (limit < 1) {
      return List.of();
    }
    HttpUrl url =
        searchUrl
            .newBuilder()
            .addQueryParameter("embedding_search", "true")
            .addQueryParameter("order_by", "querymatch")
            .addQueryParameter("query", query)
            .build();
    Request request = new Request.Builder().url(url).get().build();

    JsonNode root =
        retryPolicy.call(
            "kalshi search",
            () -> {
              try (Response response = httpClient.newCall(request).execute()) {
                ResponseBody body = response.body();
                if (!response.isSuccessful() || body == null) {
                  throw new UpstreamException(
                      "Kalshi search returned HTTP " + response.code(),
                      Map.of("status", response.code()),
                      null);
                }
                return JacksonUtility.readTree(body.string());
              } catch (IOException e) {
                throw new UpstreamException("Kalshi search request failed", e);
              }
            });
    List<Candidate> candidates = parse(root, limit);
    log.debug("Kalshi search '{}' returned {} candidate(s)", query, candidates.size());
    return candidates;
  }

  static List<Candidate> parse(JsonNode root, int limit) {
    List<Candidate> results = new ArrayList<>();
    int seriesSeen = 0;
    for (JsonNode series : root.path("series")) {
      if (seriesSeen++ >= limit) break;
      Candidate candidate = toCandidate(series, CandidateType.SERIES, "series_id");
      if (candidate == null) continue;
      results.add(candidate);
      int marketsSeen = 0;
      for (JsonNode market : series.path("markets")) {
        if (marketsSeen++ >= MARKETS_PER_SERIES) break;
        Candidate embedded = toCandidate(market, CandidateType.MARKET, "market_id");
        if (embedded != null) results.add(embedded);
      }
    }
    int marketsSeen = 0;
    for (JsonNode market : root.path("markets")) {
      if (marketsSeen++ >= limit) break;
      Candidate standalone = toCandidate(market, CandidateType.MARKET, "market_id");
      if (standalone != null) results.add(standalone);
    }

    Map<String, Candidate> unique = new LinkedHashMap<>();
    results.forEach(c -> unique.put(c.id(), c));
    return unique.values().stream().limit(limit).toList();
  }

  private static Candidate toCandidate(JsonNode item, CandidateType type, String typedIdField) {
    String rawId = firstText(item, "id", typedIdField, "ticker", "slug");
    if (rawId == null) {
      log.debug("Skipping {} without an id", type.wireName());
      return null;
    }
    String title = firstText(item, "title", "name");
    return new Candidate(
        type.wireName() + ":" + rawId,
        type,
        title == null ? rawId : title,
        firstText(item, "description"),
        firstText(item, "url", "permalink"));
  }

  private static String firstText(JsonNode item, String... fields) {
    for (String field : fields) {
      JsonNode value = item.get(field);
      if (value != null && !value.isNull() && !value.asText().isEmpty()) {
        return value.asText();
      }
    }
    return null;
  }
}
