package com.gentoro.claimgraph.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.model.EvidenceSource;
import com.gentoro.claimgraph.utility.JacksonUtility;
import com.gentoro.claimgraph.utility.RetryPolicy;
import com.gentoro.claimgraph.utility.StringUtility;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/** {@link EvidenceSearch} backed by the Exa search API. */
public class ExaEvidenceSearch implements EvidenceSearch {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(ExaEvidenceSearch.class);

  public static final String DEFAULT_BASE_URL = "https://api.exa.ai";
  public static final int MAX_SNIPPET_LENGTH = 500;
  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

  private final OkHttpClient httpClient;
  private final String baseUrl;
  private final String apiKey;
  private final RetryPolicy retryPolicy;

  public ExaEvidenceSearch(
      OkHttpClient httpClient, String baseUrl, String apiKey, RetryPolicy retryPolicy) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.baseUrl = stripTrailingSlash(baseUrl == null ? DEFAULT_BASE_URL : baseUrl);
    if (apiKey == null || apiKey.isBlank()) {
      throw new ValidationException("Exa API key is required");
    }
    this.apiKey = apiKey;
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  @Override
  public List<EvidenceSource> search(String query, int numResults) {
    ObjectNode body = JacksonUtility.getJsonMapper().createObjectNode();
    body.put("query", query);
    body.put("numResults", numResults);
    body.putObject("contents").putObject("text").put("maxCharacters", MAX_SNIPPET_LENGTH);
    body.put("type", "auto");

    Request request =
        new Request.Builder()
            .url(baseUrl + "/search")
            .header("x-api-key", apiKey)
            .post(RequestBody.create(JacksonUtility.toJson(body), JSON))
            .build();

    return retryPolicy.call(
        "exa search",
        () -> {
          try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
              throw new UpstreamException(
                  "Exa search returned HTTP " + response.code(),
                  Map.of("status", response.code()),
                  null);
            }
            List<EvidenceSource> sources = parse(JacksonUtility.readTree(responseBody.string()));
            log.info(
                "Exa search '{}' found {} source(s)",
                StringUtility.preview(query, 80),
                sources.size());
            return sources;
          } catch (IOException e) {
            throw new UpstreamException("Exa search request failed", e);
          }
        });
  }

  static List<EvidenceSource> parse(JsonNode root) {
    List<EvidenceSource> sources = new ArrayList<>();
    for (JsonNode result : root.path("results")) {
      String url = result.path("url").asText(null);
      if (url == null) continue;
      String title = result.path("title").asText("");
      sources.add(
          new EvidenceSource(
              title.isBlank() ? "Untitled" : title,
              url,
              StringUtility.truncate(result.path("text").asText(""), MAX_SNIPPET_LENGTH)));
    }
    return sources;
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
