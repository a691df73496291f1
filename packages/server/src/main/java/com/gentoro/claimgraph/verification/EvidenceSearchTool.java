package com.gentoro.claimgraph.verification;

import com.gentoro.claimgraph.llm.Tool;
import com.gentoro.claimgraph.llm.ToolDefinition;
import com.gentoro.claimgraph.llm.ToolProperty;
import com.gentoro.claimgraph.model.EvidenceSource;
import com.gentoro.claimgraph.prompt.PromptRenderer;
import com.gentoro.claimgraph.utility.StringUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exposes an {@link EvidenceSearch} to the model as the {@code search_exa} tool. One instance
 * serves a single verification and remembers every source its searches returned.
 */
public class EvidenceSearchTool implements Tool {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(EvidenceSearchTool.class);

  public static final String NAME = "search_exa";
  static final int MAX_RESULTS = 10;

  private static final ToolDefinition DEFINITION =
      new ToolDefinition(
          NAME,
          "Search the internet using Exa to find relevant articles and information about a topic."
              + " Returns articles with titles, URLs, and content snippets.",
          List.of(
              new ToolProperty(
                  "query",
                  "The search query to find relevant information",
                  ToolProperty.Type.STRING,
                  true),
              new ToolProperty(
                  "num_results",
                  "Number of results to return (default 5, max 10)",
                  ToolProperty.Type.INTEGER,
                  false)));

  private final EvidenceSearch evidenceSearch;
  private final PromptRenderer prompts;
  private final int defaultResults;
  private final List<EvidenceSource> collected = new ArrayList<>();

  public EvidenceSearchTool(
      EvidenceSearch evidenceSearch, PromptRenderer prompts, int defaultResults) {
    this.evidenceSearch = Objects.requireNonNull(evidenceSearch, "evidenceSearch");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
    this.defaultResults = clamp(defaultResults);
  }

  @Override
  public ToolDefinition definition() {
    return DEFINITION;
  }

  @Override
  public String execute(Map<String, Object> arguments) {
    Object rawQuery = arguments.get("query");
    String query = rawQuery == null ? "" : rawQuery.toString().trim();
    if (query.isEmpty()) {
      return "No query given.";
    }
    int numResults =
        arguments.get("num_results") instanceof Number n ? clamp(n.intValue()) : defaultResults;

    log.debug("Searching evidence: '{}'", StringUtility.preview(query, 80));
    List<EvidenceSource> sources = evidenceSearch.search(query, numResults);
    synchronized (collected) {
      collected.addAll(sources);
    }
    return prompts.render("search-results", Map.of("evidence", sources));
  }

  /** Sources of every search so far in call order, unique by url, at most {@value #MAX_RESULTS}. */
  public List<EvidenceSource> collected() {
    Map<String, EvidenceSource> unique = new LinkedHashMap<>();
    synchronized (collected) {
      collected.forEach(source -> unique.putIfAbsent(source.url(), source));
    }
    return unique.values().stream().limit(MAX_RESULTS).toList();
  }

  private static int clamp(int numResults) {
    return Math.max(1, Math.min(numResults, MAX_RESULTS));
  }
}
