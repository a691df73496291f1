package com.gentoro.claimgraph.suggest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.llm.LlmClient;
import com.gentoro.claimgraph.model.GraphNode;
import com.gentoro.claimgraph.model.Suggestion;
import com.gentoro.claimgraph.model.SuggestionAction;
import com.gentoro.claimgraph.prompt.PromptRenderer;
import com.gentoro.claimgraph.utility.JacksonUtility;
import com.gentoro.claimgraph.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

public class LlmSuggestionClassifier implements SuggestionClassifier {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(LlmSuggestionClassifier.class);

  static final double DEFAULT_CONFIDENCE = 0.5;
  private static final double TEMPERATURE = 0.2;

  private final LlmClient llmClient;
  private final PromptRenderer prompts;

  public LlmSuggestionClassifier(LlmClient llmClient, PromptRenderer prompts) {
    this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
  }

  @Override
  public List<Suggestion> classify(String worldview, List<GraphNode> nodes) {
    if (nodes.isEmpty()) {
      return List.of();
    }
    ObjectNode payload = JacksonUtility.getJsonMapper().createObjectNode();
    payload.put("worldview", worldview);
    ArrayNode markets = payload.putArray("markets");
    for (GraphNode node : nodes) {
      markets
          .addObject()
          .put("nodeId", node.id())
          .put("title", node.label())
          .put("similarity", node.similarity());
    }

    String reply =
        llmClient.chat(
            List.of(
                LlmClient.Message.system(prompts.render("suggestions", Map.of())),
                LlmClient.Message.user(JacksonUtility.toJson(payload))),
            TEMPERATURE);
    return parse(reply);
  }

  /** Entries that are malformed are skipped, not fatal. */
  static List<Suggestion> parse(String reply) {
    JsonNode root = JacksonUtility.readTree(StringUtility.extractJson(reply));
    List<Suggestion> suggestions = new ArrayList<>();
    for (JsonNode item : root.path("suggestions")) {
      String nodeId = item.path("nodeId").asText(null);
      String action = item.path("action").asText(null);
      if (nodeId == null || action == null) {
        log.debug("Skipping suggestion without nodeId or action: {}", item);
        continue;
      }
      try {
        suggestions.add(
            new Suggestion(
                nodeId,
                SuggestionAction.valueOf(action.trim().toUpperCase(Locale.ROOT)),
                item.path("confidence").asDouble(DEFAULT_CONFIDENCE),
                item.path("rationale").asText(""),
                null));
      } catch (IllegalArgumentException | ValidationException e) {
        log.debug("Skipping malformed suggestion for {}: {}", nodeId, e.getMessage());
      }
    }
    return suggestions;
  }
}
