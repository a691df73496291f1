package com.gentoro.claimgraph.derivative;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.llm.LlmClient;
import com.gentoro.claimgraph.prompt.PromptRenderer;
import com.gentoro.claimgraph.utility.JacksonUtility;
import com.gentoro.claimgraph.utility.StringUtility;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Asks the language model for one set of derivative beliefs. The answer must be a JSON array of
 * strings or an object with a {@code derivatives} array.
 */
public class LlmDerivativeSource implements DerivativeSource {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(LlmDerivativeSource.class);

  private final LlmClient llmClient;
  private final PromptRenderer prompts;

  public LlmDerivativeSource(LlmClient llmClient, PromptRenderer prompts) {
    this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
  }

  @Override
  public List<String> generate(String worldview, double temperature) {
    String prompt =
        prompts.render(
            "derivatives",
            Map.of(
                "worldview", worldview.strip(),
                "minItems", DerivativeValidator.MIN_ITEMS,
                "maxItems", DerivativeValidator.MAX_ITEMS));
    String reply =
        llmClient.chat(
            List.of(
                LlmClient.Message.system("You ONLY reply with valid JSON. No commentary."),
                LlmClient.Message.user(prompt)),
            temperature);
    List<String> items = parse(reply);
    log.debug("Derivative source returned {} item(s) at temperature {}", items.size(), temperature);
    return items;
  }

  static List<String> parse(String reply) {
    JsonNode root = JacksonUtility.readTree(StringUtility.extractJson(reply));
    JsonNode array = root.isObject() ? root.get("derivatives") : root;
    if (array == null || !array.isArray()) {
      throw new UpstreamException("Unexpected JSON format for derivatives");
    }
    List<String> items = new ArrayList<>();
    array.forEach(item -> items.add(item.asText()));
    return items;
  }
}
