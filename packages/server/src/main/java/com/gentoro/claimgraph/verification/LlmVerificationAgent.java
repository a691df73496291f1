package com.gentoro.claimgraph.verification;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.llm.LlmClient;
import com.gentoro.claimgraph.model.EvidenceSource;
import com.gentoro.claimgraph.model.VerificationResult;
import com.gentoro.claimgraph.prompt.PromptRenderer;
import com.gentoro.claimgraph.utility.JacksonUtility;
import com.gentoro.claimgraph.utility.RetryPolicy;
import com.gentoro.claimgraph.utility.StringUtility;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Verifies a claim in two phases. First the model researches the claim, calling the {@code
 * search_exa} tool with queries of its own for up to {@link #MAX_SEARCH_ROUNDS} rounds. Then it is
 * asked for a final assessment over everything it found, answered as {@code {confidence,
 * rationale}}. The whole verification is retried as a unit.
 */
public class LlmVerificationAgent implements VerificationAgent {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(LlmVerificationAgent.class);

  public static final int MAX_EVIDENCE = EvidenceSearchTool.MAX_RESULTS;
  public static final int MAX_SEARCH_ROUNDS = 5;
  private static final double SEARCH_TEMPERATURE = 0.2;
  private static final double ASSESSMENT_TEMPERATURE = 0.1;

  private final LlmClient llmClient;
  private final EvidenceSearch evidenceSearch;
  private final PromptRenderer prompts;
  private final int numResults;
  private final RetryPolicy retryPolicy;

  public LlmVerificationAgent(
      LlmClient llmClient,
      EvidenceSearch evidenceSearch,
      PromptRenderer prompts,
      int numResults,
      RetryPolicy retryPolicy) {
    this.llmClient = Objects.requireNonNull(llmClient, "llmClient");
    this.evidenceSearch = Objects.requireNonNull(evidenceSearch, "evidenceSearch");
    this.prompts = Objects.requireNonNull(prompts, "prompts");
    this.numResults = numResults;
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  @Override
  public VerificationResult verify(String claim) {
    return retryPolicy.call("verification", () -> attempt(claim));
  }

  private VerificationResult attempt(String claim) {
    log.info("Verifying claim: '{}'", StringUtility.preview(claim, 100));
    EvidenceSearchTool search = new EvidenceSearchTool(evidenceSearch, prompts, numResults);
    LlmClient.Message system =
        LlmClient.Message.system(prompts.render("verification-system", Map.of()));

    String analysis =
        llmClient.chat(
            List.of(
                system,
                LlmClient.Message.user(
                    prompts.render("verification-request", Map.of("claim", claim)))),
            List.of(search),
            MAX_SEARCH_ROUNDS,
            SEARCH_TEMPERATURE);

    List<EvidenceSource> evidence = search.collected();
    String assessment =
        prompts.render(
            "verification",
            Map.of(
                "claim", claim,
                "evidence", evidence,
                "analysis", analysis == null ? "" : analysis));
    String reply =
        llmClient.chat(
            List.of(system, LlmClient.Message.user(assessment)), ASSESSMENT_TEMPERATURE);

    VerificationResult result = parse(reply, evidence);
    log.info(
        "Verification complete: confidence={} over {} source(s)",
        String.format("%.2f", result.confidence()),
        evidence.size());
    return result;
  }

  static VerificationResult parse(String reply, List<EvidenceSource> evidence) {
    JsonNode root = JacksonUtility.readTree(StringUtility.extractJson(reply));
    JsonNode confidence = root.get("confidence");
    if (confidence == null || !confidence.isNumber()) {
      throw new UpstreamException("Verification answer carries no numeric confidence");
    }
    double clamped = Math.max(0.0, Math.min(1.0, confidence.asDouble()));
    return new VerificationResult(clamped, root.path("rationale").asText(""), evidence);
  }
}
