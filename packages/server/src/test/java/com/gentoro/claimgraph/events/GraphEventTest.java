package com.gentoro.claimgraph.events;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.claimgraph.exception.ClaimGraphErrorCode;
import com.gentoro.claimgraph.exception.ExceptionUtil;
import com.gentoro.claimgraph.exception.ValidationException;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.model.ClaimStatus;
import com.gentoro.claimgraph.model.MarketReference;
import com.gentoro.claimgraph.utility.JacksonUtility;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class GraphEventTest {

  @Test
  @DisplayName("claim_generated carries a snapshot of the node")
  void generatedEventIsASnapshot() {
    ClaimNode node = new ClaimNode("claim-1", "Rates fall", ClaimStatus.GENERATED, 0.9, 1);
    GraphEvent event = GraphEvent.claimGenerated(node);

    node.transitionTo(ClaimStatus.VERIFYING);

    assertEquals("generated", event.data().path("node").path("status").asText());
    assertEquals("claim-1", event.nodeId());
  }

  @Test
  void toJsonWrapsTypeAndData() {
    GraphEvent event =
        GraphEvent.sourcesFound(
            "claim-2", new MarketReference("market:X", "X market", "https://x", 0.8));

    JsonNode json = JacksonUtility.readTree(event.toJson());

    assertEquals("sources_found", json.path("event").asText());
    assertEquals("claim-2", json.path("data").path("nodeId").asText());
    assertEquals("market:X", json.path("data").path("market").path("id").asText());
    assertEquals(0.8, json.path("data").path("market").path("relevance").asDouble());
  }

  @Test
  void failedVerificationReportsCodeAndMessage() {
    GraphEvent event =
        GraphEvent.claimVerificationFailed(
            "claim-3", ClaimGraphErrorCode.UPSTREAM_ERROR, "search down");

    assertEquals(GraphEventType.CLAIM_VERIFIED, event.type());
    assertEquals("UPSTREAM_ERROR", event.data().path("error").path("code").asText());
    assertEquals("search down", event.data().path("error").path("message").asText());
    assertEquals("claim-3", event.nodeId());
  }

  @Test
  void errorEventIsGraphLevel() {
    GraphEvent event =
        GraphEvent.error(ExceptionUtil.toErrorDetails(new ValidationException("k must be > 0")));

    assertNull(event.nodeId());
    assertEquals(GraphEventType.ERROR, event.type());
    assertEquals("k must be > 0", event.data().path("error").asText());
    assertEquals("INVALID_ARGUMENT", event.data().path("code").asText());
    assertEquals("ValidationException", event.data().path("type").asText());
  }
}
