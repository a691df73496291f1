package com.gentoro.claimgraph.events;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.claimgraph.exception.ClaimGraphErrorCode;
import com.gentoro.claimgraph.exception.ErrorDetails;
import com.gentoro.claimgraph.model.ClaimGraph;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.model.MarketReference;
import com.gentoro.claimgraph.model.VerificationResult;
import com.gentoro.claimgraph.utility.JacksonUtility;
import java.util.Objects;

/**
 * A progress event of a build. The payload is a JSON snapshot taken when the event is created, so
 * later mutations of a node do not leak into events that were already emitted.
 *
 * <pre>
 * claim_generated  {node}
 * claim_verifying  {nodeId, label}
 * claim_verified   {nodeId, verification} | {nodeId, error: {code, message}}
 * sources_found    {nodeId, market}
 * graph_complete   {nodes, edges, coreId}
 * error            {error, code, type}
 * </pre>
 */
public record GraphEvent(GraphEventType type, JsonNode data) {
  public GraphEvent {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(data, "data");
  }

  public static GraphEvent claimGenerated(ClaimNode node) {
    ObjectNode data = object();
    data.set("node", JacksonUtility.toTree(node));
    return new GraphEvent(GraphEventType.CLAIM_GENERATED, data);
  }

  public static GraphEvent claimVerifying(String nodeId, String label) {
    ObjectNode data = object();
    data.put("nodeId", nodeId);
    data.put("label", label);
    return new GraphEvent(GraphEventType.CLAIM_VERIFYING, data);
  }

  public static GraphEvent claimVerified(String nodeId, VerificationResult verification) {
    ObjectNode data = object();
    data.put("nodeId", nodeId);
    data.set("verification", JacksonUtility.toTree(verification));
    return new GraphEvent(GraphEventType.CLAIM_VERIFIED, data);
  }

  public static GraphEvent claimVerificationFailed(
      String nodeId, ClaimGraphErrorCode code, String message) {
    ObjectNode data = object();
    data.put("nodeId", nodeId);
    ObjectNode error = data.putObject("error");
    error.put("code", code.name());
    error.put("message", message);
    return new GraphEvent(GraphEventType.CLAIM_VERIFIED, data);
  }

  public static GraphEvent sourcesFound(String nodeId, MarketReference market) {
    ObjectNode data = object();
    data.put("nodeId", nodeId);
    data.set("market", JacksonUtility.toTree(market));
    return new GraphEvent(GraphEventType.SOURCES_FOUND, data);
  }

  public static GraphEvent graphComplete(ClaimGraph graph) {
    return new GraphEvent(GraphEventType.GRAPH_COMPLETE, JacksonUtility.toTree(graph));
  }

  public static GraphEvent error(ErrorDetails details) {
    ObjectNode data = object();
    data.put("error", details.message);
    data.put("code", details.code.name());
    data.put("type", details.type);
    return new GraphEvent(GraphEventType.ERROR, data);
  }

  /** Node id the event refers to, or null for graph-level events. */
  public String nodeId() {
    if (data.hasNonNull("nodeId")) {
      return data.get("nodeId").asText();
    }
    if (data.has("node")) {
      return data.get("node").path("id").asText(null);
    }
    return null;
  }

  public String toJson() {
    ObjectNode envelope = object();
    envelope.put("event", type.wireName());
    envelope.set("data", data);
    return JacksonUtility.toJson(envelope);
  }

  private static ObjectNode object() {
    return JacksonUtility.getJsonMapper().createObjectNode();
  }
}
