package com.gentoro.claimgraph.events;

import com.fasterxml.jackson.annotation.JsonValue;

public enum GraphEventType {
  CLAIM_GENERATED("claim_generated"),
  CLAIM_VERIFYING("claim_verifying"),
  CLAIM_VERIFIED("claim_verified"),
  SOURCES_FOUND("sources_found"),
  GRAPH_COMPLETE("graph_complete"),
  ERROR("error");

  private final String wireName;

  GraphEventType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
