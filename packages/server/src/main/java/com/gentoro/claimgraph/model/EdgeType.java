package com.gentoro.claimgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/** Relationship carried by a {@link ClaimEdge}. */
public enum EdgeType {
  /** Root claim to a claim generated from it. */
  DERIVES_FROM("derives_from"),
  /** Two claims whose labels embed close to each other. */
  SIMILAR_TO("similar_to");

  private final String wireName;

  EdgeType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
