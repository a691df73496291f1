package com.gentoro.claimgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CandidateType {
  SERIES("series"),
  MARKET("market");

  private final String wireName;

  CandidateType(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }
}
