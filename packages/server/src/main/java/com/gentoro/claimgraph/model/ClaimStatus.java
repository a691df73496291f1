package com.gentoro.claimgraph.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a claim node. Transitions only move forward: generated → verifying → verified or
 * failed. The root claim is created directly as {@link #VERIFIED}.
 */
public enum ClaimStatus {
  GENERATED("generated"),
  VERIFYING("verifying"),
  VERIFIED("verified"),
  FAILED("failed");

  private final String wireName;

  ClaimStatus(String wireName) {
    this.wireName = wireName;
  }

  @JsonValue
  public String wireName() {
    return wireName;
  }

  public boolean isTerminal() {
    return this == VERIFIED || this == FAILED;
  }

  public boolean canTransitionTo(ClaimStatus next) {
    return switch (this) {
      case GENERATED -> next == VERIFYING;
      case VERIFYING -> next == VERIFIED || next == FAILED;
      case VERIFIED, FAILED -> false;
    };
  }
}
