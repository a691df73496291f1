package com.gentoro.claimgraph.model;

/**
 * Backing of a claim: a verification result, a market reference, or both. Either part may be
 * absent.
 */
public record ClaimSource(VerificationResult verification, MarketReference market) {

  public static ClaimSource ofVerification(VerificationResult verification) {
    return new ClaimSource(verification, null);
  }

  /** Same slot with the market replaced; the verification part is kept. */
  public ClaimSource withMarket(MarketReference market) {
    return new ClaimSource(verification, market);
  }
}
