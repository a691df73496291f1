package com.gentoro.claimgraph.verification;

import com.gentoro.claimgraph.model.VerificationResult;

/** Estimates how plausible a claim is. Failures surface as exceptions. */
@FunctionalInterface
public interface VerificationAgent {
  VerificationResult verify(String claim);
}
