package com.gentoro.claimgraph.derivative;

import java.util.List;

/** Produces sets of derivative claims for a worldview. */
public interface DerivativeGenerator {

  /**
   * Generate {@code numSets} sets; individual sets may fail as long as at least two succeed.
   *
   * @param worldview the core belief
   * @param numSets requested set count, within [3,5]
   * @return the validated sets that succeeded, each with 6 to 15 claims
   * @throws com.gentoro.claimgraph.exception.ValidationException when numSets is out of range or
   *     fewer than two sets succeed
   */
  List<List<String>> generateSets(String worldview, int numSets);
}
