package com.gentoro.claimgraph.market;

import com.gentoro.claimgraph.model.Candidate;
import java.util.List;

/** Prediction-market search. An empty result is valid. */
@FunctionalInterface
public interface MarketSearch {

  /** Ranked candidates for {@code query}, at most {@code limit} of them. */
  List<Candidate> search(String query, int limit);
}
