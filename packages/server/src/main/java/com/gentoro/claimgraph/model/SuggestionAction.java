package com.gentoro.claimgraph.model;

/** Directional alignment of a market with the worldview. */
public enum SuggestionAction {
  /** The worldview makes a YES resolution more likely. */
  YES,
  /** The worldview makes a YES resolution less likely. */
  NO,
  /** Unclear, ambiguous or unrelated. */
  SKIP
}
