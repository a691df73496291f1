package com.gentoro.claimgraph.model;

import com.gentoro.claimgraph.exception.ValidationException;

/**
 * Parameters of a build request.
 *
 * @param worldview the core belief, trimmed, 4 to 2000 characters
 * @param k market search result limit, 1 to 1000
 * @param maxHops hop cut-off of the candidate graph, 0 to 6
 * @param threshold minimum similarity of a similarity edge, 0 to 1
 * @param topN claims kept by the claim graph, nodes classified by the candidate graph, 1 to 100
 */
public record GraphRequest(String worldview, int k, int maxHops, double threshold, int topN) {
  public static final int DEFAULT_K = 200;
  public static final int DEFAULT_MAX_HOPS = 3;
  public static final double DEFAULT_THRESHOLD = 0.78;
  public static final int DEFAULT_TOP_N = 15;

  public GraphRequest {
    worldview = worldview == null ? "" : worldview.trim();
    if (worldview.isEmpty()) {
      throw new ValidationException("worldview is required");
    }
    if (worldview.length() < 4 || worldview.length() > 2000) {
      throw new ValidationException("worldview must be between 4 and 2000 characters");
    }
    if (k < 1 || k > 1000) {
      throw new ValidationException("k must be within [1,1000]: " + k);
    }
    if (maxHops < 0 || maxHops > 6) {
      throw new ValidationException("maxHops must be within [0,6]: " + maxHops);
    }
    if (Double.isNaN(threshold) || threshold < 0.0 || threshold > 1.0) {
      throw new ValidationException("threshold must be within [0,1]: " + threshold);
    }
    if (topN < 1 || topN > 100) {
      throw new ValidationException("topN must be within [1,100]: " + topN);
    }
  }

  public static GraphRequest of(String worldview) {
    return new GraphRequest(
        worldview, DEFAULT_K, DEFAULT_MAX_HOPS, DEFAULT_THRESHOLD, DEFAULT_TOP_N);
  }
}
