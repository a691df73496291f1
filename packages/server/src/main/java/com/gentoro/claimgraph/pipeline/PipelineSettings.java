package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.exception.ConfigException;
import org.apache.commons.configuration2.Configuration;

/**
 * Tuning of the build pipeline.
 *
 * @param verifyConcurrency verifications in flight at once
 * @param attachConcurrency market searches in flight at once
 * @param embedConcurrency embedding calls in flight at once
 * @param searchConcurrency per-derivative market searches in flight at once (candidate graph)
 * @param marketRelevance relevance recorded on every attached market
 * @param marketLimit upper bound of the per-claim market query
 * @param derivativeSets derivative sets requested per build
 * @param executorThreads size of the shared worker pool
 */
public record PipelineSettings(
    int verifyConcurrency,
    int attachConcurrency,
    int embedConcurrency,
    int searchConcurrency,
    double marketRelevance,
    int marketLimit,
    int derivativeSets,
    int executorThreads) {

  public static final PipelineSettings DEFAULTS = new PipelineSettings(8, 8, 16, 8, 0.8, 3, 4, 16);

  public PipelineSettings {
    requirePositive("graph.verify.concurrency", verifyConcurrency);
    requirePositive("graph.attach.concurrency", attachConcurrency);
    requirePositive("graph.embed.concurrency", embedConcurrency);
    requirePositive("graph.search.concurrency", searchConcurrency);
    requirePositive("graph.market.limit", marketLimit);
    requirePositive("graph.executor.threads", executorThreads);
    if (marketRelevance < 0.0 || marketRelevance > 1.0) {
      throw new ConfigException("graph.market.relevance must be within [0,1]: " + marketRelevance);
    }
  }

  public static PipelineSettings from(Configuration config) {
    return new PipelineSettings(
        config.getInt("graph.verify.concurrency", DEFAULTS.verifyConcurrency),
        config.getInt("graph.attach.concurrency", DEFAULTS.attachConcurrency),
        config.getInt("graph.embed.concurrency", DEFAULTS.embedConcurrency),
        config.getInt("graph.search.concurrency", DEFAULTS.searchConcurrency),
        config.getDouble("graph.market.relevance", DEFAULTS.marketRelevance),
        config.getInt("graph.market.limit", DEFAULTS.marketLimit),
        config.getInt("graph.derivatives.sets", DEFAULTS.derivativeSets),
        config.getInt("graph.executor.threads", DEFAULTS.executorThreads));
  }

  private static void requirePositive(String key, int value) {
    if (value < 1) {
      throw new ConfigException(key + " must be positive: " + value);
    }
  }
}
