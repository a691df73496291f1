package com.gentoro.claimgraph.embedding;

/**
 * Computes semantic embeddings. Implementations are called concurrently from worker threads and
 * report failures as {@link com.gentoro.claimgraph.exception.UpstreamException}.
 */
@FunctionalInterface
public interface Embedder {
  float[] embed(String text);
}
