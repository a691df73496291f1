package com.gentoro.claimgraph.support;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.embedding.Embedder;
import com.gentoro.claimgraph.embedding.EmbeddingBatch;

/** Helpers that run fan-out stages on the calling thread, for deterministic ordering. */
public final class Direct {
  private Direct() {}

  public static BoundedFanOut fanOut() {
    return new BoundedFanOut(Runnable::run);
  }

  public static EmbeddingBatch embeddings(Embedder embedder) {
    return new EmbeddingBatch(embedder, fanOut(), 4);
  }
}
