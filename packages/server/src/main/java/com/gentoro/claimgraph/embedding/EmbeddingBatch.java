package com.gentoro.claimgraph.embedding;

import com.gentoro.claimgraph.concurrent.BoundedFanOut;
import com.gentoro.claimgraph.utility.StringUtility;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Embeds a list of texts in parallel on the build's worker pool. */
public class EmbeddingBatch {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(EmbeddingBatch.class);

  private final Embedder embedder;
  private final BoundedFanOut fanOut;
  private final int concurrency;

  public EmbeddingBatch(Embedder embedder, BoundedFanOut fanOut, int concurrency) {
    this.embedder = Objects.requireNonNull(embedder, "embedder");
    this.fanOut = Objects.requireNonNull(fanOut, "fanOut");
    this.concurrency = concurrency;
  }

  public Embedder embedder() {
    return embedder;
  }

  /** Vectors in input order; the first failure aborts the batch. */
  public List<float[]> embedAll(List<String> texts) {
    return fanOut.map("embed", texts, concurrency, embedder::embed);
  }

  /** Vectors in input order; a text whose embedding fails maps to an empty result. */
  public List<Optional<float[]>> embedEach(List<String> texts) {
    return fanOut.map(
        "embed",
        texts,
        concurrency,
        text -> {
          try {
            return Optional.of(embedder.embed(text));
          } catch (RuntimeException e) {
            log.warn(
                "Embedding failed for '{}': {}", StringUtility.preview(text, 80), e.getMessage());
            return Optional.empty();
          }
        });
  }
}
