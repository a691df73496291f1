package com.gentoro.claimgraph.embedding;

import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.utility.RetryPolicy;
import com.openai.client.OpenAIClient;
import com.openai.models.embeddings.CreateEmbeddingResponse;
import com.openai.models.embeddings.EmbeddingCreateParams;
import java.util.List;
import java.util.Objects;

/** {@link Embedder} backed by the OpenAI embeddings endpoint (openai-java SDK). */
public class OpenAiEmbedder implements Embedder {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(OpenAiEmbedder.class);

  public static final String DEFAULT_MODEL = "text-embedding-3-large";

  private final OpenAIClient client;
  private final String model;
  private final RetryPolicy retryPolicy;

  public OpenAiEmbedder(OpenAIClient client, String model, RetryPolicy retryPolicy) {
    this.client = Objects.requireNonNull(client, "client");
    this.model = model == null || model.isBlank() ? DEFAULT_MODEL : model;
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  @Override
  public float[] embed(String text) {
    return retryPolicy.call("embedding", () -> request(text));
  }

  private float[] request(String text) {
    long start = System.currentTimeMillis();
    CreateEmbeddingResponse response =
        client
            .embeddings()
            .create(EmbeddingCreateParams.builder().model(model).input(text).build());
    if (response.data().isEmpty()) {
      throw new UpstreamException("Embedding response contained no data");
    }
    List<? extends Number> values = response.data().get(0).embedding();
    float[] vector = new float[values.size()];
    for (int i = 0; i < vector.length; i++) {
      vector[i] = values.get(i).floatValue();
    }
    log.trace(
        "Embedded {} chars into {} dimensions in {} ms",
        text.length(),
        vector.length,
        System.currentTimeMillis() - start);
    return vector;
  }
}
