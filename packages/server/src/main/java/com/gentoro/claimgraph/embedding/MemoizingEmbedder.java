package com.gentoro.claimgraph.embedding;

import com.gentoro.claimgraph.utility.StringUtility;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Build-scoped memo in front of an {@link Embedder}. Texts are whitespace-normalized before they
 * are embedded; each distinct normalized text reaches the delegate once, except when two workers
 * request the same text at the same moment. Returned arrays are shared and must not be modified.
 */
public class MemoizingEmbedder implements Embedder {
  private final Embedder delegate;
  private final Map<String, float[]> memo = new ConcurrentHashMap<>();

  public MemoizingEmbedder(Embedder delegate) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
  }

  @Override
  public float[] embed(String text) {
    String cleaned = StringUtility.normalizeWhitespace(text);
    float[] cached = memo.get(cleaned);
    if (cached != null) {
      return cached;
    }
    float[] vector = delegate.embed(cleaned);
    memo.put(cleaned, vector);
    return vector;
  }

  public int size() {
    return memo.size();
  }
}
