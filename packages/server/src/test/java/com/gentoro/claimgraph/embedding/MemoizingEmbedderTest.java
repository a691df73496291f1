package com.gentoro.claimgraph.embedding;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.claimgraph.support.MapEmbedder;
import org.junit.jupiter.api.Test;

class MemoizingEmbedderTest {

  @Test
  void embedsEachDistinctTextOnce() {
    MapEmbedder delegate = new MapEmbedder(1f, 0f).put("other text", 0f, 1f);
    MemoizingEmbedder memo = new MemoizingEmbedder(delegate);

    float[] first = memo.embed("some text");
    float[] again = memo.embed("  some   text ");
    memo.embed("other text");

    assertSame(first, again);
    assertEquals(2, delegate.calls());
    assertEquals(2, memo.size());
  }
}
