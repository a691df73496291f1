package com.gentoro.claimgraph.pipeline;

import java.util.UUID;

final class ClaimIds {
  private ClaimIds() {}

  /** {@code claim-} followed by 12 random hex digits. */
  static String next() {
    return "claim-" + UUID.randomUUID().toString().replace("-", "").substring(0, 12);
  }
}
