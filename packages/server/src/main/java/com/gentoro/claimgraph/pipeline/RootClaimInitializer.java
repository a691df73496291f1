package com.gentoro.claimgraph.pipeline;

import com.gentoro.claimgraph.events.EventSink;
import com.gentoro.claimgraph.events.GraphEvent;
import com.gentoro.claimgraph.model.ClaimNode;
import com.gentoro.claimgraph.model.ClaimStatus;

/** Creates the root claim. The worldview is taken as true, so the root is never verified. */
public class RootClaimInitializer {

  public ClaimNode initialize(String worldview, EventSink events) {
    ClaimNode root = new ClaimNode(ClaimIds.next(), worldview, ClaimStatus.VERIFIED, 1.0, 0);
    events.emit(GraphEvent.claimGenerated(root));
    return root;
  }
}
