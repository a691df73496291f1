package com.gentoro.claimgraph.verification;

import com.gentoro.claimgraph.model.EvidenceSource;
import java.util.List;

/** Web search returning documents relevant to a query, most relevant first. */
@FunctionalInterface
public interface EvidenceSearch {
  List<EvidenceSource> search(String query, int numResults);
}
