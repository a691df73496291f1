package com.gentoro.claimgraph.model;

import java.util.Objects;

/**
 * A market search result.
 *
 * @param id unique id, prefixed with the candidate type ({@code series:} or {@code market:})
 * @param description optional, may be null
 * @param url optional, may be null
 */
public record Candidate(
    String id, CandidateType type, String title, String description, String url) {
  public Candidate {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(title, "title");
  }

  /** Text that represents the candidate when embedded: the title, plus the description. */
  public String embeddingText() {
    if (description == null || description.isBlank()) {
      return title;
    }
    return title + ". " + description;
  }
}
