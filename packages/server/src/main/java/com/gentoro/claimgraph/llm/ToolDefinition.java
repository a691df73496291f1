package com.gentoro.claimgraph.llm;

import java.util.List;
import java.util.Objects;

/**
 * Provider-agnostic description of a tool: its name, what it does and its flat list of
 * parameters.
 */
public record ToolDefinition(String name, String description, List<ToolProperty> parameters) {
  public ToolDefinition {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(description, "description");
    parameters = parameters == null ? List.of() : List.copyOf(parameters);
  }
}
