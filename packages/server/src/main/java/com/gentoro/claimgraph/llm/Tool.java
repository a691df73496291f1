package com.gentoro.claimgraph.llm;

import java.util.Map;

/** A function the model may call during a tool-aware {@link LlmClient} chat. */
public interface Tool {
  ToolDefinition definition();

  /**
   * Run the tool with the arguments the model supplied.
   *
   * @return text fed back to the model as the tool result
   */
  String execute(Map<String, Object> arguments);

  default String name() {
    return definition().name();
  }
}
