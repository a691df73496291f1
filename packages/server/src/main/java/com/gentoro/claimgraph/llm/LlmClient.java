package com.gentoro.claimgraph.llm;

import java.util.List;

/**
 * Primary abstraction for interacting with Large Language Model providers.
 *
 * <p>Implementations encapsulate the provider SDK and expose a single entry point: one
 * chat-completion turn returning the assistant's text. Failures surface as {@link
 * com.gentoro.claimgraph.exception.UpstreamException}.
 */
public interface LlmClient {

  /**
   * Run a single completion.
   *
   * @param messages conversation, at most one {@link Role#SYSTEM} message
   * @param temperature sampling temperature
   * @return the assistant's reply, trimmed
   */
  String chat(List<Message> messages, double temperature);

  /**
   * Run a completion in which the model may call {@code tools}. Every requested call is executed
   * and its result fed back, until the model answers without tool calls or {@code maxRounds}
   * completions have been made.
   *
   * @return the last assistant reply, trimmed
   */
  String chat(List<Message> messages, List<Tool> tools, int maxRounds, double temperature);

  enum Role {
    SYSTEM,
    ASSISTANT,
    USER
  }

  record Message(Role role, String content) {
    public static Message system(String content) {
      return new Message(Role.SYSTEM, content);
    }

    public static Message user(String content) {
      return new Message(Role.USER, content);
    }
  }
}
