package com.gentoro.claimgraph.llm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.claimgraph.exception.UpstreamException;
import com.gentoro.claimgraph.utility.JacksonUtility;
import com.gentoro.claimgraph.utility.RetryPolicy;
import com.openai.client.OpenAIClient;
import com.openai.core.JsonValue;
import com.openai.models.ChatModel;
import com.openai.models.FunctionDefinition;
import com.openai.models.FunctionParameters;
import com.openai.models.chat.completions.ChatCompletion;
import com.openai.models.chat.completions.ChatCompletionCreateParams;
import com.openai.models.chat.completions.ChatCompletionFunctionTool;
import com.openai.models.chat.completions.ChatCompletionMessage;
import com.openai.models.chat.completions.ChatCompletionMessageFunctionToolCall;
import com.openai.models.chat.completions.ChatCompletionMessageToolCall;
import com.openai.models.chat.completions.ChatCompletionTool;
import com.openai.models.chat.completions.ChatCompletionToolMessageParam;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** OpenAI implementation of {@link LlmClient} using the openai-java SDK (Chat Completions API). */
public class OpenAiLlmClient implements LlmClient {
  private static final org.slf4j.Logger log =
      com.gentoro.claimgraph.logging.LoggingService.getLogger(OpenAiLlmClient.class);

  public static final String DEFAULT_MODEL = "gpt-4.1-mini";

  private static final TypeReference<HashMap<String, Object>> ARGUMENTS =
      new TypeReference<HashMap<String, Object>>() {};

  private final OpenAIClient openAIClient;
  private final String modelId;
  private final RetryPolicy retryPolicy;

  public OpenAiLlmClient(OpenAIClient openAIClient, String modelId, RetryPolicy retryPolicy) {
    this.openAIClient = Objects.requireNonNull(openAIClient, "openAIClient");
    this.modelId = modelId == null || modelId.isBlank() ? DEFAULT_MODEL : modelId;
    this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
  }

  @Override
  public String chat(List<Message> messages, double temperature) {
    return reply(complete(newRequest(messages, temperature).build()));
  }

  @Override
  public String chat(List<Message> messages, List<Tool> tools, int maxRounds, double temperature) {
    if (tools.isEmpty()) {
      return chat(messages, temperature);
    }
    ChatCompletionCreateParams.Builder builder = newRequest(messages, temperature);
    builder.tools(tools.stream().map(t -> convertTool(t.definition())).toList());

    String content = "";
    for (int round = 1; round <= maxRounds; round++) {
      ChatCompletionMessage message = firstChoice(complete(builder.build()));
      builder.addMessage(message);
      content = message.content().map(String::trim).orElse("");

      List<ChatCompletionMessageToolCall> toolCalls = message.toolCalls().orElse(List.of());
      if (toolCalls.isEmpty()) {
        return content;
      }
      log.debug("Round {}/{}: model requested {} tool call(s)", round, maxRounds, toolCalls.size());
      // Execute tools and feed responses back to the model
      for (ChatCompletionMessageToolCall toolCall : toolCalls) {
        ChatCompletionMessageFunctionToolCall call =
            toolCall
                .function()
                .orElseThrow(() -> new UpstreamException("Model requested a non-function tool"));
        builder.addMessage(
            ChatCompletionToolMessageParam.builder()
                .toolCallId(call.id())
                .content(execute(tools, call))
                .build());
      }
    }
    log.warn("Stopped tool calling after {} round(s)", maxRounds);
    return content;
  }

  private ChatCompletionCreateParams.Builder newRequest(
      List<Message> messages, double temperature) {
    ChatCompletionCreateParams.Builder builder =
        ChatCompletionCreateParams.builder().model(ChatModel.of(modelId)).temperature(temperature);
    messages.forEach(
        message -> {
          switch (message.role()) {
            case SYSTEM -> builder.addSystemMessage(message.content());
            case ASSISTANT -> builder.addAssistantMessage(message.content());
            case USER -> builder.addUserMessage(message.content());
          }
        });
    return builder;
  }

  private ChatCompletion complete(ChatCompletionCreateParams params) {
    return retryPolicy.call(
        "chat completion (%s)".formatted(modelId),
        () -> {
          long start = System.currentTimeMillis();
          ChatCompletion completion = openAIClient.chat().completions().create(params);
          log.debug(
              "[Inference] - OpenAI {} took {} ms",
              modelId,
              System.currentTimeMillis() - start);
          return completion;
        });
  }

  private static ChatCompletionMessage firstChoice(ChatCompletion completion) {
    if (completion.choices().isEmpty()) {
      throw new UpstreamException("Chat completion returned no choices");
    }
    return completion.choices().get(0).message();
  }

  private static String reply(ChatCompletion completion) {
    return firstChoice(completion).content().map(String::trim).orElse("");
  }

  private static String execute(List<Tool> tools, ChatCompletionMessageFunctionToolCall call) {
    String name = call.function().name();
    Tool tool =
        tools.stream()
            .filter(t -> t.name().equals(name))
            .findFirst()
            .orElseThrow(
                () ->
                    new UpstreamException(
                        "Model requested unknown tool " + name, Map.of("tool", name), null));
    try {
      Map<String, Object> arguments =
          JacksonUtility.getJsonMapper()
              .readValue(Objects.requireNonNullElse(call.function().arguments(), "{}"), ARGUMENTS);
      return tool.execute(arguments);
    } catch (Exception e) {
      throw new UpstreamException("Failed to execute tool: " + name, Map.of("tool", name), e);
    }
  }

  private static ChatCompletionTool convertTool(ToolDefinition definition) {
    Map<String, Object> properties = new LinkedHashMap<>();
    for (ToolProperty property : definition.parameters()) {
      properties.put(
          property.name(),
          Map.of("type", property.type().jsonType(), "description", property.description()));
    }
    List<String> required =
        definition.parameters().stream()
            .filter(ToolProperty::required)
            .map(ToolProperty::name)
            .toList();

    FunctionParameters parameters =
        FunctionParameters.builder()
            .putAdditionalProperty("type", JsonValue.from("object"))
            .putAdditionalProperty("properties", JsonValue.from(properties))
            .putAdditionalProperty("required", JsonValue.from(required))
            .putAdditionalProperty("additionalProperties", JsonValue.from(false))
            .build();
    FunctionDefinition function =
        FunctionDefinition.builder()
            .name(definition.name())
            .description(definition.description())
            .parameters(parameters)
            .build();
    return ChatCompletionTool.ofFunction(
        ChatCompletionFunctionTool.builder().function(function).build());
  }
}
