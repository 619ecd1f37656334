package com.flamingo.ai.raggateway.query;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.TokenUsage;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Local pipeline: retrieve the organization's context, then ask the chat model.
 *
 * <p>Usage is reported in the OpenAI shape ({@code prompt_tokens}, {@code completion_tokens},
 * {@code total_tokens}) so the v1 response looks like any other OpenAI-backed service.
 */
@Service
@Slf4j
public class LangChain4jLocalRagPipeline implements LocalRagPipeline {

  static final String CONTEXT_PROMPT =
      """
      You are an assistant that answers questions about an organization's products and services.
      Answer clearly, concisely and professionally, using ONLY the context below as your source of
      truth. Do not invent facts that the context does not contain. If the context is not enough
      to answer, say that you cannot answer from the available knowledge and ask for more detail.

      Context:
      %s""";

  static final String PLAIN_PROMPT =
      "You are an assistant that answers questions about an organization's products and services."
          + " Provide clear, concise and professional responses.";

  private final ChatModel chatModel;
  private final ContextRetriever contextRetriever;
  private final RagGatewayConfig.Local settings;

  public LangChain4jLocalRagPipeline(
      ChatModel chatModel, ContextRetriever contextRetriever, RagGatewayConfig ragGatewayConfig) {
    this.chatModel = chatModel;
    this.contextRetriever = contextRetriever;
    this.settings = ragGatewayConfig.getLocal();
  }

  @Override
  @Timed(value = "rag.local.answer", description = "Time for the local pipeline to answer")
  public Map<String, Object> answer(
      String query, String organizationId, List<ConversationTurn> conversationHistory) {
    RetrievedContext context = contextRetriever.retrieve(query, organizationId);
    log.debug(
        "Local pipeline: org={}, context length={} chars", organizationId, context.text().length());

    List<ChatMessage> messages = new ArrayList<>();
    messages.add(
        SystemMessage.from(
            context.isEmpty() ? PLAIN_PROMPT : String.format(CONTEXT_PROMPT, context.text())));
    if (conversationHistory != null) {
      for (ConversationTurn turn : conversationHistory) {
        if (turn.content() == null || turn.content().isBlank()) {
          continue;
        }
        messages.add(
            turn.isAssistant() ? AiMessage.from(turn.content()) : UserMessage.from(turn.content()));
      }
    }
    messages.add(UserMessage.from(query));

    ChatResponse response = chatModel.chat(ChatRequest.builder().messages(messages).build());
    String answer = response.aiMessage() != null ? response.aiMessage().text() : null;
    if (answer == null) {
      throw new IllegalStateException("Chat model returned no answer text");
    }

    Map<String, Object> result = new LinkedHashMap<>();
    result.put("answer", answer);
    result.put("sources", context.sources());
    if (response.tokenUsage() != null) {
      result.put("usage", toUsageMap(response.tokenUsage()));
    } else {
      log.debug("Model {} reported no token usage", response.modelName());
    }
    result.put("model", response.modelName());
    result.put(
        "finish_reason", response.finishReason() != null ? response.finishReason().name() : null);
    result.put("context_length", context.text().length());
    result.put(
        "parameters",
        Map.of("max_tokens", settings.getMaxTokens(), "temperature", settings.getTemperature()));
    return result;
  }

  private static Map<String, Object> toUsageMap(TokenUsage usage) {
    Map<String, Object> map = new LinkedHashMap<>();
    map.put("prompt_tokens", usage.inputTokenCount());
    map.put("completion_tokens", usage.outputTokenCount());
    map.put("total_tokens", usage.totalTokenCount());
    return map;
  }
}
