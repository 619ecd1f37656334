package com.flamingo.ai.raggateway.query;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.flamingo.ai.raggateway.config.RagGatewayConfig;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.output.FinishReason;
import dev.langchain4j.model.output.TokenUsage;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
@DisplayName("LangChain4jLocalRagPipeline Tests")
class LangChain4jLocalRagPipelineTest {

  @Mock private ChatModel chatModel;
  @Mock private ContextRetriever contextRetriever;

  private LangChain4jLocalRagPipeline pipeline;

  @BeforeEach
  void setUp() {
    pipeline = new LangChain4jLocalRagPipeline(chatModel, contextRetriever, new RagGatewayConfig());
  }

  private static ChatResponse response(String text) {
    return ChatResponse.builder()
        .aiMessage(AiMessage.from(text))
        .tokenUsage(new TokenUsage(120, 30))
        .finishReason(FinishReason.STOP)
        .modelName("gpt-3.5-turbo")
        .build();
  }

  @Test
  @DisplayName("Should ground the system prompt in retrieved context")
  void shouldUseRetrievedContext() {
    when(contextRetriever.retrieve("What is the SLA?", "org-1"))
        .thenReturn(new RetrievedContext("Uptime is 99.9% monthly.", List.of("file_sla")));
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("99.9%"));

    Map<String, Object> result = pipeline.answer("What is the SLA?", "org-1", List.of());

    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
    verify(chatModel).chat(captor.capture());
    List<ChatMessage> messages = captor.getValue().messages();
    assertThat(messages).hasSize(2);
    assertThat(((SystemMessage) messages.get(0)).text()).contains("Uptime is 99.9% monthly.");
    assertThat(((UserMessage) messages.get(1)).singleText()).isEqualTo("What is the SLA?");

    assertThat(result)
        .containsEntry("answer", "99.9%")
        .containsEntry("sources", List.of("file_sla"))
        .containsEntry("model", "gpt-3.5-turbo")
        .containsEntry("finish_reason", "STOP")
        .containsEntry("context_length", "Uptime is 99.9% monthly.".length());
    assertThat(result.get("usage"))
        .isEqualTo(Map.of("prompt_tokens", 120, "completion_tokens", 30, "total_tokens", 150));
  }

  @Test
  @DisplayName("Should use the plain prompt and replay history when there is no context")
  void shouldReplayHistoryWithoutContext() {
    when(contextRetriever.retrieve("And tomorrow?", "org-1")).thenReturn(RetrievedContext.EMPTY);
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(response("Sunny too."));

    pipeline.answer(
        "And tomorrow?",
        "org-1",
        List.of(
            new ConversationTurn("user", "Weather today?"),
            new ConversationTurn("assistant", "Sunny.")));

    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
    verify(chatModel).chat(captor.capture());
    List<ChatMessage> messages = captor.getValue().messages();
    assertThat(messages).hasSize(4);
    assertThat(((SystemMessage) messages.get(0)).text())
        .isEqualTo(LangChain4jLocalRagPipeline.PLAIN_PROMPT);
    assertThat(messages.get(1)).isInstanceOf(UserMessage.class);
    assertThat(((AiMessage) messages.get(2)).text()).isEqualTo("Sunny.");
    assertThat(((UserMessage) messages.get(3)).singleText()).isEqualTo("And tomorrow?");
  }

  @Test
  @DisplayName("Should leave usage out when the model reports none")
  void shouldOmitMissingUsage() {
    when(contextRetriever.retrieve("q", "org-1")).thenReturn(RetrievedContext.EMPTY);
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(ChatResponse.builder().aiMessage(AiMessage.from("hi")).build());

    Map<String, Object> result = pipeline.answer("q", "org-1", List.of());

    assertThat(result).doesNotContainKey("usage").containsEntry("answer", "hi");
  }

  @Test
  @DisplayName("Should propagate chat model failures")
  void shouldPropagateModelFailures() {
    when(contextRetriever.retrieve("q", "org-1")).thenReturn(RetrievedContext.EMPTY);
    when(chatModel.chat(any(ChatRequest.class))).thenThrow(new RuntimeException("rate limited"));

    assertThatThrownBy(() -> pipeline.answer("q", "org-1", List.of()))
        .isInstanceOf(RuntimeException.class)
        .hasMessage("rate limited");
  }
}
