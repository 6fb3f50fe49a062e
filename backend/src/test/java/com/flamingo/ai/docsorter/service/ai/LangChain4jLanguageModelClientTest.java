package com.flamingo.ai.docsorter.service.ai;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docsorter.config.AnalysisConfig;
import com.flamingo.ai.docsorter.exception.LlmServiceException;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;

@ExtendWith(MockitoExtension.class)
@DisplayName("LangChain4jLanguageModelClient Tests")
class LangChain4jLanguageModelClientTest {

  @Mock private ObjectProvider<ChatModel> chatModelProvider;
  @Mock private ChatModel chatModel;

  private final ObjectMapper objectMapper = new ObjectMapper();
  private AnalysisConfig config;
  private LangChain4jLanguageModelClient client;

  @BeforeEach
  void setUp() {
    lenient().when(chatModelProvider.getIfAvailable()).thenReturn(chatModel);
    config = new AnalysisConfig();
    client = new LangChain4jLanguageModelClient(chatModelProvider, objectMapper, config);
  }

  private static ChatResponse reply(String text) {
    return ChatResponse.builder().aiMessage(AiMessage.from(text)).build();
  }

  @Test
  @DisplayName("should send system and user messages with the requested model")
  void shouldBuildChatRequest() {
    when(chatModel.chat(any(ChatRequest.class))).thenReturn(reply("{\"ok\": true}"));

    String text =
        client.complete(new ModelRequest("gpt-4o", "system prompt", "user prompt", 300, 0.1));

    assertThat(text).isEqualTo("{\"ok\": true}");
    ArgumentCaptor<ChatRequest> captor = ArgumentCaptor.forClass(ChatRequest.class);
    verify(chatModel).chat(captor.capture());
    ChatRequest request = captor.getValue();
    assertThat(request.messages()).hasSize(2);
    assertThat(request.parameters().modelName()).isEqualTo("gpt-4o");
    assertThat(request.parameters().maxOutputTokens()).isEqualTo(300);
  }

  @Test
  @DisplayName("should report unavailable and refuse calls without a chat model")
  void shouldFail_whenNoChatModel() {
    when(chatModelProvider.getIfAvailable()).thenReturn(null);

    assertThat(client.isAvailable()).isFalse();
    assertThatThrownBy(() -> client.complete(new ModelRequest("m", "s", "u", 10, 0.0)))
        .isInstanceOf(LlmServiceException.class);
  }

  @Test
  @DisplayName("should wrap provider errors and flag rate limits")
  void shouldWrapProviderErrors() {
    when(chatModel.chat(any(ChatRequest.class)))
        .thenThrow(new RuntimeException("HTTP 429 Too Many Requests"));

    assertThatThrownBy(() -> client.complete(new ModelRequest("m", "s", "u", 10, 0.0)))
        .isInstanceOfSatisfying(
            LlmServiceException.class, e -> assertThat(e.isRateLimited()).isTrue());
  }

  @Test
  @DisplayName("should split a batch response into one JSON object per document")
  void shouldSplitBatchResponse() throws Exception {
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(
            reply(
                "{\"documents\": [{\"clientName\": \"A\"}, {\"clientName\": \"B\"}]}"));

    List<String> results = client.completeBatch("gpt-4o-mini", List.of("first", "second"));

    assertThat(results).hasSize(2);
    assertThat(objectMapper.readTree(results.get(1)).get("clientName").asText()).isEqualTo("B");
  }

  @Test
  @DisplayName("should reject a batch response with the wrong number of results")
  void shouldRejectBatch_whenCountMismatch() {
    when(chatModel.chat(any(ChatRequest.class)))
        .thenReturn(reply("{\"documents\": [{\"clientName\": \"A\"}]}"));

    assertThatThrownBy(() -> client.completeBatch("gpt-4o-mini", List.of("first", "second")))
        .isInstanceOf(LlmServiceException.class)
        .hasMessageContaining("1 results for 2 documents");
  }

  @Test
  void shouldFollowConfiguredBatchingFlag() {
    config.getAi().setIntelligentBatching(false);

    assertThat(client.supportsBatching()).isFalse();
  }
}
