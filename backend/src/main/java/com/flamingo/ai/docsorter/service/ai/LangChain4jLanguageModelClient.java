package com.flamingo.ai.docsorter.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docsorter.agent.MetadataPrompts;
import com.flamingo.ai.docsorter.config.AnalysisConfig;
import com.flamingo.ai.docsorter.exception.LlmServiceException;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.request.ChatRequestParameters;
import dev.langchain4j.model.chat.response.ChatResponse;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

/** {@link LanguageModelClient} backed by a LangChain4j {@link ChatModel}. */
@Component
@RequiredArgsConstructor
@Slf4j
public class LangChain4jLanguageModelClient implements LanguageModelClient {

  private final ObjectProvider<ChatModel> chatModelProvider;
  private final ObjectMapper objectMapper;
  private final AnalysisConfig analysisConfig;

  @Override
  public boolean isAvailable() {
    return chatModelProvider.getIfAvailable() != null;
  }

  @Override
  public String complete(ModelRequest request) {
    ChatModel chatModel = chatModelProvider.getIfAvailable();
    if (chatModel == null) {
      throw new LlmServiceException("No chat model configured");
    }

    ChatRequest chatRequest =
        ChatRequest.builder()
            .messages(
                SystemMessage.from(request.systemPrompt()), UserMessage.from(request.userPrompt()))
            .parameters(
                ChatRequestParameters.builder()
                    .modelName(request.model())
                    .temperature(request.temperature())
                    .maxOutputTokens(request.maxTokens())
                    .build())
            .build();

    try {
      ChatResponse response = chatModel.chat(chatRequest);
      if (response == null || response.aiMessage() == null) {
        return null;
      }
      return response.aiMessage().text();
    } catch (RuntimeException e) {
      throw new LlmServiceException("Chat model call failed: " + e.getMessage(), e);
    }
  }

  @Override
  public boolean supportsBatching() {
    return analysisConfig.getAi().isIntelligentBatching();
  }

  @Override
  public List<String> completeBatch(String model, List<String> texts) {
    AnalysisConfig.Ai ai = analysisConfig.getAi();
    String raw =
        complete(
            new ModelRequest(
                model,
                MetadataPrompts.SYSTEM_PROMPT,
                MetadataPrompts.batchUserPrompt(texts, ai.getBatchMaxInputChars()),
                ai.getMaxTokens() * texts.size(),
                ai.getTemperature()));
    if (raw == null || raw.isBlank()) {
      throw new LlmServiceException("Empty batch response");
    }

    int start = raw.indexOf('{');
    int end = raw.lastIndexOf('}');
    if (start == -1 || start >= end) {
      throw new LlmServiceException("No JSON object in batch response");
    }

    JsonNode documents;
    try {
      documents = objectMapper.readTree(raw.substring(start, end + 1)).path("documents");
    } catch (JsonProcessingException e) {
      throw new LlmServiceException("Unparseable batch response", e);
    }
    if (!documents.isArray() || documents.size() != texts.size()) {
      throw new LlmServiceException(
          "Batch response held "
              + (documents.isArray() ? documents.size() : 0)
              + " results for "
              + texts.size()
              + " documents");
    }

    List<String> results = new ArrayList<>(texts.size());
    documents.forEach(node -> results.add(node.toString()));
    log.debug("Batch completion returned {} results for model {}", results.size(), model);
    return results;
  }
}
