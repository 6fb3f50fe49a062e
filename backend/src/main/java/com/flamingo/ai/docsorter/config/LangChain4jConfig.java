package com.flamingo.ai.docsorter.config;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnExpression;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the LangChain4j chat model.
 *
 * <p>The model bean exists only when an API key is configured. Without it the analysis pipeline
 * runs heuristics only and reports the AI path as unavailable.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String openAiApiKey;

  @Value("${analysis.ai.model:gpt-4o-mini}")
  private String chatModelName;

  @Value("${analysis.ai.max-tokens:500}")
  private int maxCompletionTokens;

  @Value("${langchain4j.openai.timeout-seconds:30}")
  private int timeoutSeconds;

  @Bean
  @ConditionalOnExpression("!'${langchain4j.openai.api-key:}'.isBlank()")
  public ChatModel chatModel() {
    validateApiKey();
    log.info("Configuring OpenAI chat model: {}", chatModelName);

    return OpenAiChatModel.builder()
        .apiKey(openAiApiKey)
        .modelName(chatModelName)
        .maxCompletionTokens(maxCompletionTokens)
        .timeout(Duration.ofSeconds(timeoutSeconds))
        .responseFormat("json_object")
        .logRequests(false)
        .logResponses(false)
        .build();
  }

  private void validateApiKey() {
    if (openAiApiKey == null || openAiApiKey.isBlank()) {
      throw new IllegalStateException(
          "OpenAI API key is required. Set OPENAI_API_KEY environment variable.");
    }
  }
}
