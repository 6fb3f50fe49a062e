package com.flamingo.ai.docsorter;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docsorter.config.ResilienceConfig;
import com.flamingo.ai.docsorter.service.ai.AiOrchestrator;
import com.flamingo.ai.docsorter.service.analysis.DocumentAnalysisService;
import com.flamingo.ai.docsorter.service.cache.ContentCache;
import com.flamingo.ai.docsorter.service.heuristic.HeuristicExtractor;
import dev.langchain4j.model.chat.ChatModel;
import io.github.resilience4j.retry.Retry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.bean.override.mockito.MockitoBean;

/**
 * Integration test that verifies the Spring application context loads correctly. Uses @MockitoBean
 * to mock the chat model so the test can run without an API key.
 */
@SpringBootTest
class ApplicationContextTest {

  @MockitoBean private ChatModel chatModel;

  @Autowired private ApplicationContext applicationContext;

  @Test
  @DisplayName("Application context should load successfully")
  void contextLoads() {
    assertThat(applicationContext).isNotNull();
  }

  @Test
  @DisplayName("All core analysis beans should be available")
  void coreServiceBeansShouldBeAvailable() {
    assertThat(applicationContext.getBean(DocumentAnalysisService.class)).isNotNull();
    assertThat(applicationContext.getBean(HeuristicExtractor.class)).isNotNull();
    assertThat(applicationContext.getBean(ContentCache.class)).isNotNull();
    assertThat(applicationContext.getBean(ContentCache.class).getStats().capacity())
        .isEqualTo(100);
  }

  @Test
  @DisplayName("AI path should be available when a chat model is present")
  void aiPathShouldBeAvailable() {
    AiOrchestrator orchestrator = applicationContext.getBean(AiOrchestrator.class);

    assertThat(orchestrator.isEnabled()).isTrue();
    assertThat(orchestrator.isAvailable()).isTrue();
  }

  @Test
  @DisplayName("Retry should follow the configured attempts")
  void retryShouldUseConfiguredAttempts() {
    Retry retry = applicationContext.getBean("metadataExtractionRetry", Retry.class);

    assertThat(retry.getName()).isEqualTo(ResilienceConfig.METADATA_EXTRACTION);
    assertThat(retry.getRetryConfig().getMaxAttempts()).isEqualTo(3);
  }
}
