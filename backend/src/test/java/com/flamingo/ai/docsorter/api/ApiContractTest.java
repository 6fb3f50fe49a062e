package com.flamingo.ai.docsorter.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.docsorter.api.rest.AnalysisController;
import com.flamingo.ai.docsorter.api.rest.HealthController;
import java.lang.reflect.Method;
import java.util.Arrays;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests to verify API endpoints stay where clients expect them.
 *
 * <ul>
 *   <li>POST /api/analysis - Analyse one document
 *   <li>POST /api/analysis/batch - Analyse several documents
 *   <li>GET /api/analysis/stats - Processing and cache counters
 *   <li>DELETE /api/analysis/cache - Clear the content cache
 *   <li>GET /api/health - Health check
 * </ul>
 */
class ApiContractTest {

  private static Method method(Class<?> type, String name) {
    return Arrays.stream(type.getDeclaredMethods())
        .filter(m -> m.getName().equals(name))
        .findFirst()
        .orElseThrow();
  }

  @Nested
  @DisplayName("AnalysisController API contract")
  class AnalysisControllerContract {

    @Test
    @DisplayName("should be mapped to /api/analysis")
    void shouldBeMappedToApiAnalysis() {
      RequestMapping mapping = AnalysisController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/analysis");
    }

    @Test
    @DisplayName("should expose analyse, batch, stats and cache endpoints")
    void shouldExposeEndpoints() {
      assertThat(method(AnalysisController.class, "analyze").getAnnotation(PostMapping.class))
          .isNotNull();
      assertThat(
              method(AnalysisController.class, "analyzeBatch")
                  .getAnnotation(PostMapping.class)
                  .value())
          .containsExactly("/batch");
      assertThat(
              method(AnalysisController.class, "stats").getAnnotation(GetMapping.class).value())
          .containsExactly("/stats");
      assertThat(
              method(AnalysisController.class, "clearCache")
                  .getAnnotation(DeleteMapping.class)
                  .value())
          .containsExactly("/cache");
    }
  }

  @Nested
  @DisplayName("HealthController API contract")
  class HealthControllerContract {

    @Test
    @DisplayName("should be mapped to /api/health")
    void shouldBeMappedToApiHealth() {
      RequestMapping mapping = HealthController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/health");
    }
  }
}
