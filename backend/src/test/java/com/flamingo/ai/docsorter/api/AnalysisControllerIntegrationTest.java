package com.flamingo.ai.docsorter.api;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.docsorter.api.dto.request.AnalyzeRequest;
import com.flamingo.ai.docsorter.api.dto.request.BatchAnalyzeRequest;
import com.flamingo.ai.docsorter.api.rest.AnalysisController;
import com.flamingo.ai.docsorter.config.AnalysisConfig;
import com.flamingo.ai.docsorter.domain.AnalysisOptions;
import com.flamingo.ai.docsorter.domain.AnalysisSource;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.exception.GlobalExceptionHandler;
import com.flamingo.ai.docsorter.exception.LlmServiceException;
import com.flamingo.ai.docsorter.service.analysis.DocumentAnalysisService;
import com.flamingo.ai.docsorter.service.analysis.ProcessingStatsSnapshot;
import com.flamingo.ai.docsorter.service.cache.CacheStats;
import com.flamingo.ai.docsorter.service.cache.ContentCache;
import com.flamingo.ai.docsorter.service.filename.FilenameSuggester;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

@ExtendWith(MockitoExtension.class)
@DisplayName("AnalysisController Integration Tests")
class AnalysisControllerIntegrationTest {

  private MockMvc mockMvc;
  private ObjectMapper objectMapper;
  private SimpleMeterRegistry meterRegistry;

  @Mock private DocumentAnalysisService analysisService;
  @Mock private ContentCache contentCache;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    FilenameSuggester filenameSuggester = new FilenameSuggester(path -> Optional.empty());
    AnalysisController controller =
        new AnalysisController(
            analysisService, filenameSuggester, contentCache, new AnalysisConfig());
    mockMvc =
        MockMvcBuilders.standaloneSetup(controller)
            .setControllerAdvice(new GlobalExceptionHandler(meterRegistry))
            .build();
    objectMapper = new ObjectMapper();
  }

  private static DocumentAnalysis invoice() {
    return DocumentAnalysis.builder()
        .clientName("Acme Corporation")
        .clientConfidence(0.9)
        .date("2024-01-15")
        .dateConfidence(0.8)
        .docType("Invoice")
        .docTypeConfidence(0.9)
        .source(AnalysisSource.HYBRID)
        .build();
  }

  @Test
  @DisplayName("Should analyse one document and suggest a filename")
  void shouldAnalyseDocument() throws Exception {
    when(analysisService.analyze(eq("INVOICE"), eq("scan.pdf"), any(AnalysisOptions.class)))
        .thenReturn(invoice());
    AnalyzeRequest request =
        AnalyzeRequest.builder().filePath("scan.pdf").text("INVOICE").forceAI(true).build();

    mockMvc
        .perform(
            post("/api/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.docType").value("Invoice"))
        .andExpect(jsonPath("$.clientName").value("Acme Corporation"))
        .andExpect(jsonPath("$.source").value("hybrid"))
        .andExpect(jsonPath("$.suggestedFilename").value("Invoice_Acme_2024-01-15.pdf"));

    ArgumentCaptor<AnalysisOptions> options = ArgumentCaptor.forClass(AnalysisOptions.class);
    verify(analysisService).analyze(eq("INVOICE"), eq("scan.pdf"), options.capture());
    assertThat(options.getValue().isForceAI()).isTrue();
    assertThat(options.getValue().isUseCache()).isTrue();
  }

  @Test
  @DisplayName("Should reject a request without text")
  void shouldRejectMissingText() throws Exception {
    mockMvc
        .perform(
            post("/api/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"filePath\": \"a.txt\"}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_001"));
  }

  @Test
  @DisplayName("Should reject an out-of-range threshold")
  void shouldRejectInvalidThreshold() throws Exception {
    mockMvc
        .perform(
            post("/api/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"x\", \"aiConfidenceThreshold\": 1.5}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should reject a malformed body")
  void shouldRejectMalformedBody() throws Exception {
    mockMvc
        .perform(post("/api/analysis").contentType(MediaType.APPLICATION_JSON).content("{oops"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.code").value("VALIDATION_002"));
  }

  @Test
  @DisplayName("Should map an unexpected service failure to 500")
  void shouldReturnInternalError_whenServiceThrows() throws Exception {
    when(analysisService.analyze(any(), any(), any(AnalysisOptions.class)))
        .thenThrow(new LlmServiceException("model gateway down"));

    mockMvc
        .perform(
            post("/api/analysis")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"text\": \"INVOICE\"}"))
        .andExpect(status().isInternalServerError())
        .andExpect(jsonPath("$.code").value("INTERNAL_001"));

    assertThat(
            meterRegistry
                .get("docsorter.errors")
                .tag("error_type", "internal_error")
                .counter()
                .count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("Should analyse a batch in request order")
  void shouldAnalyseBatch() throws Exception {
    when(analysisService.analyzeBatch(anyList(), any(AnalysisOptions.class)))
        .thenReturn(List.of(invoice(), DocumentAnalysis.empty(null)));
    BatchAnalyzeRequest request =
        BatchAnalyzeRequest.builder()
            .items(
                List.of(
                    new BatchAnalyzeRequest.Item("a.pdf", "INVOICE", null),
                    new BatchAnalyzeRequest.Item("b.txt", "", null)))
            .aiBatchSize(2)
            .build();

    mockMvc
        .perform(
            post("/api/analysis/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(2))
        .andExpect(jsonPath("$[0].filePath").value("a.pdf"))
        .andExpect(jsonPath("$[1].docType").value("Unclassified"))
        .andExpect(
            jsonPath("$[1].suggestedFilename").value("Unknown_UnknownClient_UnknownDate.txt"));
  }

  @Test
  @DisplayName("Should reject an empty batch")
  void shouldRejectEmptyBatch() throws Exception {
    mockMvc
        .perform(
            post("/api/analysis/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"items\": []}"))
        .andExpect(status().isBadRequest());
  }

  @Test
  @DisplayName("Should report processing and cache statistics")
  void shouldReturnStats() throws Exception {
    when(analysisService.getStats())
        .thenReturn(new ProcessingStatsSnapshot(4, 3, 1, 0, 1, 0, 0.75));
    when(contentCache.getStats()).thenReturn(CacheStats.of(0, 1, 1, 0, 1, 1000));

    mockMvc
        .perform(get("/api/analysis/stats"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.processing.totalProcessed").value(4))
        .andExpect(jsonPath("$.cache.capacity").value(1000));
  }

  @Test
  @DisplayName("Should clear the content cache")
  void shouldClearCache() throws Exception {
    mockMvc.perform(delete("/api/analysis/cache")).andExpect(status().isNoContent());

    verify(contentCache).clear();
  }
}
