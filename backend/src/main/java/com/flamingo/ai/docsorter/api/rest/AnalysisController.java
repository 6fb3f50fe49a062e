package com.flamingo.ai.docsorter.api.rest;

import com.flamingo.ai.docsorter.api.dto.request.AnalyzeRequest;
import com.flamingo.ai.docsorter.api.dto.request.BatchAnalyzeRequest;
import com.flamingo.ai.docsorter.api.dto.response.AnalysisResponse;
import com.flamingo.ai.docsorter.api.dto.response.AnalysisStatsResponse;
import com.flamingo.ai.docsorter.config.AnalysisConfig;
import com.flamingo.ai.docsorter.domain.AnalysisOptions;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.domain.DocumentInput;
import com.flamingo.ai.docsorter.service.analysis.DocumentAnalysisService;
import com.flamingo.ai.docsorter.service.cache.ContentCache;
import com.flamingo.ai.docsorter.service.filename.FilenameSuggester;
import jakarta.validation.Valid;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for document analysis. */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
public class AnalysisController {

  private final DocumentAnalysisService analysisService;
  private final FilenameSuggester filenameSuggester;
  private final ContentCache contentCache;
  private final AnalysisConfig analysisConfig;

  /** Analyses one document's text. */
  @PostMapping
  public ResponseEntity<AnalysisResponse> analyze(@Valid @RequestBody AnalyzeRequest request) {
    AnalysisOptions options =
        applyOverrides(
            analysisConfig.defaultOptions().toBuilder(),
            request.getUseAI(),
            request.getForceAI(),
            request.getUseCache(),
            request.getForceRefresh(),
            request.getAiConfidenceThreshold(),
            request.getModel());

    DocumentAnalysis analysis =
        analysisService.analyze(request.getText(), request.getFilePath(), options);
    return ResponseEntity.ok(toResponse(analysis, request.getFilePath()));
  }

  /** Analyses several documents; the response keeps the request order. */
  @PostMapping("/batch")
  public ResponseEntity<List<AnalysisResponse>> analyzeBatch(
      @Valid @RequestBody BatchAnalyzeRequest request) {
    AnalysisOptions.AnalysisOptionsBuilder builder = analysisConfig.defaultOptions().toBuilder();
    if (request.getAiBatchSize() != null) {
      builder.aiBatchSize(request.getAiBatchSize());
    }
    AnalysisOptions options =
        applyOverrides(
            builder,
            request.getUseAI(),
            request.getForceAI(),
            request.getUseCache(),
            request.getForceRefresh(),
            request.getAiConfidenceThreshold(),
            request.getModel());

    List<DocumentInput> items =
        request.getItems().stream()
            .map(item -> new DocumentInput(item.getFilePath(), item.getText(), item.getModel()))
            .toList();
    List<DocumentAnalysis> analyses = analysisService.analyzeBatch(items, options);

    List<AnalysisResponse> responses = new ArrayList<>(analyses.size());
    for (int i = 0; i < analyses.size(); i++) {
      responses.add(toResponse(analyses.get(i), items.get(i).filePath()));
    }
    return ResponseEntity.ok(responses);
  }

  /** Returns processing and cache counters. */
  @GetMapping("/stats")
  public ResponseEntity<AnalysisStatsResponse> stats() {
    return ResponseEntity.ok(
        AnalysisStatsResponse.builder()
            .processing(analysisService.getStats())
            .cache(contentCache.getStats())
            .build());
  }

  /** Empties the content cache. */
  @DeleteMapping("/cache")
  public ResponseEntity<Void> clearCache() {
    contentCache.clear();
    return ResponseEntity.noContent().build();
  }

  private AnalysisResponse toResponse(DocumentAnalysis analysis, String filePath) {
    return AnalysisResponse.from(
        analysis, filePath, filenameSuggester.suggest(analysis, filePath));
  }

  private static AnalysisOptions applyOverrides(
      AnalysisOptions.AnalysisOptionsBuilder builder,
      Boolean useAI,
      Boolean forceAI,
      Boolean useCache,
      Boolean forceRefresh,
      Double threshold,
      String model) {
    if (useAI != null) {
      builder.useAI(useAI);
    }
    if (forceAI != null) {
      builder.forceAI(forceAI);
    }
    if (useCache != null) {
      builder.useCache(useCache);
    }
    if (forceRefresh != null) {
      builder.forceRefresh(forceRefresh);
    }
    if (threshold != null) {
      builder.aiConfidenceThreshold(threshold);
    }
    if (model != null && !model.isBlank()) {
      builder.model(model);
    }
    return builder.build();
  }
}
