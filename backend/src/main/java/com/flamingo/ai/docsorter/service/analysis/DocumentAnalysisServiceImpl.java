package com.flamingo.ai.docsorter.service.analysis;

import com.flamingo.ai.docsorter.config.AnalysisConfig;
import com.flamingo.ai.docsorter.domain.AnalysisOptions;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.domain.DocumentInput;
import com.flamingo.ai.docsorter.service.ai.AiExtractionResult;
import com.flamingo.ai.docsorter.service.ai.AiFailureReason;
import com.flamingo.ai.docsorter.service.ai.AiOrchestrator;
import com.flamingo.ai.docsorter.service.cache.ContentHasher;
import com.flamingo.ai.docsorter.service.heuristic.HeuristicExtractor;
import com.flamingo.ai.docsorter.service.merge.ResultMerger;
import io.micrometer.core.annotation.Timed;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Runs heuristics first and escalates to the AI path only when the heuristic result is weak or
 * incomplete.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DocumentAnalysisServiceImpl implements DocumentAnalysisService {

  private final HeuristicExtractor heuristicExtractor;
  private final AiOrchestrator aiOrchestrator;
  private final ResultMerger resultMerger;
  private final ProcessingStats stats;
  private final AnalysisConfig analysisConfig;

  @Override
  @Timed(value = "analysis.document", description = "Time to analyse one document")
  public DocumentAnalysis analyze(String text, String filePath, AnalysisOptions options) {
    AnalysisOptions effective = options != null ? options : analysisConfig.defaultOptions();
    stats.recordProcessed();
    if (text == null || text.isBlank()) {
      log.debug("Empty text for {}, returning unclassified result", filePath);
      return DocumentAnalysis.empty(null);
    }

    try {
      DocumentAnalysis regex = heuristicExtractor.extract(text, filePath);
      AiExtractionResult ai = null;
      if (shouldEscalate(regex, effective)) {
        stats.recordAiEscalation();
        ai = aiOrchestrator.extractMetadataAI(text, effective);
      }
      return complete(regex, ai);
    } catch (RuntimeException e) {
      stats.recordError();
      log.warn("Analysis failed for {}: {}", filePath, e.getMessage());
      return DocumentAnalysis.empty(ContentHasher.sha256Hex(text));
    }
  }

  @Override
  @Timed(value = "analysis.batch", description = "Time to analyse a batch of documents")
  public List<DocumentAnalysis> analyzeBatch(List<DocumentInput> items, AnalysisOptions options) {
    if (items == null || items.isEmpty()) {
      return List.of();
    }
    AnalysisOptions effective = options != null ? options : analysisConfig.defaultOptions();
    log.info("Analysing batch of {} documents", items.size());

    List<DocumentAnalysis> regexResults = new ArrayList<>(items.size());
    List<Integer> escalated = new ArrayList<>();
    List<DocumentInput> escalatedItems = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      DocumentInput item = items.get(i);
      stats.recordProcessed();
      if (item.text() == null || item.text().isBlank()) {
        regexResults.add(null);
        continue;
      }
      DocumentAnalysis regex = heuristicExtractor.extract(item.text(), item.filePath());
      regexResults.add(regex);
      if (shouldEscalate(regex, effective)) {
        stats.recordAiEscalation();
        escalated.add(i);
        escalatedItems.add(item);
      }
    }

    List<AiExtractionResult> aiResults = List.of();
    if (!escalatedItems.isEmpty()) {
      try {
        aiResults = aiOrchestrator.extractMetadataAIBatch(escalatedItems, effective);
      } catch (RuntimeException e) {
        stats.recordError();
        log.warn("AI batch failed, using heuristic results: {}", e.getMessage());
      }
    }

    List<DocumentAnalysis> results = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      DocumentAnalysis regex = regexResults.get(i);
      if (regex == null) {
        results.add(DocumentAnalysis.empty(null));
        continue;
      }
      int position = escalated.indexOf(i);
      AiExtractionResult ai =
          position >= 0 && position < aiResults.size() ? aiResults.get(position) : null;
      results.add(complete(regex, ai));
    }
    return results;
  }

  @Override
  public ProcessingStatsSnapshot getStats() {
    return stats.snapshot();
  }

  private boolean shouldEscalate(DocumentAnalysis regex, AnalysisOptions options) {
    return options.isUseAI()
        && aiOrchestrator.isEnabled()
        && aiOrchestrator.shouldUseAI(regex, options);
  }

  private DocumentAnalysis complete(DocumentAnalysis regex, AiExtractionResult ai) {
    DocumentAnalysis result;
    if (ai == null) {
      stats.recordRegexOnly();
      result = regex;
    } else if (ai.isSuccess()) {
      result = resultMerger.mergeResults(regex, ai.analysis());
    } else {
      if (ai.failureReason() == AiFailureReason.ERROR) {
        stats.recordError();
      }
      log.debug(
          "AI path gave no result [{}]: {} {}, keeping heuristic analysis",
          ContentHasher.shortHash(regex.getTextHash()),
          ai.failureReason(),
          ai.detail());
      result = regex;
    }
    stats.recordConfidence(result.getOverallConfidence());
    return result;
  }
}
