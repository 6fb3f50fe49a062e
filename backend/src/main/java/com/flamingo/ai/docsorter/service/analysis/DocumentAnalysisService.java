package com.flamingo.ai.docsorter.service.analysis;

import com.flamingo.ai.docsorter.domain.AnalysisOptions;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.domain.DocumentInput;
import java.util.List;

/** Hybrid heuristic and AI document analysis. */
public interface DocumentAnalysisService {

  /**
   * Analyses one document. Never throws; AI failures degrade to the heuristic result.
   *
   * @param text extracted document text
   * @param filePath originating path, may be null
   * @param options per-call options, null for configured defaults
   * @return analysis with source {@code regex} or {@code hybrid}
   */
  DocumentAnalysis analyze(String text, String filePath, AnalysisOptions options);

  /**
   * Analyses several documents.
   *
   * @param items documents
   * @param options per-call options, null for configured defaults
   * @return one analysis per item, in input order
   */
  List<DocumentAnalysis> analyzeBatch(List<DocumentInput> items, AnalysisOptions options);

  ProcessingStatsSnapshot getStats();
}
