package com.flamingo.ai.docsorter.service.merge;

import com.flamingo.ai.docsorter.domain.AnalysisSource;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.service.cache.ContentHasher;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reconciles a heuristic result with an AI result.
 *
 * <p>Each field keeps the value with the strictly higher confidence; ties keep the heuristic
 * value. Snippets come from the AI result when it has any. The title is heuristic-only. Inputs are
 * never modified and the overall confidence is derived afresh.
 */
@Component
@Slf4j
public class ResultMerger {

  /**
   * Merges two analyses of the same text.
   *
   * @param regexResult heuristic analysis
   * @param aiResult AI or cached analysis, may be null
   * @return hybrid analysis, or the heuristic one unchanged when there is no AI result
   */
  public DocumentAnalysis mergeResults(DocumentAnalysis regexResult, DocumentAnalysis aiResult) {
    if (aiResult == null) {
      return regexResult;
    }
    if (regexResult == null) {
      return aiResult.toBuilder().source(AnalysisSource.HYBRID).build();
    }

    boolean aiClient = aiResult.getClientConfidence() > regexResult.getClientConfidence();
    boolean aiDate = aiResult.getDateConfidence() > regexResult.getDateConfidence();
    boolean aiType = aiResult.getDocTypeConfidence() > regexResult.getDocTypeConfidence();

    DocumentAnalysis merged =
        DocumentAnalysis.builder()
            .clientName(aiClient ? aiResult.getClientName() : regexResult.getClientName())
            .clientConfidence(
                aiClient ? aiResult.getClientConfidence() : regexResult.getClientConfidence())
            .date(aiDate ? aiResult.getDate() : regexResult.getDate())
            .dateConfidence(aiDate ? aiResult.getDateConfidence() : regexResult.getDateConfidence())
            .docType(aiType ? aiResult.getDocType() : regexResult.getDocType())
            .docTypeConfidence(
                aiType ? aiResult.getDocTypeConfidence() : regexResult.getDocTypeConfidence())
            .snippets(
                aiResult.getSnippets().isEmpty()
                    ? regexResult.getSnippets()
                    : aiResult.getSnippets())
            .title(regexResult.getTitle())
            .textHash(
                regexResult.getTextHash() != null
                    ? regexResult.getTextHash()
                    : aiResult.getTextHash())
            .source(AnalysisSource.HYBRID)
            .build();

    log.debug(
        "Merged [{}]: client={}, date={}, type={}, overall={}",
        ContentHasher.shortHash(merged.getTextHash()),
        aiClient ? "ai" : "regex",
        aiDate ? "ai" : "regex",
        aiType ? "ai" : "regex",
        String.format("%.3f", merged.getOverallConfidence()));
    return merged;
  }
}
