package com.flamingo.ai.docsorter.service.ai;

import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import java.util.Optional;

/**
 * Result of an AI extraction: either an analysis or the reason there is none.
 *
 * @param analysis AI or cached analysis, null on failure
 * @param failureReason why no analysis was produced, null on success
 * @param detail free-text failure detail for logs
 */
public record AiExtractionResult(
    DocumentAnalysis analysis, AiFailureReason failureReason, String detail) {

  public static AiExtractionResult success(DocumentAnalysis analysis) {
    return new AiExtractionResult(analysis, null, null);
  }

  public static AiExtractionResult failure(AiFailureReason reason, String detail) {
    return new AiExtractionResult(null, reason, detail);
  }

  public boolean isSuccess() {
    return analysis != null;
  }

  public Optional<DocumentAnalysis> toOptional() {
    return Optional.ofNullable(analysis);
  }
}
