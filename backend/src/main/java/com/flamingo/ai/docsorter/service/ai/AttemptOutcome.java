package com.flamingo.ai.docsorter.service.ai;

import com.flamingo.ai.docsorter.domain.DocumentAnalysis;

/**
 * Result of one language-model attempt; unusable outcomes are retried.
 *
 * @param analysis sanitized analysis, null when unusable
 * @param failure reason the attempt was rejected, null when usable
 */
public record AttemptOutcome(DocumentAnalysis analysis, String failure) {

  public static AttemptOutcome usable(DocumentAnalysis analysis) {
    return new AttemptOutcome(analysis, null);
  }

  public static AttemptOutcome unusable(String failure) {
    return new AttemptOutcome(null, failure);
  }

  public boolean isUsable() {
    return analysis != null;
  }
}
