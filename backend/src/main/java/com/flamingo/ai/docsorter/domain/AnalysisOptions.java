package com.flamingo.ai.docsorter.domain;

import lombok.Builder;
import lombok.Value;

/** Per-call analysis options. Immutable; start from {@link #defaults()} and use toBuilder. */
@Value
@Builder(toBuilder = true)
public class AnalysisOptions {

  public static final double DEFAULT_CONFIDENCE_THRESHOLD = 0.5;
  public static final int DEFAULT_BATCH_SIZE = 5;

  /** Allow escalation to the language model. */
  @Builder.Default boolean useAI = true;

  /** Escalate when the heuristic overall confidence is below this value. */
  @Builder.Default double aiConfidenceThreshold = DEFAULT_CONFIDENCE_THRESHOLD;

  /** Concurrency of traditional batching. */
  @Builder.Default int aiBatchSize = DEFAULT_BATCH_SIZE;

  /** Escalate regardless of heuristic confidence. */
  boolean forceAI;

  /** Read from and write to the content cache. */
  @Builder.Default boolean useCache = true;

  /** Skip the cache read for this call but still store the fresh result. */
  boolean forceRefresh;

  /** Model identifier; null means the configured default. */
  String model;

  /** Group batch requests by model into single calls when the client supports it. */
  @Builder.Default boolean intelligentBatching = true;

  public static AnalysisOptions defaults() {
    return AnalysisOptions.builder().build();
  }
}
