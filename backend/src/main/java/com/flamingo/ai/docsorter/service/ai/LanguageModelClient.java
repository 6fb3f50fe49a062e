package com.flamingo.ai.docsorter.service.ai;

import java.util.List;

/** Language-model access used by {@link AiOrchestrator}. */
public interface LanguageModelClient {

  /** Whether a model is configured and calls can be made. */
  boolean isAvailable();

  /**
   * Runs one completion.
   *
   * @param request prompt and parameters
   * @return raw response text, possibly null or blank
   */
  String complete(ModelRequest request);

  /** Whether {@link #completeBatch} is supported. */
  default boolean supportsBatching() {
    return false;
  }

  /**
   * Extracts metadata for several documents in one call.
   *
   * @param model model identifier shared by the documents
   * @param texts document texts
   * @return one raw metadata JSON object per text, in input order
   */
  default List<String> completeBatch(String model, List<String> texts) {
    throw new UnsupportedOperationException("Batch completion is not supported");
  }
}
