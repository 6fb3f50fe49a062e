package com.flamingo.ai.docsorter.service.cache;

import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import java.util.Optional;

/** Store of AI analyses keyed by the SHA-256 of the analysed text. Safe for concurrent use. */
public interface ContentCache {

  /**
   * Looks up an analysis and counts a hit or a miss.
   *
   * @param textHash SHA-256 hex of the text
   * @return cached analysis, if present
   */
  Optional<DocumentAnalysis> get(String textHash);

  /**
   * Stores an analysis, evicting the least recently used entry when full.
   *
   * @param textHash SHA-256 hex of the text
   * @param analysis AI-sourced analysis
   */
  void put(String textHash, DocumentAnalysis analysis);

  int size();

  CacheStats getStats();

  /** Removes all entries; counters are kept. */
  void clear();
}
