package com.flamingo.ai.docsorter.service.cache;

import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/** Periodically snapshots the content cache; a no-op while nothing changed. */
@Component
@RequiredArgsConstructor
public class ContentCacheFlusher {

  private final LruContentCache contentCache;

  @Scheduled(
      fixedDelayString = "${analysis.cache.persistence.flush-interval-ms:30000}",
      initialDelayString = "${analysis.cache.persistence.flush-interval-ms:30000}")
  public void flush() {
    contentCache.flush();
  }
}
