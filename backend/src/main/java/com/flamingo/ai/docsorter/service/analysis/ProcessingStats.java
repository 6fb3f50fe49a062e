package com.flamingo.ai.docsorter.service.analysis;

import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Component;

/**
 * Cumulative, monotonically updated processing counters shared by the analysis service and the AI
 * orchestrator.
 */
@Component
public class ProcessingStats {

  private final AtomicLong totalProcessed = new AtomicLong();
  private final AtomicLong regexProcessed = new AtomicLong();
  private final AtomicLong aiProcessed = new AtomicLong();
  private final AtomicLong cacheHits = new AtomicLong();
  private final AtomicLong cacheMisses = new AtomicLong();
  private final AtomicLong errors = new AtomicLong();

  private long confidenceSamples;
  private double averageConfidence;

  public void recordProcessed() {
    totalProcessed.incrementAndGet();
  }

  public void recordRegexOnly() {
    regexProcessed.incrementAndGet();
  }

  public void recordAiEscalation() {
    aiProcessed.incrementAndGet();
  }

  public void recordCacheHit() {
    cacheHits.incrementAndGet();
  }

  public void recordCacheMiss() {
    cacheMisses.incrementAndGet();
  }

  public void recordError() {
    errors.incrementAndGet();
  }

  /** Folds one final overall confidence into the running mean. */
  public synchronized void recordConfidence(double overallConfidence) {
    confidenceSamples++;
    averageConfidence += (overallConfidence - averageConfidence) / confidenceSamples;
  }

  public synchronized ProcessingStatsSnapshot snapshot() {
    return new ProcessingStatsSnapshot(
        totalProcessed.get(),
        regexProcessed.get(),
        aiProcessed.get(),
        cacheHits.get(),
        cacheMisses.get(),
        errors.get(),
        averageConfidence);
  }
}
