package com.flamingo.ai.docsorter.service.analysis;

/** Point-in-time copy of the cumulative processing counters. */
public record ProcessingStatsSnapshot(
    long totalProcessed,
    long regexProcessed,
    long aiProcessed,
    long cacheHits,
    long cacheMisses,
    long errors,
    double averageConfidence) {}
