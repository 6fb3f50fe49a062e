package com.flamingo.ai.docsorter.service.cache;

/**
 * Cumulative content cache counters.
 *
 * @param hits lookups that found an entry
 * @param misses lookups that found nothing
 * @param sets insertions
 * @param evictions entries dropped to respect capacity
 * @param size current entry count
 * @param capacity maximum entry count
 * @param hitRate hits as a percentage of lookups, two decimals
 */
public record CacheStats(
    long hits, long misses, long sets, long evictions, int size, int capacity, double hitRate) {

  public static CacheStats of(
      long hits, long misses, long sets, long evictions, int size, int capacity) {
    long lookups = hits + misses;
    double hitRate = lookups == 0 ? 0.0 : Math.round(hits * 10_000.0 / lookups) / 100.0;
    return new CacheStats(hits, misses, sets, evictions, size, capacity, hitRate);
  }
}
