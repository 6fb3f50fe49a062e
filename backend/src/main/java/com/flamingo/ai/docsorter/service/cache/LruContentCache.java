package com.flamingo.ai.docsorter.service.cache;

import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;

/**
 * Bounded {@link ContentCache} with least-recently-used eviction.
 *
 * <p>All reads and writes go through one lock; a read updates recency, so it mutates too. Entries
 * are never expired by age.
 */
@Slf4j
public class LruContentCache implements ContentCache {

  private final int capacity;
  private final CacheSnapshotStore snapshotStore;
  private final Clock clock;
  private final ReentrantLock lock = new ReentrantLock();
  private final LinkedHashMap<String, Entry> entries = new LinkedHashMap<>(16, 0.75f, true);

  private long hits;
  private long misses;
  private long sets;
  private long evictions;
  private boolean dirty;

  public LruContentCache(int capacity) {
    this(capacity, CacheSnapshotStore.NONE, Clock.systemUTC());
  }

  public LruContentCache(int capacity, CacheSnapshotStore snapshotStore, Clock clock) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Cache capacity must be positive: " + capacity);
    }
    this.capacity = capacity;
    this.snapshotStore = snapshotStore;
    this.clock = clock;
  }

  @Override
  public Optional<DocumentAnalysis> get(String textHash) {
    lock.lock();
    try {
      Entry entry = textHash == null ? null : entries.get(textHash);
      if (entry == null) {
        misses++;
        return Optional.empty();
      }
      hits++;
      entry.lastAccessedAt = clock.instant();
      return Optional.of(entry.analysis);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void put(String textHash, DocumentAnalysis analysis) {
    if (textHash == null || analysis == null) {
      return;
    }
    lock.lock();
    try {
      Instant now = clock.instant();
      entries.put(textHash, new Entry(analysis, now, now));
      sets++;
      evictOverflow();
      dirty = true;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return entries.size();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public CacheStats getStats() {
    lock.lock();
    try {
      return CacheStats.of(hits, misses, sets, evictions, entries.size(), capacity);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void clear() {
    lock.lock();
    try {
      entries.clear();
      dirty = true;
    } finally {
      lock.unlock();
    }
    log.info("Content cache cleared");
  }

  /** Loads the persisted snapshot, keeping at most {@code capacity} most recent entries. */
  public void restore() {
    List<CacheSnapshotEntry> snapshot = snapshotStore.load();
    lock.lock();
    try {
      for (CacheSnapshotEntry saved : snapshot) {
        if (saved.key() == null) {
          continue;
        }
        Instant inserted = saved.insertedAt() != null ? saved.insertedAt() : clock.instant();
        Instant accessed = saved.lastAccessedAt() != null ? saved.lastAccessedAt() : inserted;
        entries.put(saved.key(), new Entry(saved.toAnalysis(), inserted, accessed));
      }
      while (entries.size() > capacity) {
        Iterator<String> eldest = entries.keySet().iterator();
        eldest.next();
        eldest.remove();
      }
      dirty = false;
    } finally {
      lock.unlock();
    }
    if (!snapshot.isEmpty()) {
      log.info("Restored {} content cache entries", size());
    }
  }

  /** Writes a snapshot when entries changed since the last flush. */
  public void flush() {
    List<CacheSnapshotEntry> snapshot;
    lock.lock();
    try {
      if (!dirty) {
        return;
      }
      snapshot = new ArrayList<>(entries.size());
      for (Map.Entry<String, Entry> e : entries.entrySet()) {
        Entry entry = e.getValue();
        snapshot.add(
            CacheSnapshotEntry.from(
                e.getKey(), entry.analysis, entry.insertedAt, entry.lastAccessedAt));
      }
      dirty = false;
    } finally {
      lock.unlock();
    }
    snapshotStore.save(snapshot);
    log.debug("Flushed {} content cache entries", snapshot.size());
  }

  private void evictOverflow() {
    Iterator<String> eldest = entries.keySet().iterator();
    while (entries.size() > capacity && eldest.hasNext()) {
      String key = eldest.next();
      eldest.remove();
      evictions++;
      log.debug("Evicted content cache entry [{}]", ContentHasher.shortHash(key));
    }
  }

  private static final class Entry {
    private final DocumentAnalysis analysis;
    private final Instant insertedAt;
    private Instant lastAccessedAt;

    private Entry(DocumentAnalysis analysis, Instant insertedAt, Instant lastAccessedAt) {
      this.analysis = analysis;
      this.insertedAt = insertedAt;
      this.lastAccessedAt = lastAccessedAt;
    }
  }
}
