package com.flamingo.ai.docsorter.service.cache;

import java.util.List;

/** Durable storage for content cache snapshots. */
public interface CacheSnapshotStore {

  /** Store that keeps nothing. */
  CacheSnapshotStore NONE =
      new CacheSnapshotStore() {
        @Override
        public List<CacheSnapshotEntry> load() {
          return List.of();
        }

        @Override
        public void save(List<CacheSnapshotEntry> entries) {}
      };

  /**
   * Reads the last snapshot. Storage errors yield an empty list.
   *
   * @return entries from least to most recently used
   */
  List<CacheSnapshotEntry> load();

  /**
   * Replaces the snapshot. Storage errors are logged, not thrown.
   *
   * @param entries entries from least to most recently used
   */
  void save(List<CacheSnapshotEntry> entries);
}
