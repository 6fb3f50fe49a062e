package com.flamingo.ai.docsorter.service.cache;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.List;
import lombok.extern.slf4j.Slf4j;

/**
 * Keeps the content cache snapshot in a JSON file.
 *
 * <p>Writes go to a sibling temp file that then replaces the snapshot. I/O and parse errors are
 * logged and treated as an empty snapshot.
 */
@Slf4j
public class JsonFileCacheSnapshotStore implements CacheSnapshotStore {

  static final int FORMAT_VERSION = 1;

  private final Path file;
  private final ObjectMapper objectMapper;

  public JsonFileCacheSnapshotStore(Path file, ObjectMapper objectMapper) {
    this.file = file;
    this.objectMapper = objectMapper;
  }

  @Override
  public List<CacheSnapshotEntry> load() {
    if (!Files.exists(file)) {
      return List.of();
    }
    try {
      Snapshot snapshot = objectMapper.readValue(file.toFile(), Snapshot.class);
      if (snapshot.version() != FORMAT_VERSION || snapshot.entries() == null) {
        log.warn("Ignoring cache snapshot {} with version {}", file, snapshot.version());
        return List.of();
      }
      return snapshot.entries();
    } catch (IOException e) {
      log.warn("Could not read cache snapshot {}: {}", file, e.getMessage());
      return List.of();
    }
  }

  @Override
  public void save(List<CacheSnapshotEntry> entries) {
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      Path temp = file.resolveSibling(file.getFileName() + ".tmp");
      objectMapper.writeValue(temp.toFile(), new Snapshot(FORMAT_VERSION, entries));
      Files.move(temp, file, StandardCopyOption.REPLACE_EXISTING);
    } catch (IOException e) {
      log.warn("Could not write cache snapshot {}: {}", file, e.getMessage());
    }
  }

  record Snapshot(int version, List<CacheSnapshotEntry> entries) {}
}
