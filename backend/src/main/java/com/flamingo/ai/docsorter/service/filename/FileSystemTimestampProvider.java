package com.flamingo.ai.docsorter.service.filename;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Reads modification times from the local file system. */
@Component
@Slf4j
public class FileSystemTimestampProvider implements FileTimestampProvider {

  @Override
  public Optional<Instant> lastModified(String filePath) {
    if (filePath == null || filePath.isBlank()) {
      return Optional.empty();
    }
    try {
      Path path = Path.of(filePath);
      if (!Files.isRegularFile(path)) {
        return Optional.empty();
      }
      return Optional.of(Files.getLastModifiedTime(path).toInstant());
    } catch (IOException | InvalidPathException e) {
      log.debug("No modification time for {}: {}", filePath, e.getMessage());
      return Optional.empty();
    }
  }
}
