package com.flamingo.ai.docsorter.service.filename;

import java.time.Instant;
import java.util.Optional;

/** Supplies a file's last modification time, the date fallback for filename suggestions. */
public interface FileTimestampProvider {

  Optional<Instant> lastModified(String filePath);
}
