package com.flamingo.ai.docsorter.service.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/** SHA-256 content hashing for cache keys. */
public final class ContentHasher {

  private ContentHasher() {}

  /**
   * Hashes text with SHA-256.
   *
   * @param text input text, null treated as empty
   * @return lowercase hex digest
   */
  public static String sha256Hex(String text) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] hash = digest.digest((text == null ? "" : text).getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(hash);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  /** Short prefix of a hash for log correlation. */
  public static String shortHash(String hash) {
    if (hash == null) {
      return "-";
    }
    return hash.substring(0, Math.min(12, hash.length()));
  }
}
