package com.flamingo.ai.docsorter.exception;

/** Exception thrown when the language-model client fails. */
public class LlmServiceException extends RuntimeException {

  private final boolean rateLimited;

  public LlmServiceException(String message) {
    this(message, false, null);
  }

  public LlmServiceException(String message, Throwable cause) {
    this(message, isRateLimit(cause), cause);
  }

  public LlmServiceException(String message, boolean rateLimited, Throwable cause) {
    super(message, cause);
    this.rateLimited = rateLimited;
  }

  public boolean isRateLimited() {
    return rateLimited;
  }

  private static boolean isRateLimit(Throwable cause) {
    if (cause == null || cause.getMessage() == null) {
      return false;
    }
    String message = cause.getMessage().toLowerCase();
    return message.contains("429") || message.contains("rate limit");
  }
}
