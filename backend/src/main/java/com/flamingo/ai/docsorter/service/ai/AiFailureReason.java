package com.flamingo.ai.docsorter.service.ai;

/** Why the AI path produced no analysis. None of these fail the document pipeline. */
public enum AiFailureReason {

  /** AI escalation is switched off in configuration. */
  DISABLED,

  /** There was no text to send. */
  EMPTY_INPUT,

  /** No language-model client is configured. */
  UNAVAILABLE,

  /** Every attempt returned an empty, malformed or unusable response. */
  RETRIES_EXHAUSTED,

  /** An unexpected error outside the retried call. */
  ERROR
}
