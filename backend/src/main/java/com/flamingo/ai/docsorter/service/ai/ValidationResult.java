package com.flamingo.ai.docsorter.service.ai;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Outcome of validating a language-model response.
 *
 * @param valid whether the response satisfies the metadata schema
 * @param failureType kind of failure, null when valid
 * @param error human readable description, null when valid
 * @param data the validated JSON object, null when invalid
 */
public record ValidationResult(
    boolean valid, ValidationFailureType failureType, String error, JsonNode data) {

  public static ValidationResult success(JsonNode data) {
    return new ValidationResult(true, null, null, data);
  }

  public static ValidationResult failure(ValidationFailureType type, String error) {
    return new ValidationResult(false, type, error, null);
  }
}
