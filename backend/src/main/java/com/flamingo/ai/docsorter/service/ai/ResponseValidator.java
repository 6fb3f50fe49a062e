package com.flamingo.ai.docsorter.service.ai;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Strict schema check for metadata returned by the language model.
 *
 * <p>The object must hold exactly the seven metadata fields; {@code overallConfidence} is tolerated
 * and ignored. Name, date and type are string or null, confidences are numbers in [0, 1] and
 * snippets is an array. Failures are returned, never thrown.
 */
@Component
@RequiredArgsConstructor
public class ResponseValidator {

  static final List<String> REQUIRED_FIELDS =
      List.of(
          "clientName",
          "clientConfidence",
          "date",
          "dateConfidence",
          "docType",
          "docTypeConfidence",
          "snippets");

  private static final Set<String> TOLERATED_FIELDS = Set.of("overallConfidence");
  private static final List<String> TEXT_FIELDS = List.of("clientName", "date", "docType");
  private static final List<String> CONFIDENCE_FIELDS =
      List.of("clientConfidence", "dateConfidence", "docTypeConfidence");

  private final ObjectMapper objectMapper;

  /**
   * Locates the JSON object in a raw response (first '{' to last '}') and validates it.
   *
   * @param rawResponse model output, possibly wrapped in prose
   * @return validation result carrying the parsed object when valid
   */
  public ValidationResult validate(String rawResponse) {
    if (rawResponse == null) {
      return ValidationResult.failure(ValidationFailureType.PARSE_ERROR, "Empty response");
    }
    int start = rawResponse.indexOf('{');
    int end = rawResponse.lastIndexOf('}');
    if (start == -1 || end == -1 || start >= end) {
      return ValidationResult.failure(
          ValidationFailureType.PARSE_ERROR, "No valid JSON object found");
    }

    JsonNode node;
    try {
      node = objectMapper.readTree(rawResponse.substring(start, end + 1));
    } catch (JsonProcessingException e) {
      return ValidationResult.failure(
          ValidationFailureType.PARSE_ERROR, "JSON parsing error: " + e.getOriginalMessage());
    }
    return validateNode(node);
  }

  /**
   * Validates an already parsed metadata object.
   *
   * @param node candidate object
   * @return validation result
   */
  public ValidationResult validateNode(JsonNode node) {
    if (node == null || !node.isObject()) {
      return ValidationResult.failure(
          ValidationFailureType.PARSE_ERROR, "Response is not a JSON object");
    }

    List<String> missing = REQUIRED_FIELDS.stream().filter(f -> !node.has(f)).toList();
    if (!missing.isEmpty()) {
      return ValidationResult.failure(
          ValidationFailureType.MISSING_FIELDS,
          "Missing required fields: " + String.join(", ", missing));
    }

    List<String> unexpected = new ArrayList<>();
    Iterator<String> names = node.fieldNames();
    while (names.hasNext()) {
      String name = names.next();
      if (!REQUIRED_FIELDS.contains(name) && !TOLERATED_FIELDS.contains(name)) {
        unexpected.add(name);
      }
    }
    if (!unexpected.isEmpty()) {
      return ValidationResult.failure(
          ValidationFailureType.UNEXPECTED_FIELDS,
          "Unexpected fields: " + String.join(", ", unexpected));
    }

    List<String> typeErrors = new ArrayList<>();
    for (String field : TEXT_FIELDS) {
      JsonNode value = node.get(field);
      if (!value.isNull() && !value.isTextual()) {
        typeErrors.add(field + " must be a string or null");
      }
    }
    for (String field : CONFIDENCE_FIELDS) {
      JsonNode value = node.get(field);
      if (!value.isNumber()) {
        typeErrors.add(field + " must be a number");
      } else if (value.asDouble() < 0 || value.asDouble() > 1) {
        typeErrors.add(field + " must be between 0 and 1");
      }
    }
    if (!node.get("snippets").isArray()) {
      typeErrors.add("snippets must be an array");
    }
    if (!typeErrors.isEmpty()) {
      return ValidationResult.failure(
          ValidationFailureType.TYPE_ERRORS, String.join("; ", typeErrors));
    }

    return ValidationResult.success(node);
  }
}
