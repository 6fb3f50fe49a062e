package com.flamingo.ai.docsorter.service.ai;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("ResponseValidator Tests")
class ResponseValidatorTest {

  private static final String VALID =
      "{\"clientName\": \"Acme Corp\", \"clientConfidence\": 0.9, \"date\": \"2024-01-15\","
          + " \"dateConfidence\": 0.8, \"docType\": \"Invoice\", \"docTypeConfidence\": 0.95,"
          + " \"snippets\": [\"Bill to: Acme Corp\"]}";

  private final ObjectMapper objectMapper = new ObjectMapper();
  private ResponseValidator validator;

  @BeforeEach
  void setUp() {
    validator = new ResponseValidator(objectMapper);
  }

  private ObjectNode validNode() throws Exception {
    return (ObjectNode) objectMapper.readTree(VALID);
  }

  @Nested
  @DisplayName("locating JSON")
  class LocatingJson {

    @Test
    @DisplayName("should accept an object wrapped in prose")
    void shouldAccept_whenJsonWrappedInProse() {
      ValidationResult result = validator.validate("Sure, here it is:\n" + VALID + "\nCheers!");

      assertThat(result.valid()).isTrue();
      assertThat(result.data().get("clientName").asText()).isEqualTo("Acme Corp");
    }

    @Test
    @DisplayName("should report a parse error when no braces are present")
    void shouldFail_whenNoObjectPresent() {
      ValidationResult result = validator.validate("I could not find any metadata.");

      assertThat(result.valid()).isFalse();
      assertThat(result.failureType()).isEqualTo(ValidationFailureType.PARSE_ERROR);
      assertThat(result.error()).isEqualTo("No valid JSON object found");
    }

    @Test
    @DisplayName("should report a parse error for malformed JSON")
    void shouldFail_whenJsonMalformed() {
      ValidationResult result = validator.validate("{clientName: Acme,}");

      assertThat(result.failureType()).isEqualTo(ValidationFailureType.PARSE_ERROR);
      assertThat(result.error()).startsWith("JSON parsing error");
    }

    @Test
    void shouldFail_whenResponseNull() {
      assertThat(validator.validate(null).failureType())
          .isEqualTo(ValidationFailureType.PARSE_ERROR);
    }
  }

  @Nested
  @DisplayName("schema")
  class Schema {

    @Test
    @DisplayName("should list missing fields")
    void shouldFail_whenFieldsMissing() throws Exception {
      ObjectNode node = validNode();
      node.remove("snippets");
      node.remove("dateConfidence");

      ValidationResult result = validator.validateNode(node);

      assertThat(result.failureType()).isEqualTo(ValidationFailureType.MISSING_FIELDS);
      assertThat(result.error()).contains("dateConfidence", "snippets");
    }

    @Test
    @DisplayName("should reject unexpected fields")
    void shouldFail_whenUnexpectedFieldPresent() throws Exception {
      ObjectNode node = validNode();
      node.put("notes", "extra");

      ValidationResult result = validator.validateNode(node);

      assertThat(result.failureType()).isEqualTo(ValidationFailureType.UNEXPECTED_FIELDS);
      assertThat(result.error()).contains("notes");
    }

    @Test
    @DisplayName("should tolerate a model supplied overallConfidence")
    void shouldAccept_whenOverallConfidencePresent() throws Exception {
      ObjectNode node = validNode();
      node.put("overallConfidence", 0.9);

      assertThat(validator.validateNode(node).valid()).isTrue();
    }

    @Test
    @DisplayName("should accept null text fields")
    void shouldAccept_whenTextFieldsNull() throws Exception {
      ObjectNode node = validNode();
      node.putNull("clientName");
      node.putNull("date");

      assertThat(validator.validateNode(node).valid()).isTrue();
    }

    @Test
    @DisplayName("should collect type errors")
    void shouldFail_whenTypesWrong() throws Exception {
      ObjectNode node = validNode();
      node.put("clientName", 42);
      node.put("clientConfidence", "high");
      node.put("docTypeConfidence", 1.5);
      node.put("snippets", "Bill to");

      ValidationResult result = validator.validateNode(node);

      assertThat(result.failureType()).isEqualTo(ValidationFailureType.TYPE_ERRORS);
      assertThat(result.error())
          .contains("clientName must be a string or null")
          .contains("clientConfidence must be a number")
          .contains("docTypeConfidence must be between 0 and 1")
          .contains("snippets must be an array");
    }

    @Test
    void shouldFail_whenConfidenceNegative() throws Exception {
      ObjectNode node = validNode();
      node.put("dateConfidence", -0.1);

      assertThat(validator.validateNode(node).failureType())
          .isEqualTo(ValidationFailureType.TYPE_ERRORS);
    }

    @Test
    void shouldFail_whenNodeIsArray() throws Exception {
      assertThat(validator.validateNode(objectMapper.readTree("[1, 2]")).failureType())
          .isEqualTo(ValidationFailureType.PARSE_ERROR);
    }
  }
}
