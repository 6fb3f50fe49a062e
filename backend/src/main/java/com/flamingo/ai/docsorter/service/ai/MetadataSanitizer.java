package com.flamingo.ai.docsorter.service.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.docsorter.domain.AnalysisSource;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.service.heuristic.DateExtractor;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Cleans validated language-model output into an AI-sourced {@link DocumentAnalysis}.
 *
 * <p>{@link #sanitize(String)} is idempotent: it repeats its rewrites until the text stops
 * changing.
 */
@Component
@RequiredArgsConstructor
public class MetadataSanitizer {

  static final int MAX_CLIENT_NAME_LENGTH = 200;
  static final int MAX_DOC_TYPE_LENGTH = 100;

  private static final Pattern ANGLE_BRACKETS = Pattern.compile("[<>]");
  private static final Pattern JAVASCRIPT_URI =
      Pattern.compile("javascript\\s*:", Pattern.CASE_INSENSITIVE);
  private static final Pattern EVENT_HANDLER =
      Pattern.compile(
          "\\bon[a-z]+\\s*=\\s*(\"[^\"]*\"|'[^']*'|[^\\s>]*)", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final DateExtractor dateExtractor;

  /**
   * Strips markup and script fragments and collapses whitespace.
   *
   * @param value raw text, may be null
   * @return sanitized text, null for null input
   */
  public String sanitize(String value) {
    if (value == null) {
      return null;
    }
    String current = value;
    String previous;
    do {
      previous = current;
      current = EVENT_HANDLER.matcher(current).replaceAll("");
      current = JAVASCRIPT_URI.matcher(current).replaceAll("");
      current = ANGLE_BRACKETS.matcher(current).replaceAll("");
      current = WHITESPACE.matcher(current).replaceAll(" ").trim();
    } while (!current.equals(previous));
    return current;
  }

  /**
   * Builds an AI-sourced analysis from a validated metadata object. Rejected values become null
   * with zero confidence.
   *
   * @param data object accepted by {@link ResponseValidator}
   * @param textHash hash of the analysed text
   * @return sanitized analysis with {@code source = ai}
   */
  public DocumentAnalysis toAnalysis(JsonNode data, String textHash) {
    String clientName = cleanClientName(text(data, "clientName"));
    String date = cleanDate(text(data, "date"));
    String docType = cleanDocType(text(data, "docType"));

    return DocumentAnalysis.builder()
        .clientName(clientName)
        .clientConfidence(clientName == null ? 0.0 : data.get("clientConfidence").asDouble())
        .date(date)
        .dateConfidence(date == null ? 0.0 : data.get("dateConfidence").asDouble())
        .docType(docType)
        .docTypeConfidence(docType == null ? 0.0 : data.get("docTypeConfidence").asDouble())
        .snippets(cleanSnippets(data.get("snippets")))
        .source(AnalysisSource.AI)
        .textHash(textHash)
        .build();
  }

  String cleanClientName(String raw) {
    String cleaned = sanitize(raw);
    if (cleaned == null || cleaned.isEmpty() || cleaned.length() >= MAX_CLIENT_NAME_LENGTH) {
      return null;
    }
    return cleaned;
  }

  String cleanDate(String raw) {
    return dateExtractor.normalize(sanitize(raw)).orElse(null);
  }

  String cleanDocType(String raw) {
    String cleaned = sanitize(raw);
    if (cleaned == null || cleaned.isEmpty() || cleaned.length() >= MAX_DOC_TYPE_LENGTH) {
      return null;
    }
    return cleaned;
  }

  private List<String> cleanSnippets(JsonNode snippets) {
    List<String> cleaned = new ArrayList<>();
    if (snippets == null || !snippets.isArray()) {
      return cleaned;
    }
    for (JsonNode snippet : snippets) {
      if (!snippet.isTextual()) {
        continue;
      }
      String value = sanitize(snippet.asText());
      if (!value.isEmpty() && value.length() < DocumentAnalysis.MAX_SNIPPET_LENGTH) {
        cleaned.add(value);
      }
      if (cleaned.size() == DocumentAnalysis.MAX_SNIPPETS) {
        break;
      }
    }
    return cleaned;
  }

  private static String text(JsonNode data, String field) {
    JsonNode value = data.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }
}
