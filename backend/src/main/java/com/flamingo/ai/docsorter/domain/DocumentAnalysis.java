package com.flamingo.ai.docsorter.domain;

import java.util.List;
import java.util.stream.DoubleStream;
import lombok.Builder;
import lombok.Value;

/**
 * Metadata extracted from a single document.
 *
 * <p>Instances are immutable. Every confidence is clamped to [0, 1] on construction and {@code
 * overallConfidence} is always derived from the three field confidences, so it cannot be set
 * through the builder.
 */
@Value
public class DocumentAnalysis {

  public static final String UNCLASSIFIED = "Unclassified";
  public static final int MAX_SNIPPETS = 5;
  public static final int MAX_SNIPPET_LENGTH = 500;

  String clientName;
  double clientConfidence;
  String date;
  double dateConfidence;
  String docType;
  double docTypeConfidence;
  double overallConfidence;
  List<String> snippets;
  AnalysisSource source;
  String title;

  /** SHA-256 of the originating text; the text itself is never retained. */
  String textHash;

  @Builder(toBuilder = true)
  private DocumentAnalysis(
      String clientName,
      double clientConfidence,
      String date,
      double dateConfidence,
      String docType,
      double docTypeConfidence,
      List<String> snippets,
      AnalysisSource source,
      String title,
      String textHash) {
    this.clientName = clientName;
    this.clientConfidence = clamp(clientConfidence);
    this.date = date;
    this.dateConfidence = clamp(dateConfidence);
    this.docType = docType;
    this.docTypeConfidence = clamp(docTypeConfidence);
    this.snippets = capSnippets(snippets);
    this.source = source != null ? source : AnalysisSource.REGEX;
    this.title = title;
    this.textHash = textHash;
    this.overallConfidence =
        computeOverallConfidence(
            this.clientConfidence, this.dateConfidence, this.docTypeConfidence);
  }

  /**
   * Result for text that carries no evidence at all.
   *
   * @param textHash hash of the originating text, may be null
   * @return analysis with null fields, zero confidence and an unclassified type
   */
  public static DocumentAnalysis empty(String textHash) {
    return DocumentAnalysis.builder()
        .docType(UNCLASSIFIED)
        .source(AnalysisSource.REGEX)
        .textHash(textHash)
        .build();
  }

  /**
   * Mean of the non-zero confidences plus 0.1 when at least two are non-zero, capped at 1.0.
   *
   * @param confidences field confidences
   * @return overall confidence in [0, 1]
   */
  public static double computeOverallConfidence(double... confidences) {
    double[] confident = DoubleStream.of(confidences).filter(c -> c > 0).toArray();
    if (confident.length == 0) {
      return 0.0;
    }
    double mean = DoubleStream.of(confident).average().orElse(0.0);
    if (confident.length >= 2) {
      mean += 0.1;
    }
    return Math.min(mean, 1.0);
  }

  public static double clamp(double value) {
    if (Double.isNaN(value) || value < 0) {
      return 0.0;
    }
    return Math.min(value, 1.0);
  }

  /** True when client, date and a real document type are all present. */
  public boolean hasAllFields() {
    return clientName != null && date != null && isClassified();
  }

  /** True when at least one of client, date or a real document type is present. */
  public boolean hasAnyField() {
    return clientName != null || date != null || isClassified();
  }

  public boolean isClassified() {
    return docType != null && !UNCLASSIFIED.equalsIgnoreCase(docType);
  }

  private static List<String> capSnippets(List<String> snippets) {
    if (snippets == null || snippets.isEmpty()) {
      return List.of();
    }
    return snippets.stream()
        .filter(s -> s != null && !s.isBlank() && s.length() < MAX_SNIPPET_LENGTH)
        .limit(MAX_SNIPPETS)
        .toList();
  }
}
