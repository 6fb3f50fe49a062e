package com.flamingo.ai.docsorter.service.heuristic;

import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import java.util.List;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Per-field confidence for heuristic results.
 *
 * <p>Each score depends only on the extracted value and the source text and is clamped to [0, 1].
 */
@Component
public class ConfidenceScorer {

  static final List<String> CLIENT_CONTEXTS =
      List.of(
          "bill to", "billed to", "invoice to", "to:", "from", "vendor", "supplier", "company",
          "customer", "account holder", "payee");

  static final List<String> DATE_CONTEXTS =
      List.of(
          "date", "issued", "created", "generated", "printed", "due", "expires", "valid",
          "effective");

  private static final Pattern DATE_LABEL_LINE =
      Pattern.compile("\\b(date|dated|issued|due|effective)\\b.*\\d", Pattern.CASE_INSENSITIVE);
  private static final Pattern CANONICAL_DATE = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

  private static final int EARLY_LINES = 5;
  private static final int HEADER_LINES = 10;

  private final DocumentTypeClassifier classifier;
  private final ClientNameExtractor clientNameExtractor;

  public ConfidenceScorer(
      DocumentTypeClassifier classifier, ClientNameExtractor clientNameExtractor) {
    this.classifier = classifier;
    this.clientNameExtractor = clientNameExtractor;
  }

  /**
   * Client confidence: label context and name length averaged, raised when the name appears early
   * or carries a company suffix, lowered when it only matches loosely.
   */
  public double scoreClient(String clientName, String text) {
    if (isBlank(clientName) || text == null) {
      return 0.0;
    }
    String lower = text.toLowerCase();
    long contexts = CLIENT_CONTEXTS.stream().filter(lower::contains).count();
    double contextScore = Math.min(contexts / 3.0, 1.0);
    double lengthScore = Math.min(clientName.length() / 20.0, 1.0);
    double score = (contextScore + lengthScore) / 2;

    if (firstLines(text, EARLY_LINES).toLowerCase().contains(clientName.toLowerCase())) {
      score += 0.2;
    }
    if (clientNameExtractor.hasCompanySuffix(clientName)) {
      score += 0.1;
    }
    if (!text.contains(clientName)) {
      score -= lower.contains(clientName.toLowerCase()) ? 0.1 : 0.3;
    }
    return DocumentAnalysis.clamp(score);
  }

  /**
   * Date confidence: 0.3 for a valid canonical date, up to 0.4 more for date vocabulary in the
   * text and 0.2 when a labelled line carries the date.
   */
  public double scoreDate(String date, String text) {
    if (isBlank(date) || text == null || !CANONICAL_DATE.matcher(date).matches()) {
      return 0.0;
    }
    String lower = text.toLowerCase();
    long contexts = DATE_CONTEXTS.stream().filter(lower::contains).count();
    double score = 0.3 + Math.min(contexts / 2.0, 1.0) * 0.4;
    if (text.lines().anyMatch(line -> DATE_LABEL_LINE.matcher(line).find())) {
      score += 0.2;
    }
    return DocumentAnalysis.clamp(score);
  }

  /**
   * Document type confidence: keyword hits out of 5, plus 0.2 when a keyword is in the header
   * lines and 0.1 when the type name appears verbatim.
   */
  public double scoreDocType(String docType, String text) {
    if (isBlank(docType) || DocumentAnalysis.UNCLASSIFIED.equalsIgnoreCase(docType)) {
      return 0.0;
    }
    if (text == null) {
      return 0.0;
    }
    String lower = text.toLowerCase();
    int matches = classifier.countKeywordMatches(docType, lower);
    double score = Math.min(matches / 5.0, 1.0);
    if (classifier.countKeywordMatches(docType, firstLines(text, HEADER_LINES).toLowerCase()) > 0) {
      score += 0.2;
    }
    if (DocumentTypeClassifier.wordPattern(docType.toLowerCase()).matcher(lower).find()) {
      score += 0.1;
    }
    return DocumentAnalysis.clamp(score);
  }

  private static String firstLines(String text, int count) {
    return String.join("\n", text.lines().filter(l -> !l.isBlank()).limit(count).toList());
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
