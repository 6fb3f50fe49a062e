package com.flamingo.ai.docsorter.service.heuristic;

import com.flamingo.ai.docsorter.domain.AnalysisSource;
import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import com.flamingo.ai.docsorter.service.cache.ContentHasher;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * First-pass, pattern based metadata extraction.
 *
 * <p>Runs type classification, title, date and client detection over the text and scores each
 * field with {@link ConfidenceScorer}. Never throws: absent evidence gives null fields with zero
 * confidence and an {@code Unclassified} type.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class HeuristicExtractor {

  private final DocumentTypeClassifier classifier;
  private final TitleDetector titleDetector;
  private final DateExtractor dateExtractor;
  private final ClientNameExtractor clientNameExtractor;
  private final ConfidenceScorer confidenceScorer;

  /**
   * Extracts metadata from text.
   *
   * @param text document text
   * @param filePath originating path, for logging only
   * @return analysis with {@code source = regex}
   */
  public DocumentAnalysis extract(String text, String filePath) {
    if (text == null || text.isBlank()) {
      return DocumentAnalysis.empty(text == null ? null : ContentHasher.sha256Hex(text));
    }
    String textHash = ContentHasher.sha256Hex(text);

    try {
      List<String> lines = text.lines().map(String::trim).filter(l -> !l.isEmpty()).toList();
      List<String> words =
          Arrays.stream(text.trim().split("\\s+")).filter(w -> !w.isEmpty()).toList();
      String content = text.toLowerCase();

      DocumentTypeClassifier.Classification classification =
          classifier.classify(lines, words, content);
      Optional<FieldMatch> date = dateExtractor.extract(lines);
      Optional<FieldMatch> client = clientNameExtractor.extract(lines);
      String title = titleDetector.detect(lines).orElse(null);

      String docType =
          classification.isClassified() ? classification.type() : DocumentAnalysis.UNCLASSIFIED;
      String clientName = client.map(FieldMatch::value).orElse(null);
      String dateValue = date.map(FieldMatch::value).orElse(null);

      DocumentAnalysis analysis =
          DocumentAnalysis.builder()
              .clientName(clientName)
              .clientConfidence(confidenceScorer.scoreClient(clientName, text))
              .date(dateValue)
              .dateConfidence(confidenceScorer.scoreDate(dateValue, text))
              .docType(docType)
              .docTypeConfidence(confidenceScorer.scoreDocType(docType, text))
              .title(title)
              .snippets(
                  snippets(
                      classification.evidence(),
                      client.map(FieldMatch::evidence).orElse(null),
                      date.map(FieldMatch::evidence).orElse(null)))
              .source(AnalysisSource.REGEX)
              .textHash(textHash)
              .build();

      log.debug(
          "Heuristic analysis [{}] file={}: type={} ({}), client={}, date={}, overall={}",
          ContentHasher.shortHash(textHash),
          filePath,
          analysis.getDocType(),
          classification.method(),
          analysis.getClientName() != null,
          analysis.getDate(),
          String.format("%.3f", analysis.getOverallConfidence()));
      return analysis;
    } catch (RuntimeException e) {
      log.warn(
          "Heuristic extraction failed [{}] for {}: {}",
          ContentHasher.shortHash(textHash),
          filePath,
          e.getMessage());
      return DocumentAnalysis.empty(textHash);
    }
  }

  private static List<String> snippets(String... evidence) {
    Set<String> unique = new LinkedHashSet<>();
    for (String line : evidence) {
      if (line != null && !line.isBlank()) {
        unique.add(line.trim());
      }
    }
    return new ArrayList<>(unique);
  }
}
