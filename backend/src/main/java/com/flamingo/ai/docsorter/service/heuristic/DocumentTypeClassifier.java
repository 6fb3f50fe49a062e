package com.flamingo.ai.docsorter.service.heuristic;

import java.util.Arrays;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Keyword based document type classification.
 *
 * <p>The primary pass weighs keyword hits by where they occur: header zone (first 20 lines, 20 per
 * hit), early content (first 100 words, 15 per hit) and the whole document (5 per hit), plus 50
 * when the type name itself appears as a phrase. When no type reaches 0.3 confidence a word
 * frequency pass over stop-word filtered tokens gets a chance, capped at 0.8.
 */
@Component
@Slf4j
public class DocumentTypeClassifier {

  static final int HEADER_LINES = 20;
  static final int EARLY_WORDS = 100;
  static final int HEADER_WEIGHT = 20;
  static final int EARLY_WEIGHT = 15;
  static final int DOCUMENT_WEIGHT = 5;
  static final int TYPE_NAME_BONUS = 50;
  static final int MIN_WINNING_SCORE = 10;
  static final double SECONDARY_THRESHOLD = 0.3;
  static final double SECONDARY_CAP = 0.8;

  /** Type name to keywords, in tie-break order. */
  public static final Map<String, List<String>> TYPE_KEYWORDS = buildTypeKeywords();

  // Single tokens for the frequency pass; every token is also a primary keyword of its type
  private static final Map<String, String> FREQUENCY_KEYWORDS =
      Map.ofEntries(
          Map.entry("invoice", "Invoice"),
          Map.entry("billing", "Invoice"),
          Map.entry("resume", "Resume"),
          Map.entry("education", "Resume"),
          Map.entry("skills", "Resume"),
          Map.entry("contract", "Contract"),
          Map.entry("agreement", "Contract"),
          Map.entry("nda", "Contract"),
          Map.entry("statement", "Statement"),
          Map.entry("balance", "Statement"),
          Map.entry("receipt", "Receipt"),
          Map.entry("transaction", "Receipt"),
          Map.entry("proposal", "Proposal"),
          Map.entry("deliverables", "Proposal"),
          Map.entry("report", "Report"),
          Map.entry("analysis", "Report"),
          Map.entry("findings", "Report"),
          Map.entry("memo", "Letter"),
          Map.entry("correspondence", "Letter"),
          Map.entry("sincerely", "Letter"),
          Map.entry("irs", "Tax Document"),
          Map.entry("deduction", "Tax Document"),
          Map.entry("court", "Legal Document"),
          Map.entry("attorney", "Legal Document"),
          Map.entry("litigation", "Legal Document"),
          Map.entry("lawsuit", "Legal Document"));

  static final Set<String> STOP_WORDS =
      Set.of(
          "a", "an", "and", "are", "as", "at", "be", "by", "for", "from", "has", "he", "in", "is",
          "it", "its", "of", "on", "or", "that", "the", "to", "was", "were", "will", "with", "this",
          "but", "they", "have", "had", "what", "when", "where", "who", "which", "why", "how",
          "all", "each", "every", "both", "few", "more", "most", "other", "some", "such", "no",
          "nor", "not", "only", "own", "same", "so", "than", "too", "very", "just", "can", "should",
          "now", "been", "being", "do", "does", "did", "would", "could", "may", "about", "after",
          "before", "into", "over", "under", "up", "am", "i", "me", "my", "we", "our", "you",
          "your", "him", "her", "them", "their", "if", "then", "also", "here", "there", "these",
          "those", "any", "please");

  private final Map<String, List<Pattern>> keywordPatterns = compileKeywordPatterns();
  private final Map<String, Pattern> typeNamePatterns = compileTypeNamePatterns();

  /**
   * Classifies a document.
   *
   * @param lines trimmed non-empty lines
   * @param words whitespace separated words of the whole text
   * @param content lowercase flattened text
   * @return winning type, or {@link Classification#none()} when nothing scores above the minimum
   */
  public Classification classify(List<String> lines, List<String> words, String content) {
    String header =
        lines.stream().limit(HEADER_LINES).collect(Collectors.joining("\n")).toLowerCase();
    String early = words.stream().limit(EARLY_WORDS).collect(Collectors.joining(" ")).toLowerCase();

    String bestType = null;
    int bestScore = 0;
    for (Map.Entry<String, List<Pattern>> entry : keywordPatterns.entrySet()) {
      int score = 0;
      for (Pattern keyword : entry.getValue()) {
        score += countMatches(keyword, header) * HEADER_WEIGHT;
        score += countMatches(keyword, early) * EARLY_WEIGHT;
        score += countMatches(keyword, content) * DOCUMENT_WEIGHT;
      }
      if (typeNamePatterns.get(entry.getKey()).matcher(content).find()) {
        score += TYPE_NAME_BONUS;
      }
      if (score > bestScore) {
        bestScore = score;
        bestType = entry.getKey();
      }
    }

    Classification primary = Classification.none();
    if (bestScore > MIN_WINNING_SCORE) {
      double confidence = Math.min(bestScore / 100.0, 1.0);
      primary = new Classification(bestType, confidence, evidenceLine(bestType, lines), "keyword");
    }

    if (primary.confidence() >= SECONDARY_THRESHOLD) {
      return primary;
    }

    Classification secondary = classifyByFrequency(content, lines);
    if (secondary.isClassified()) {
      log.debug(
          "Frequency classifier chose {} ({}) over keyword result {}",
          secondary.type(),
          String.format("%.2f", secondary.confidence()),
          primary.type());
      return secondary;
    }
    return primary;
  }

  Classification classifyByFrequency(String content, List<String> lines) {
    Map<String, Integer> frequencies = new HashMap<>();
    for (String token : tokenize(content)) {
      if (!STOP_WORDS.contains(token)) {
        frequencies.merge(token, 1, Integer::sum);
      }
    }

    Map<String, Integer> typeScores = new LinkedHashMap<>();
    for (String type : TYPE_KEYWORDS.keySet()) {
      typeScores.put(type, 0);
    }
    FREQUENCY_KEYWORDS.forEach(
        (token, type) -> typeScores.merge(type, frequencies.getOrDefault(token, 0), Integer::sum));

    String bestType = null;
    int bestScore = 0;
    for (Map.Entry<String, Integer> entry : typeScores.entrySet()) {
      if (entry.getValue() > bestScore) {
        bestScore = entry.getValue();
        bestType = entry.getKey();
      }
    }
    if (bestType == null) {
      return Classification.none();
    }
    double confidence = Math.min(0.3 + 0.1 * bestScore, SECONDARY_CAP);
    return new Classification(bestType, confidence, evidenceLine(bestType, lines), "frequency");
  }

  /**
   * Counts whole-word keyword occurrences of a type in the given text.
   *
   * @param type document type name
   * @param lowercaseText text to search, already lowercased
   * @return number of keyword hits, zero for unknown types
   */
  public int countKeywordMatches(String type, String lowercaseText) {
    List<Pattern> patterns = keywordPatterns.get(type);
    if (patterns == null) {
      return 0;
    }
    return patterns.stream().mapToInt(p -> countMatches(p, lowercaseText)).sum();
  }

  private String evidenceLine(String type, List<String> lines) {
    List<Pattern> patterns = keywordPatterns.get(type);
    for (String line : lines) {
      String lower = line.toLowerCase();
      if (patterns.stream().anyMatch(p -> p.matcher(lower).find())) {
        return line;
      }
    }
    return null;
  }

  static List<String> tokenize(String text) {
    return Arrays.stream(text.split("[^\\p{L}\\p{N}']+"))
        .map(w -> w.replaceAll("^'+|'+$", ""))
        .filter(w -> w.length() >= 2)
        .toList();
  }

  private static int countMatches(Pattern pattern, String text) {
    Matcher matcher = pattern.matcher(text);
    int count = 0;
    while (matcher.find()) {
      count++;
    }
    return count;
  }

  static Pattern wordPattern(String phrase) {
    return Pattern.compile("(?<![\\p{L}\\p{N}])" + Pattern.quote(phrase) + "(?![\\p{L}\\p{N}])");
  }

  private static Map<String, List<Pattern>> compileKeywordPatterns() {
    Map<String, List<Pattern>> patterns = new LinkedHashMap<>();
    TYPE_KEYWORDS.forEach(
        (type, keywords) ->
            patterns.put(
                type, keywords.stream().map(DocumentTypeClassifier::wordPattern).toList()));
    return patterns;
  }

  private static Map<String, Pattern> compileTypeNamePatterns() {
    Map<String, Pattern> patterns = new HashMap<>();
    TYPE_KEYWORDS.keySet().forEach(type -> patterns.put(type, wordPattern(type.toLowerCase())));
    return patterns;
  }

  private static Map<String, List<String>> buildTypeKeywords() {
    Map<String, List<String>> keywords = new LinkedHashMap<>();
    keywords.put(
        "Invoice",
        List.of(
            "invoice", "bill", "billing", "amount due", "payment due", "total amount",
            "invoice number", "billed to"));
    keywords.put(
        "Resume",
        List.of(
            "resume", "cv", "curriculum vitae", "professional summary", "work experience",
            "education", "skills", "objective"));
    keywords.put(
        "Contract",
        List.of(
            "contract", "agreement", "terms and conditions", "service agreement",
            "partnership agreement", "nda", "non-disclosure"));
    keywords.put(
        "Statement",
        List.of(
            "statement", "account statement", "bank statement", "balance", "account balance",
            "transaction history"));
    keywords.put(
        "Receipt",
        List.of(
            "receipt", "payment received", "thank you for your payment", "transaction",
            "purchase confirmation"));
    keywords.put(
        "Proposal",
        List.of(
            "proposal", "project proposal", "business proposal", "scope of work",
            "deliverables"));
    keywords.put(
        "Report",
        List.of(
            "report", "analysis", "findings", "conclusions", "executive summary",
            "monthly report"));
    keywords.put(
        "Letter",
        List.of("dear", "sincerely", "yours truly", "letter", "correspondence", "memo"));
    keywords.put(
        "Tax Document",
        List.of("tax return", "w-2", "1099", "irs", "federal tax", "state tax", "deduction"));
    keywords.put(
        "Legal Document",
        List.of(
            "legal", "court", "lawsuit", "litigation", "attorney", "lawyer", "legal notice"));
    return keywords;
  }

  /**
   * Outcome of classification.
   *
   * @param type winning type, null when unclassified
   * @param confidence classification strength, used only to decide on the secondary pass
   * @param evidence first line containing a keyword of the type
   * @param method "keyword" or "frequency"
   */
  public record Classification(String type, double confidence, String evidence, String method) {

    static Classification none() {
      return new Classification(null, 0.0, null, "none");
    }

    public boolean isClassified() {
      return type != null;
    }
  }
}
