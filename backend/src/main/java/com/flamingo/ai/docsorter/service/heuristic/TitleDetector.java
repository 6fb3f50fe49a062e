package com.flamingo.ai.docsorter.service.heuristic;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/** Best-guess document title from the first lines of text. */
@Component
public class TitleDetector {

  static final int SCAN_LINES = 10;
  static final double MIN_SCORE = 3.0;
  private static final int MAX_TITLE_LENGTH = 150;

  private static final List<Pattern> BOILERPLATE =
      List.of(
          Pattern.compile("^page\\s+\\d+(\\s+of\\s+\\d+)?$", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^\\d+$"),
          Pattern.compile("(©|\\(c\\)|copyright)", Pattern.CASE_INSENSITIVE),
          Pattern.compile("\\bconfidential\\b", Pattern.CASE_INSENSITIVE),
          Pattern.compile("all rights reserved", Pattern.CASE_INSENSITIVE),
          Pattern.compile("^(draft|untitled|document)$", Pattern.CASE_INSENSITIVE));

  private static final Pattern PHONE_LIKE =
      Pattern.compile(
          "(\\+?\\d[\\d\\s().-]{7,}\\d)|\\b(tel|phone|fax)\\b", Pattern.CASE_INSENSITIVE);
  private static final Pattern ADDRESS_LIKE =
      Pattern.compile(
          "^\\d+\\s+\\w+.*\\b(st|street|ave|avenue|rd|road|blvd|lane|ln|drive|dr|suite|way)\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern CONTACT_LIKE =
      Pattern.compile("@|https?://|www\\.", Pattern.CASE_INSENSITIVE);

  private final DateExtractor dateExtractor;

  public TitleDetector(DateExtractor dateExtractor) {
    this.dateExtractor = dateExtractor;
  }

  /**
   * Scores the first non-empty lines and returns the best one above the minimum score.
   *
   * @param lines trimmed non-empty lines
   * @return the title line, if any scored high enough
   */
  public Optional<String> detect(List<String> lines) {
    String best = null;
    double bestScore = MIN_SCORE;
    int limit = Math.min(SCAN_LINES, lines.size());
    for (int i = 0; i < limit; i++) {
      String line = lines.get(i);
      if (line.length() > MAX_TITLE_LENGTH || isBoilerplate(line)) {
        continue;
      }
      double score = score(line, i);
      if (score > bestScore || (best == null && score >= bestScore)) {
        bestScore = score;
        best = line;
      }
    }
    return Optional.ofNullable(best);
  }

  double score(String line, int position) {
    double score = 0;
    int words = line.split("\\s+").length;
    if (words <= 5) {
      score += 3;
    } else if (words <= 10) {
      score += 1;
    } else {
      score -= 2;
    }

    if (isAllCaps(line)) {
      score += 2;
    } else if (isTitleCase(line)) {
      score += 2;
    }

    score += (SCAN_LINES - position) * 0.5;

    if (dateExtractor.containsDate(line)) {
      score -= 3;
    }
    if (PHONE_LIKE.matcher(line).find()) {
      score -= 3;
    }
    if (ADDRESS_LIKE.matcher(line).find()) {
      score -= 2;
    }
    if (CONTACT_LIKE.matcher(line).find()) {
      score -= 3;
    }
    return score;
  }

  private boolean isBoilerplate(String line) {
    return BOILERPLATE.stream().anyMatch(p -> p.matcher(line).find());
  }

  private static boolean isAllCaps(String line) {
    boolean hasLetter = false;
    for (char c : line.toCharArray()) {
      if (Character.isLetter(c)) {
        hasLetter = true;
        if (Character.isLowerCase(c)) {
          return false;
        }
      }
    }
    return hasLetter;
  }

  private static boolean isTitleCase(String line) {
    boolean sawWord = false;
    for (String word : line.split("\\s+")) {
      if (word.isEmpty() || !Character.isLetter(word.charAt(0))) {
        continue;
      }
      sawWord = true;
      if (!Character.isUpperCase(word.charAt(0)) && word.length() > 3) {
        return false;
      }
    }
    return sawWord;
  }
}
