package com.flamingo.ai.docsorter.service.heuristic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Picks the most likely client or counterparty name.
 *
 * <p>Candidates come from labelled lines ("Bill To:", "From:", "Attention:", "Re:"), standalone
 * Title-Case lines and names ending in a company suffix. Each candidate scores 10, plus 20 when it
 * follows a billing label, plus 15 when it carries a company suffix, plus 10 when it sits in the
 * first 5 lines. The highest score wins; earlier candidates win ties.
 */
@Component
@Slf4j
public class ClientNameExtractor {

  static final int BASE_SCORE = 10;
  static final int BILLING_LABEL_BONUS = 20;
  static final int COMPANY_SUFFIX_BONUS = 15;
  static final int EARLY_LINE_BONUS = 10;
  static final int EARLY_LINES = 5;
  private static final int MAX_NAME_LENGTH = 100;

  private static final Pattern LABELLED_LINE =
      Pattern.compile(
          "^(bill(?:ed)?\\s+to|invoice\\s+to|sold\\s+to|to|from|attention|attn|re|client|customer"
              + "|vendor|supplier|company|payee|account\\s+holder)\\s*[:\\-]\\s*(.*)$",
          Pattern.CASE_INSENSITIVE);

  private static final Pattern BILLING_LABEL =
      Pattern.compile("^(bill(?:ed)?\\s+to|invoice\\s+to|sold\\s+to)$", Pattern.CASE_INSENSITIVE);

  private static final Pattern TITLE_CASE_LINE =
      Pattern.compile("^([A-Z][a-z]+(?:[ \\t]+[A-Z][a-z]+){1,3})$");

  private static final String SUFFIXES =
      "Inc|Incorporated|Corp|Corporation|LLC|Ltd|Limited|Co|Company|Group|GmbH|LLP|PLC";

  private static final Pattern COMPANY_NAME =
      Pattern.compile(
          "\\b([A-Z][A-Za-z0-9&'.\\-]*(?:[ \\t]+(?:[A-Z][A-Za-z0-9&'.\\-]*|&|and|of)){0,4}"
              + "[ \\t]+(?:"
              + SUFFIXES
              + "))\\b\\.?");

  private static final Pattern COMPANY_SUFFIX =
      Pattern.compile("\\b(?:" + SUFFIXES + ")\\.?$", Pattern.CASE_INSENSITIVE);

  // Words that make a Title-Case line a heading rather than a name
  private static final Set<String> NON_NAME_WORDS =
      Set.of(
          "invoice", "receipt", "contract", "agreement", "statement", "report", "proposal",
          "resume", "letter", "memo", "summary", "total", "amount", "date", "page", "dear",
          "sincerely", "regards", "thank", "payment", "balance", "january", "february", "march",
          "april", "may", "june", "july", "august", "september", "october", "november",
          "december", "monday", "tuesday", "wednesday", "thursday", "friday", "saturday",
          "sunday", "terms", "conditions", "executive", "work", "experience", "education");

  /**
   * Finds the best client name candidate.
   *
   * @param lines trimmed non-empty lines
   * @return winning name and its source line
   */
  public Optional<FieldMatch> extract(List<String> lines) {
    Map<String, Candidate> candidates = new LinkedHashMap<>();

    for (int i = 0; i < lines.size(); i++) {
      String line = lines.get(i);
      Matcher labelled = LABELLED_LINE.matcher(line);
      if (labelled.matches()) {
        String value = labelled.group(2).trim();
        int valueLine = i;
        if (value.isEmpty() && i + 1 < lines.size()) {
          valueLine = i + 1;
          value = lines.get(valueLine);
        }
        boolean billing = BILLING_LABEL.matcher(labelled.group(1).trim()).matches();
        offer(candidates, clean(value), line, valueLine, billing);
      }

      Matcher titleCase = TITLE_CASE_LINE.matcher(line);
      if (titleCase.matches() && !containsNonNameWord(titleCase.group(1))) {
        offer(candidates, titleCase.group(1), line, i, false);
      }

      Matcher company = COMPANY_NAME.matcher(line);
      while (company.find()) {
        offer(candidates, clean(company.group(0)), line, i, false);
      }
    }

    Candidate best = null;
    for (Candidate candidate : candidates.values()) {
      if (best == null || candidate.score() > best.score()) {
        best = candidate;
      }
    }
    if (best == null) {
      return Optional.empty();
    }
    log.debug("Client candidates: {}, selected '{}'", candidates.size(), best.name());
    return Optional.of(new FieldMatch(best.name(), best.evidence(), best.lineIndex()));
  }

  /** True when the name ends with a recognised business suffix. */
  public boolean hasCompanySuffix(String name) {
    return name != null && COMPANY_SUFFIX.matcher(name.trim()).find();
  }

  private void offer(
      Map<String, Candidate> candidates,
      String name,
      String evidence,
      int lineIndex,
      boolean billingLabel) {
    if (!isPlausibleName(name)) {
      return;
    }
    int score = BASE_SCORE;
    if (billingLabel) {
      score += BILLING_LABEL_BONUS;
    }
    if (hasCompanySuffix(name)) {
      score += COMPANY_SUFFIX_BONUS;
    }
    if (lineIndex < EARLY_LINES) {
      score += EARLY_LINE_BONUS;
    }
    Candidate candidate = new Candidate(name, score, evidence, lineIndex);
    candidates.merge(
        name.toLowerCase(), candidate, (old, fresh) -> fresh.score() > old.score() ? fresh : old);
  }

  private boolean isPlausibleName(String name) {
    if (name == null || name.length() < 2 || name.length() > MAX_NAME_LENGTH) {
      return false;
    }
    if (name.chars().noneMatch(Character::isLetter)) {
      return false;
    }
    String lower = name.toLowerCase();
    return !DocumentTypeClassifier.TYPE_KEYWORDS.containsKey(name)
        && !DocumentTypeClassifier.TYPE_KEYWORDS.values().stream()
            .anyMatch(keywords -> keywords.contains(lower));
  }

  private boolean containsNonNameWord(String text) {
    for (String word : text.toLowerCase().split("\\s+")) {
      if (NON_NAME_WORDS.contains(word)) {
        return true;
      }
    }
    return false;
  }

  static String clean(String value) {
    if (value == null) {
      return null;
    }
    String cleaned = value;
    // Cut at column gaps and separators that usually start the next field
    for (String separator : List.of("  ", "\t", "|", " - ")) {
      int index = cleaned.indexOf(separator);
      if (index > 0) {
        cleaned = cleaned.substring(0, index);
      }
    }
    cleaned = cleaned.replaceAll("[^\\p{L}\\p{N}\\s&'.,\\-]", "").trim();
    cleaned = cleaned.replaceAll("[,;:\\-]+$", "").trim();
    return cleaned;
  }

  private record Candidate(String name, int score, String evidence, int lineIndex) {}
}
