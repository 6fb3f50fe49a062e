package com.flamingo.ai.docsorter.service.heuristic;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Finds the first plausible date in a document and normalizes it to {@code YYYY-MM-DD}.
 *
 * <p>Patterns are tried in a fixed order: slash separated numeric, dash or dot separated numeric,
 * month name first, day first with month name, then ISO. Numeric dates are read month-first when
 * the first group is at most 12, otherwise day-first. Matches that do not form a real calendar
 * date are skipped.
 */
@Component
public class DateExtractor {

  private static final String MONTH_NAME =
      "(jan(?:uary)?|feb(?:ruary)?|mar(?:ch)?|apr(?:il)?|may|june?|july?|aug(?:ust)?"
          + "|sep(?:t(?:ember)?)?|oct(?:ober)?|nov(?:ember)?|dec(?:ember)?)";

  private static final Pattern SLASH_NUMERIC =
      Pattern.compile("\\b(\\d{1,2})/(\\d{1,2})/(\\d{4}|\\d{2})\\b");
  private static final Pattern DASH_NUMERIC =
      Pattern.compile("\\b(\\d{1,2})[-.](\\d{1,2})[-.](\\d{4}|\\d{2})\\b");
  private static final Pattern MONTH_DAY_YEAR =
      Pattern.compile(
          "\\b" + MONTH_NAME + "\\.?\\s+(\\d{1,2})(?:st|nd|rd|th)?,?\\s+(\\d{4})\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern DAY_MONTH_YEAR =
      Pattern.compile(
          "\\b(\\d{1,2})(?:st|nd|rd|th)?\\s+" + MONTH_NAME + "\\.?,?\\s+(\\d{4})\\b",
          Pattern.CASE_INSENSITIVE);
  private static final Pattern ISO =
      Pattern.compile("\\b(\\d{4})[-/.](\\d{1,2})[-/.](\\d{1,2})\\b");
  private static final Pattern CANONICAL = Pattern.compile("^\\d{4}-\\d{2}-\\d{2}$");

  private static final Map<String, Integer> MONTHS =
      Map.ofEntries(
          Map.entry("jan", 1),
          Map.entry("feb", 2),
          Map.entry("mar", 3),
          Map.entry("apr", 4),
          Map.entry("may", 5),
          Map.entry("jun", 6),
          Map.entry("jul", 7),
          Map.entry("aug", 8),
          Map.entry("sep", 9),
          Map.entry("oct", 10),
          Map.entry("nov", 11),
          Map.entry("dec", 12));

  private static final int MIN_YEAR = 1900;
  private static final int MAX_YEAR = 2100;

  private enum Layout {
    NUMERIC,
    MONTH_NAME_FIRST,
    DAY_FIRST_MONTH_NAME,
    YEAR_FIRST
  }

  private static final List<Map.Entry<Pattern, Layout>> PATTERNS =
      List.of(
          Map.entry(SLASH_NUMERIC, Layout.NUMERIC),
          Map.entry(DASH_NUMERIC, Layout.NUMERIC),
          Map.entry(MONTH_DAY_YEAR, Layout.MONTH_NAME_FIRST),
          Map.entry(DAY_MONTH_YEAR, Layout.DAY_FIRST_MONTH_NAME),
          Map.entry(ISO, Layout.YEAR_FIRST));

  /**
   * Finds the first date in the document.
   *
   * @param lines trimmed non-empty lines
   * @return normalized date and the line it was found on
   */
  public Optional<FieldMatch> extract(List<String> lines) {
    for (Map.Entry<Pattern, Layout> entry : PATTERNS) {
      for (int i = 0; i < lines.size(); i++) {
        Matcher matcher = entry.getKey().matcher(lines.get(i));
        while (matcher.find()) {
          Optional<String> date = toIso(matcher, entry.getValue());
          if (date.isPresent()) {
            return Optional.of(new FieldMatch(date.get(), lines.get(i), i));
          }
        }
      }
    }
    return Optional.empty();
  }

  /**
   * Normalizes a free-form date string, accepting values already in canonical form.
   *
   * @param raw date text
   * @return {@code YYYY-MM-DD}, or empty when the text holds no valid date
   */
  public Optional<String> normalize(String raw) {
    if (raw == null || raw.isBlank()) {
      return Optional.empty();
    }
    String trimmed = raw.trim();
    if (CANONICAL.matcher(trimmed).matches()) {
      return isoDate(
          Integer.parseInt(trimmed.substring(0, 4)),
          Integer.parseInt(trimmed.substring(5, 7)),
          Integer.parseInt(trimmed.substring(8, 10)));
    }
    return extract(List.of(trimmed)).map(FieldMatch::value);
  }

  /** True when the line contains anything this extractor would read as a date. */
  public boolean containsDate(String line) {
    return extract(List.of(line)).isPresent();
  }

  private Optional<String> toIso(Matcher m, Layout layout) {
    switch (layout) {
      case NUMERIC -> {
        int first = Integer.parseInt(m.group(1));
        int second = Integer.parseInt(m.group(2));
        int year = expandYear(Integer.parseInt(m.group(3)));
        return first <= 12 ? isoDate(year, first, second) : isoDate(year, second, first);
      }
      case MONTH_NAME_FIRST -> {
        return isoDate(
            Integer.parseInt(m.group(3)), month(m.group(1)), Integer.parseInt(m.group(2)));
      }
      case DAY_FIRST_MONTH_NAME -> {
        return isoDate(
            Integer.parseInt(m.group(3)), month(m.group(2)), Integer.parseInt(m.group(1)));
      }
      case YEAR_FIRST -> {
        return isoDate(
            Integer.parseInt(m.group(1)),
            Integer.parseInt(m.group(2)),
            Integer.parseInt(m.group(3)));
      }
      default -> {
        return Optional.empty();
      }
    }
  }

  private static int month(String name) {
    return MONTHS.get(name.substring(0, 3).toLowerCase());
  }

  private static int expandYear(int year) {
    if (year >= 100) {
      return year;
    }
    return year < 50 ? 2000 + year : 1900 + year;
  }

  private static Optional<String> isoDate(int year, int month, int day) {
    if (year < MIN_YEAR || year > MAX_YEAR) {
      return Optional.empty();
    }
    try {
      return Optional.of(LocalDate.of(year, month, day).toString());
    } catch (DateTimeException e) {
      return Optional.empty();
    }
  }
}
