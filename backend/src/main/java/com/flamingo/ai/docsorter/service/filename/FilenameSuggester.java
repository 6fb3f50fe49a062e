package com.flamingo.ai.docsorter.service.filename;

import com.flamingo.ai.docsorter.domain.DocumentAnalysis;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.regex.Pattern;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Proposes {@code Type_Client_Date.ext} filenames from an analysis.
 *
 * <p>When the analysis has no date the file's modification date is used, then {@code
 * UnknownDate}.
 */
@Component
@RequiredArgsConstructor
public class FilenameSuggester {

  static final int MAX_FILENAME_LENGTH = 100;
  static final int MAX_COMPONENT_LENGTH = 50;
  static final int MAX_CLIENT_LENGTH = 30;

  private static final Pattern INVALID_CHARS = Pattern.compile("[<>:\"/\\\\|?*]");
  private static final Pattern BUSINESS_SUFFIX =
      Pattern.compile(
          "\\b(Incorporated|Corporation|Inc|Corp|LLC|Ltd)\\b\\.?", Pattern.CASE_INSENSITIVE);
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final Pattern REPEATED_UNDERSCORES = Pattern.compile("_+");

  private final FileTimestampProvider fileTimestampProvider;

  /**
   * Builds the suggested filename.
   *
   * @param analysis final analysis
   * @param filePath original path, source of the extension and the fallback date
   * @return filename of at most 100 characters
   */
  public String suggest(DocumentAnalysis analysis, String filePath) {
    String type =
        analysis.isClassified() ? sanitizeComponent(analysis.getDocType()) : "Unknown";
    String client = sanitizeComponent(analysis.getClientName());
    if (client.length() > MAX_CLIENT_LENGTH) {
      client = client.substring(0, MAX_CLIENT_LENGTH).replaceAll("_+$", "");
    }
    if (client.isEmpty()) {
      client = "UnknownClient";
    }
    if (type.isEmpty()) {
      type = "Unknown";
    }

    String extension = extension(filePath);
    String base = type + "_" + client + "_" + date(analysis, filePath);
    int maxBase = MAX_FILENAME_LENGTH - extension.length();
    if (base.length() > maxBase) {
      base = base.substring(0, Math.max(1, maxBase));
    }
    return base + extension;
  }

  static String sanitizeComponent(String value) {
    if (value == null) {
      return "";
    }
    String cleaned = INVALID_CHARS.matcher(value).replaceAll("_");
    cleaned = BUSINESS_SUFFIX.matcher(cleaned).replaceAll("");
    cleaned = WHITESPACE.matcher(cleaned.trim()).replaceAll("_");
    cleaned = REPEATED_UNDERSCORES.matcher(cleaned).replaceAll("_");
    cleaned = cleaned.replaceAll("^_+|_+$", "").replaceAll("[,.]+$", "");
    if (cleaned.length() > MAX_COMPONENT_LENGTH) {
      cleaned = cleaned.substring(0, MAX_COMPONENT_LENGTH);
    }
    return cleaned;
  }

  private String date(DocumentAnalysis analysis, String filePath) {
    if (analysis.getDate() != null) {
      return analysis.getDate();
    }
    return fileTimestampProvider
        .lastModified(filePath)
        .map(instant -> LocalDate.ofInstant(instant, ZoneId.systemDefault()).toString())
        .orElse("UnknownDate");
  }

  private static String extension(String filePath) {
    if (filePath == null) {
      return "";
    }
    String name = filePath.replace('\\', '/');
    name = name.substring(name.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return "";
    }
    return name.substring(dot).toLowerCase();
  }
}
