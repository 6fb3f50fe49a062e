package com.flamingo.ai.docsorter.domain;

/**
 * A document handed to batch analysis.
 *
 * @param filePath originating path, used for the filename date fallback only
 * @param text extracted plain text
 * @param model optional model override used to group intelligent batch calls
 */
public record DocumentInput(String filePath, String text, String model) {

  public static DocumentInput of(String filePath, String text) {
    return new DocumentInput(filePath, text, null);
  }
}
