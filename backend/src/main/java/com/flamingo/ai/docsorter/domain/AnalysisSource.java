package com.flamingo.ai.docsorter.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** Origin of the field values in a {@link DocumentAnalysis}. */
public enum AnalysisSource {

  /** Produced by keyword and pattern heuristics only. */
  REGEX("regex"),

  /** Freshly returned by the language model. */
  AI("ai"),

  /** Served from the content cache instead of calling the language model. */
  AI_CACHED("ai-cached"),

  /** Heuristic result reconciled with an AI result. */
  HYBRID("hybrid");

  private final String value;

  AnalysisSource(String value) {
    this.value = value;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  @JsonCreator
  public static AnalysisSource fromValue(String value) {
    for (AnalysisSource source : values()) {
      if (source.value.equalsIgnoreCase(value) || source.name().equalsIgnoreCase(value)) {
        return source;
      }
    }
    throw new IllegalArgumentException("Unknown analysis source: " + value);
  }
}
