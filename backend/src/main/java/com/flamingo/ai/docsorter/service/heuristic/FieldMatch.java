package com.flamingo.ai.docsorter.service.heuristic;

/**
 * A value found in the text together with the line it came from.
 *
 * @param value normalized value
 * @param evidence trimmed source line, used as a snippet
 * @param lineIndex index of the source line among non-empty lines
 */
public record FieldMatch(String value, String evidence, int lineIndex) {}
