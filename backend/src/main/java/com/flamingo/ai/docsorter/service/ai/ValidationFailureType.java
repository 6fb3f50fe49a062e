package com.flamingo.ai.docsorter.service.ai;

/** Why a language-model response was rejected. */
public enum ValidationFailureType {

  /** No JSON object could be located or parsed. */
  PARSE_ERROR,

  /** One or more required fields are absent. */
  MISSING_FIELDS,

  /** Fields outside the metadata schema are present. */
  UNEXPECTED_FIELDS,

  /** A field has the wrong type or an out-of-range value. */
  TYPE_ERRORS
}
