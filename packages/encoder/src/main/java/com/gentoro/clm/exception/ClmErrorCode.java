package com.gentoro.clm.exception;

/** Stable error codes attached to every {@link ClmException}. */
public enum ClmErrorCode {
  UNKNOWN,
  CONFIGURATION_ERROR,
  LANGUAGE_NOT_SUPPORTED,
  VOCABULARY_ERROR,
  RULE_ERROR,
  INVALID_INPUT,
  RECORD_VALIDATION_ERROR,
  PATTERN_BUDGET_EXCEEDED,
  TEMPLATE_ERROR,
  ANALYZER_ERROR
}
