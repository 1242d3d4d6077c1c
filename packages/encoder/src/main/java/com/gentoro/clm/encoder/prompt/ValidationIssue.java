package com.gentoro.clm.encoder.prompt;

import com.fasterxml.jackson.annotation.JsonProperty;

/** A finding of {@link PromptTemplateValidator}. */
public record ValidationIssue(
    @JsonProperty("severity") Severity severity,
    @JsonProperty("code") String code,
    @JsonProperty("message") String message) {

  public enum Severity {
    ERROR,
    WARNING
  }

  public static ValidationIssue error(String code, String message) {
    return new ValidationIssue(Severity.ERROR, code, message);
  }

  public static ValidationIssue warning(String code, String message) {
    return new ValidationIssue(Severity.WARNING, code, message);
  }
}
