package com.gentoro.clm.exception;

/** Raised while building a configuration for a language without a complete resource pack. */
public class LanguageNotSupportedException extends ClmException {
  private final String language;

  public LanguageNotSupportedException(String language, String reason) {
    super(
        ClmErrorCode.LANGUAGE_NOT_SUPPORTED,
        "language not fully supported: " + language + (reason == null ? "" : " (" + reason + ")"));
    this.language = language;
    withContext("language", language);
  }

  public String getLanguage() {
    return language;
  }
}
