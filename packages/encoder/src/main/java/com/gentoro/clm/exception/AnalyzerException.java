package com.gentoro.clm.exception;

/** Errors while initializing the linguistic analyzer. */
public class AnalyzerException extends ClmException {
  public AnalyzerException(String message) {
    super(ClmErrorCode.ANALYZER_ERROR, message);
  }

  public AnalyzerException(String message, Throwable cause) {
    super(ClmErrorCode.ANALYZER_ERROR, message, cause);
  }
}
