package com.gentoro.clm.exception;

/** Errors while loading or merging vocabulary and rule tables. */
public class VocabularyException extends ClmException {
  public VocabularyException(String message) {
    super(ClmErrorCode.VOCABULARY_ERROR, message);
  }

  public VocabularyException(String message, Throwable cause) {
    super(ClmErrorCode.VOCABULARY_ERROR, message, cause);
  }
}
