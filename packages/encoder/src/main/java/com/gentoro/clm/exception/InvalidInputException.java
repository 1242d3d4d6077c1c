package com.gentoro.clm.exception;

/** Input that cannot be routed to any encoder. */
public class InvalidInputException extends ClmException {
  public InvalidInputException(String message) {
    super(ClmErrorCode.INVALID_INPUT, message);
  }

  public InvalidInputException(String message, Throwable cause) {
    super(ClmErrorCode.INVALID_INPUT, message, cause);
  }
}
