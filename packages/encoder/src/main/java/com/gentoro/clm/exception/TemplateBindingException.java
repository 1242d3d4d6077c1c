package com.gentoro.clm.exception;

/** Errors while binding runtime values into a compressed configuration prompt. */
public class TemplateBindingException extends ClmException {
  public TemplateBindingException(String message) {
    super(ClmErrorCode.TEMPLATE_ERROR, message);
  }

  public TemplateBindingException(String message, Throwable cause) {
    super(ClmErrorCode.TEMPLATE_ERROR, message, cause);
  }
}
