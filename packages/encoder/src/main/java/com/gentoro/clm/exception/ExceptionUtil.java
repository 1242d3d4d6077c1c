package com.gentoro.clm.exception;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Utility helpers for dealing with exceptions and structured error details. */
public final class ExceptionUtil {
  private ExceptionUtil() {}

  /**
   * Convert any {@link Throwable} into {@link ErrorDetails} for logging or result metadata. If the
   * throwable is a {@link ClmException}, its code and context are preserved.
   */
  public static ErrorDetails toErrorDetails(Throwable t) {
    if (t instanceof ClmException ex) {
      return new ErrorDetails(
          ex.getClass().getSimpleName(),
          safeMessage(ex.getMessage()),
          ex.getCode(),
          ex.getContext(),
          Instant.now());
    }
    return new ErrorDetails(
        t.getClass().getSimpleName(), safeMessage(t.getMessage()), ClmErrorCode.UNKNOWN, null, Instant.now());
  }

  /**
   * Flatten a record-level failure into the map shape stored under {@code record_errors}. The
   * timestamp is left out so that repeated encodings stay byte-identical.
   */
  public static Map<String, Object> toRecordError(RecordValidationException ex) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("index", ex.getRecordIndex());
    out.put("field", ex.getField());
    out.put("code", ex.getCode().name());
    out.put("message", safeMessage(ex.getMessage()));
    return out;
  }

  /**
   * Produce a compact, single-line representation of a throwable's stack trace, e.g. {@code
   * com.example.Foo.bar (Foo.java:42) > com.example.App.main (App.java:10)}.
   *
   * @param t the throwable whose stack should be summarized (null returns empty string)
   * @param maxFrames maximum number of top stack frames to include; if <= 0, includes all frames
   */
  public static String formatCompactStackTrace(Throwable t, int maxFrames) {
    if (t == null) return "";
    StackTraceElement[] elements = t.getStackTrace();
    if (elements == null || elements.length == 0) return "";

    int limit = maxFrames <= 0 ? elements.length : Math.min(elements.length, maxFrames);
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < limit; i++) {
      StackTraceElement e = elements[i];
      sb.append(e.getClassName())
          .append('.')
          .append(e.getMethodName())
          .append(" (")
          .append(e.getFileName() == null ? "Unknown Source" : e.getFileName());
      if (e.getLineNumber() >= 0) {
        sb.append(':').append(e.getLineNumber());
      }
      sb.append(')');
      if (i < limit - 1) sb.append(" > ");
    }
    return sb.toString();
  }

  /**
   * Walk the cause chain and return the first message that is not blank, prefixed with the
   * simple class name of the throwable that carried it.
   */
  public static String extractErrorMessage(Throwable t) {
    if (t == null) {
      return "Unknown error";
    }
    Throwable current = t;
    while (current != null) {
      String message = current.getMessage();
      if (message != null && !message.isBlank()) {
        return current.getClass().getSimpleName() + ": " + message.trim();
      }
      current = current.getCause();
    }
    return t.getClass().getSimpleName();
  }

  private static String safeMessage(String message) {
    return message == null ? "" : message;
  }
}
