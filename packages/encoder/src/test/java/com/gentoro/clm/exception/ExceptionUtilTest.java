package com.gentoro.clm.exception;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Map;
import org.junit.jupiter.api.Test;

class ExceptionUtilTest {

  @Test
  void testToErrorDetails_clmException() {
    ClmException ex =
        new ClmException(ClmErrorCode.RULE_ERROR, "bad rule").withContext("category", "ORDERING");

    ErrorDetails details = ExceptionUtil.toErrorDetails(ex);

    assertEquals("ClmException", details.type());
    assertEquals("bad rule", details.message());
    assertEquals(ClmErrorCode.RULE_ERROR, details.code());
    assertEquals("ORDERING", details.context().get("category"));
    assertNotNull(details.timestamp());
  }

  @Test
  void testToErrorDetails_otherThrowable() {
    ErrorDetails details = ExceptionUtil.toErrorDetails(new IllegalStateException());

    assertEquals("IllegalStateException", details.type());
    assertEquals("", details.message());
    assertEquals(ClmErrorCode.UNKNOWN, details.code());
  }

  @Test
  void testToRecordError() {
    Map<String, Object> error =
        ExceptionUtil.toRecordError(new RecordValidationException(3, "id", "missing id"));

    assertEquals(3, error.get("index"));
    assertEquals("id", error.get("field"));
    assertEquals("RECORD_VALIDATION_ERROR", error.get("code"));
    assertEquals("missing id", error.get("message"));
    assertFalse(error.containsKey("timestamp"));
  }

  @Test
  void testExtractErrorMessage() {
    Exception wrapped = new RuntimeException(null, new VocabularyException("bad overlay"));

    assertEquals("VocabularyException: bad overlay", ExceptionUtil.extractErrorMessage(wrapped));
    assertEquals("Unknown error", ExceptionUtil.extractErrorMessage(null));
  }

  @Test
  void testFormatCompactStackTrace() {
    Exception ex = new Exception("x");

    String trace = ExceptionUtil.formatCompactStackTrace(ex, 1);

    String expected = ExceptionUtilTest.class.getName() + ".testFormatCompactStackTrace";
    assertTrue(trace.startsWith(expected), trace);
    assertFalse(trace.contains(" > "));
    assertEquals("", ExceptionUtil.formatCompactStackTrace(null, 3));
  }

  @Test
  void testLanguageNotSupportedMessage() {
    LanguageNotSupportedException ex = new LanguageNotSupportedException("pt", "no vocabulary");

    assertEquals("pt", ex.getLanguage());
    assertEquals("language not fully supported: pt (no vocabulary)", ex.getMessage());
    assertEquals(ClmErrorCode.LANGUAGE_NOT_SUPPORTED, ex.getCode());
  }
}
