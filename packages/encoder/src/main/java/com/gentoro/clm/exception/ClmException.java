package com.gentoro.clm.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/** Base class of every error raised by the compression engine. */
public class ClmException extends RuntimeException {
  private final ClmErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public ClmException(ClmErrorCode code, String message) {
    super(message);
    this.code = code == null ? ClmErrorCode.UNKNOWN : code;
  }

  public ClmException(ClmErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code == null ? ClmErrorCode.UNKNOWN : code;
  }

  public ClmErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  /** Attach a diagnostic key/value and return this exception for chaining. */
  public ClmException withContext(String key, Object value) {
    if (key != null) {
      context.put(key, value);
    }
    return this;
  }
}
