package com.gentoro.clm.exception;

import java.time.Instant;
import java.util.Map;

/** Serializable summary of a failure, used in CLI output and result metadata. */
public record ErrorDetails(
    String type, String message, ClmErrorCode code, Map<String, Object> context, Instant timestamp) {}
