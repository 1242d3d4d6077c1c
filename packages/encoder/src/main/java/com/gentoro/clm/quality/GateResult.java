package com.gentoro.clm.quality;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Verdict of one {@link QualityGate}.
 *
 * @param score 0.0 to 1.0
 * @param failures machine readable failure codes, empty on {@link GateStatus#PASS}
 */
public record GateResult(
    @JsonProperty("gate") String gate,
    @JsonProperty("status") GateStatus status,
    @JsonProperty("score") double score,
    @JsonProperty("message") String message,
    @JsonProperty("failures") List<String> failures) {

  public GateResult {
    failures = failures == null ? List.of() : List.copyOf(failures);
  }

  public static GateResult pass(String gate, double score, String message) {
    return new GateResult(gate, GateStatus.PASS, score, message, List.of());
  }

  public static GateResult degraded(String gate, double score, String message, String... failures) {
    return new GateResult(gate, GateStatus.DEGRADED, score, message, List.of(failures));
  }

  public static GateResult fail(String gate, String message, List<String> failures) {
    return new GateResult(gate, GateStatus.FAIL, 0.0, message, failures);
  }
}
