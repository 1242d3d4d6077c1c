package com.gentoro.clm.quality;

/** Outcome of a quality gate, ordered from best to worst. */
public enum GateStatus {
  PASS,
  DEGRADED,
  FAIL;

  public GateStatus worst(GateStatus other) {
    return other != null && other.ordinal() > ordinal() ? other : this;
  }
}
