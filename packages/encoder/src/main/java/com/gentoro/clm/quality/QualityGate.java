package com.gentoro.clm.quality;

/** A check run over the tokens of one task-mode prompt encoding. */
public interface QualityGate {
  String name();

  GateResult validate(GateInput input);
}
