package com.gentoro.clm.quality;

import java.util.List;

/**
 * A prompt that names things must produce a TARGET. Without nouns in the text a missing target may
 * be implicit, so that case only degrades.
 */
public final class TargetPresenceGate implements QualityGate {

  @Override
  public String name() {
    return "TARGET_PRESENCE";
  }

  @Override
  public GateResult validate(GateInput input) {
    if (!input.targets().isEmpty()) {
      return GateResult.pass(name(), 1.0, "Found " + input.targets().size() + " target token(s)");
    }
    if (!input.nounPhrases().isEmpty()) {
      return GateResult.fail(
          name(), "No TARGET despite noun phrases", List.of("MISSING_TARGET_WITH_NOUNS"));
    }
    return GateResult.degraded(name(), 0.3, "No TARGET and no nouns", "NO_TARGET_NO_NOUNS");
  }
}
