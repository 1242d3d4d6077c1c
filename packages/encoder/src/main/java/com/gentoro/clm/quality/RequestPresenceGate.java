package com.gentoro.clm.quality;

import java.util.List;

/** The prompt must yield at least one REQ action, and not an implausibly long chain. */
public final class RequestPresenceGate implements QualityGate {
  static final int MAX_ACTIONS = 3;

  @Override
  public String name() {
    return "REQ_PRESENCE";
  }

  @Override
  public GateResult validate(GateInput input) {
    int count = input.actions().size();
    if (count == 0) {
      return GateResult.fail(name(), "No REQ action found", List.of("NO_REQ_TOKEN"));
    }
    if (count > MAX_ACTIONS) {
      return GateResult.degraded(
          name(), 0.7, "Unusually long REQ chain: " + count, "EXCESSIVE_REQ_COUNT");
    }
    return GateResult.pass(name(), 1.0, "Found " + count + " REQ action(s)");
  }
}
