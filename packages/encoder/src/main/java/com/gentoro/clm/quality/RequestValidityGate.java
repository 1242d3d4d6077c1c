package com.gentoro.clm.quality;

import java.util.List;
import java.util.Set;

/** Every REQ action must be a canonical action of the language's vocabulary. */
public final class RequestValidityGate implements QualityGate {
  private final Set<String> validActions;

  public RequestValidityGate(Set<String> validActions) {
    this.validActions = Set.copyOf(validActions);
  }

  @Override
  public String name() {
    return "REQ_VALIDITY";
  }

  @Override
  public GateResult validate(GateInput input) {
    List<String> invalid =
        input.actions().stream().filter(a -> !validActions.contains(a)).toList();
    if (!invalid.isEmpty()) {
      return GateResult.fail(
          name(),
          "Unknown REQ actions " + invalid,
          invalid.stream().map(a -> "INVALID_REQ_" + a).toList());
    }
    return GateResult.pass(name(), 1.0, "All REQ actions valid");
  }
}
