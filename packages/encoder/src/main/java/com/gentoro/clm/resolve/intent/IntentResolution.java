package com.gentoro.clm.resolve.intent;

import java.util.List;

/**
 * Ordered, de-duplicated actions with their confidences.
 *
 * @param candidates actions in pipeline order, then source order
 * @param strategies names of the strategies that contributed
 */
public record IntentResolution(List<IntentCandidate> candidates, List<String> strategies) {

  public IntentResolution {
    candidates = List.copyOf(candidates);
    strategies = List.copyOf(strategies);
  }

  public static IntentResolution empty() {
    return new IntentResolution(List.of(), List.of());
  }

  public boolean isEmpty() {
    return candidates.isEmpty();
  }

  public List<String> actions() {
    return candidates.stream().map(IntentCandidate::action).toList();
  }

  /** Target implied by the first imperative candidate, or null. */
  public String defaultTarget() {
    return candidates.stream()
        .map(IntentCandidate::defaultTarget)
        .filter(t -> t != null && !t.isBlank())
        .findFirst()
        .orElse(null);
  }
}
