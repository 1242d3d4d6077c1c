package com.gentoro.clm.quality;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Share of the text's noun phrases that surface in a target-side token. A phrase counts as covered
 * when the stem of any of its words appears inside one of the tokens.
 */
public final class TargetCoverageGate implements QualityGate {
  static final double DEFAULT_MIN_COVERAGE = 0.5;
  private static final int MIN_STEM_LENGTH = 3;

  private final double minCoverage;

  public TargetCoverageGate() {
    this(DEFAULT_MIN_COVERAGE);
  }

  public TargetCoverageGate(double minCoverage) {
    this.minCoverage = minCoverage;
  }

  @Override
  public String name() {
    return "TARGET_COVERAGE";
  }

  @Override
  public GateResult validate(GateInput input) {
    if (input.nounPhrases().isEmpty()) {
      return GateResult.pass(name(), 1.0, "No noun phrases to cover");
    }
    List<String> targets =
        input.targets().stream().map(t -> t.toLowerCase(Locale.ROOT)).toList();
    List<String> uncovered = new ArrayList<>();
    for (GateInput.NounPhrase phrase : input.nounPhrases()) {
      if (!covered(phrase, targets)) {
        uncovered.add(phrase.text());
      }
    }
    int total = input.nounPhrases().size();
    double ratio = (double) (total - uncovered.size()) / total;
    String summary = String.format(Locale.ROOT, "%.0f%% of noun phrases covered", ratio * 100);
    if (ratio < minCoverage) {
      return GateResult.degraded(name(), ratio, summary + ", missing " + uncovered, "LOW_COVERAGE");
    }
    return GateResult.pass(name(), ratio, summary);
  }

  private static boolean covered(GateInput.NounPhrase phrase, List<String> targets) {
    for (String stem : phrase.stems()) {
      String s = stem.toLowerCase(Locale.ROOT);
      if (s.length() < MIN_STEM_LENGTH) continue;
      for (String target : targets) {
        if (target.contains(s)) return true;
      }
    }
    return false;
  }
}
