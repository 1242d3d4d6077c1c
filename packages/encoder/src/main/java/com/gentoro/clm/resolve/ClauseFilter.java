package com.gentoro.clm.resolve;

import com.gentoro.clm.rules.RuleCategory;
import java.util.BitSet;

/**
 * Character spans of role clauses ("you are a ...") and conditional clauses ("if no ... matches").
 * Verbs inside them describe the role or a condition, not the requested operation.
 */
public final class ClauseFilter {
  private final BitSet excluded = new BitSet();

  public ClauseFilter(RuleEvaluator evaluator, String text) {
    for (RuleMatch m : evaluator.all(RuleCategory.ROLE_CLAUSE, text)) {
      excluded.set(m.start(), m.end());
    }
    for (RuleMatch m : evaluator.all(RuleCategory.CONDITIONAL_CLAUSE, text)) {
      excluded.set(m.start(), m.end());
    }
  }

  public boolean isExcluded(int offset) {
    return excluded.get(offset);
  }

  public BitSet spans() {
    return (BitSet) excluded.clone();
  }
}
