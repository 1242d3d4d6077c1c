package com.gentoro.clm.exception;

/** A regular expression consumed more character reads than its step budget allows. */
public class PatternBudgetExceededException extends ClmException {
  public PatternBudgetExceededException(String pattern, long steps) {
    super(
        ClmErrorCode.PATTERN_BUDGET_EXCEEDED,
        "Pattern step budget of " + steps + " exceeded for: " + pattern);
    withContext("pattern", pattern);
    withContext("steps", steps);
  }
}
