package com.gentoro.clm.rules;

import com.gentoro.clm.exception.PatternBudgetExceededException;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Runs regular expressions under a step budget. The subject text is wrapped in a character
 * sequence that counts every character read by the regex engine; once a single pattern execution
 * reads more than {@code maxSteps} characters a {@link PatternBudgetExceededException} is thrown.
 * Catastrophic backtracking thus ends in bounded time instead of hanging the caller.
 */
public final class BoundedPatternMatcher {
  public static final long DEFAULT_MAX_STEPS = 2_000_000L;

  private final long maxSteps;

  public BoundedPatternMatcher(long maxSteps) {
    this.maxSteps = maxSteps <= 0 ? DEFAULT_MAX_STEPS : maxSteps;
  }

  public long maxSteps() {
    return maxSteps;
  }

  /** All matches of the pattern, in order. */
  public List<MatchResult> findAll(Pattern pattern, String text) {
    List<MatchResult> out = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return out;
    }
    Matcher matcher = pattern.matcher(new CountingSequence(text, new long[1], maxSteps, pattern));
    while (matcher.find()) {
      out.add(matcher.toMatchResult());
    }
    return out;
  }

  public boolean matches(Pattern pattern, String text) {
    if (text == null || text.isEmpty()) {
      return false;
    }
    return pattern.matcher(new CountingSequence(text, new long[1], maxSteps, pattern)).find();
  }

  private static final class CountingSequence implements CharSequence {
    private final String text;
    private final long[] steps;
    private final long budget;
    private final Pattern pattern;
    private final int offset;
    private final int length;

    CountingSequence(String text, long[] steps, long budget, Pattern pattern) {
      this(text, steps, budget, pattern, 0, text.length());
    }

    private CountingSequence(
        String text, long[] steps, long budget, Pattern pattern, int offset, int length) {
      this.text = text;
      this.steps = steps;
      this.budget = budget;
      this.pattern = pattern;
      this.offset = offset;
      this.length = length;
    }

    @Override
    public int length() {
      return length;
    }

    @Override
    public char charAt(int index) {
      if (++steps[0] > budget) {
        throw new PatternBudgetExceededException(pattern.pattern(), budget);
      }
      return text.charAt(offset + index);
    }

    @Override
    public CharSequence subSequence(int start, int end) {
      return new CountingSequence(text, steps, budget, pattern, offset + start, end - start);
    }

    @Override
    public String toString() {
      return text.substring(offset, offset + length);
    }
  }
}
