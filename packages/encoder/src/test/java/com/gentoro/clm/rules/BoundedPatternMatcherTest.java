package com.gentoro.clm.rules;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.exception.ClmErrorCode;
import com.gentoro.clm.exception.PatternBudgetExceededException;
import java.util.List;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import org.junit.jupiter.api.Test;

class BoundedPatternMatcherTest {

  @Test
  void testFindAll() {
    BoundedPatternMatcher matcher = new BoundedPatternMatcher(10_000);

    List<MatchResult> found =
        matcher.findAll(Pattern.compile("top (\\d+)"), "top 5 of the top 10");

    assertEquals(2, found.size());
    assertEquals("5", found.get(0).group(1));
    assertEquals("10", found.get(1).group(1));
  }

  @Test
  void testMatches() {
    BoundedPatternMatcher matcher = new BoundedPatternMatcher(10_000);

    assertTrue(matcher.matches(Pattern.compile("\\bjson\\b"), "return json please"));
    assertFalse(matcher.matches(Pattern.compile("\\bcsv\\b"), "return json please"));
  }

  @Test
  void testBudgetExceeded() {
    BoundedPatternMatcher matcher = new BoundedPatternMatcher(50);
    Pattern evil = Pattern.compile("(a+)+b");

    PatternBudgetExceededException ex =
        assertThrows(
            PatternBudgetExceededException.class,
            () -> matcher.findAll(evil, "a".repeat(200) + "c"));
    assertEquals(ClmErrorCode.PATTERN_BUDGET_EXCEEDED, ex.getCode());
  }

  @Test
  void testNonPositiveBudgetUsesDefault() {
    assertEquals(BoundedPatternMatcher.DEFAULT_MAX_STEPS, new BoundedPatternMatcher(0).maxSteps());
    assertEquals(123, new BoundedPatternMatcher(123).maxSteps());
  }
}
