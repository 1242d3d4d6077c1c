package com.gentoro.clm.resolve;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.rules.RuleCategory;
import java.util.List;
import org.junit.jupiter.api.Test;

class AttributeResolverTest {

  @Test
  void testOverlappingMatchesKeepEarlierRule() {
    RuleMatch range = new RuleMatch(RuleCategory.DURATION, "5-10m", 10, 25);
    RuleMatch tail = new RuleMatch(RuleCategory.DURATION, "10m", 12, 25);
    RuleMatch separate = new RuleMatch(RuleCategory.DURATION, "2h", 40, 47);

    assertEquals(
        List.of(range, separate), AttributeResolver.withoutOverlaps(List.of(range, tail, separate)));
  }

  @Test
  void testAdjacentMatchesBothKept() {
    RuleMatch first = new RuleMatch(RuleCategory.COMPARISON, "DIFFERENCES", 0, 10);
    RuleMatch second = new RuleMatch(RuleCategory.COMPARISON, "PROS_CONS", 10, 20);

    assertEquals(List.of(first, second), AttributeResolver.withoutOverlaps(List.of(first, second)));
  }
}
