package com.gentoro.clm.resolve;

import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.exception.PatternBudgetExceededException;
import com.gentoro.clm.rules.PatternRule;
import com.gentoro.clm.rules.RuleCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.MatchResult;

/**
 * Runs the pattern rules of a category under the step budget of the call. A rule that exceeds the
 * budget ends evaluation of its category; matches found before that are kept and the call is
 * flagged as degraded.
 */
public final class RuleEvaluator {
  private final EncodingContext context;

  public RuleEvaluator(EncodingContext context) {
    this.context = context;
  }

  /** Every match of every rule of the category, rule order first, then text order. */
  public List<RuleMatch> all(RuleCategory category, String text) {
    List<RuleMatch> out = new ArrayList<>();
    for (PatternRule rule : context.rules().rules(category)) {
      try {
        for (MatchResult m : context.matcher().findAll(rule.pattern(), text)) {
          String value = rule.render(m);
          if (!value.isBlank()) {
            out.add(new RuleMatch(category, value, m.start(), m.end()));
          }
        }
      } catch (PatternBudgetExceededException e) {
        context.markDegraded(category.name(), e);
        break;
      }
    }
    return out;
  }

  /** First rule, in declaration order, that matches anywhere in the text. */
  public Optional<RuleMatch> first(RuleCategory category, String text) {
    for (PatternRule rule : context.rules().rules(category)) {
      try {
        List<MatchResult> matches = context.matcher().findAll(rule.pattern(), text);
        for (MatchResult m : matches) {
          String value = rule.render(m);
          if (!value.isBlank()) {
            return Optional.of(new RuleMatch(category, value, m.start(), m.end()));
          }
        }
      } catch (PatternBudgetExceededException e) {
        context.markDegraded(category.name(), e);
        return Optional.empty();
      }
    }
    return Optional.empty();
  }

  public boolean matches(RuleCategory category, String text) {
    for (PatternRule rule : context.rules().rules(category)) {
      try {
        if (context.matcher().matches(rule.pattern(), text)) {
          return true;
        }
      } catch (PatternBudgetExceededException e) {
        context.markDegraded(category.name(), e);
        return false;
      }
    }
    return false;
  }
}
