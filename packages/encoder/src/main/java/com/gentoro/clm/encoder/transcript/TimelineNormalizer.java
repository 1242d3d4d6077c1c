package com.gentoro.clm.encoder.transcript;

import com.gentoro.clm.resolve.RuleEvaluator;
import com.gentoro.clm.resolve.RuleMatch;
import com.gentoro.clm.rules.PatternRuleSet;
import com.gentoro.clm.rules.RuleCategory;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns timeline phrases into {@code TODAY}, {@code TOMORROW}, {@code 24h}, {@code 3d} or
 * {@code 3-5d}. Rules may capture number words; they are replaced with digits here.
 */
final class TimelineNormalizer {
  private static final Pattern WORD = Pattern.compile("[A-Za-z]+");

  private final RuleEvaluator rules;
  private final PatternRuleSet ruleSet;

  TimelineNormalizer(RuleEvaluator rules, PatternRuleSet ruleSet) {
    this.rules = rules;
    this.ruleSet = ruleSet;
  }

  Optional<String> find(String text) {
    return rules.first(RuleCategory.TIMELINE, text).map(RuleMatch::value).map(this::digits);
  }

  String digits(String value) {
    Matcher m = WORD.matcher(value);
    StringBuilder sb = new StringBuilder();
    while (m.find()) {
      m.appendReplacement(sb, Matcher.quoteReplacement(replaceWord(m.group())));
    }
    m.appendTail(sb);
    return sb.toString();
  }

  private String replaceWord(String word) {
    Optional<Integer> number = ruleSet.number(word);
    if (number.isPresent()) {
      return number.get().toString();
    }
    char unit = Character.toLowerCase(word.charAt(word.length() - 1));
    if (word.length() > 1 && (unit == 'd' || unit == 'h')) {
      Optional<Integer> prefix = ruleSet.number(word.substring(0, word.length() - 1));
      if (prefix.isPresent()) {
        return prefix.get() + String.valueOf(unit);
      }
    }
    return word;
  }
}
