package com.gentoro.clm.rules;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable per-language rule table. Languages may cover only some categories; asking for a
 * missing category returns an empty list.
 */
public final class PatternRuleSet {
  private static final PatternRuleSet EMPTY = new PatternRuleSet(null, Map.of(), Map.of());

  private final String language;
  private final Map<RuleCategory, List<PatternRule>> rules;
  private final Map<String, Integer> numberWords;

  public PatternRuleSet(
      String language, Map<RuleCategory, List<PatternRule>> rules, Map<String, Integer> numberWords) {
    this.language = language;
    Map<RuleCategory, List<PatternRule>> copy = new EnumMap<>(RuleCategory.class);
    rules.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    this.rules = Collections.unmodifiableMap(copy);
    this.numberWords = Map.copyOf(numberWords);
  }

  public static PatternRuleSet empty(String language) {
    return language == null ? EMPTY : new PatternRuleSet(language, Map.of(), Map.of());
  }

  public String language() {
    return language;
  }

  public List<PatternRule> rules(RuleCategory category) {
    return rules.getOrDefault(category, List.of());
  }

  /** Resolve a spelled-out number ("five") or digits to an integer. */
  public Optional<Integer> number(String word) {
    if (word == null || word.isBlank()) {
      return Optional.empty();
    }
    String w = word.trim().toLowerCase(Locale.ROOT);
    if (w.chars().allMatch(Character::isDigit)) {
      try {
        return Optional.of(Integer.parseInt(w));
      } catch (NumberFormatException e) {
        return Optional.empty();
      }
    }
    return Optional.ofNullable(numberWords.get(w));
  }

  public int size() {
    return rules.values().stream().mapToInt(List::size).sum();
  }

  @Override
  public String toString() {
    return "PatternRuleSet{language=" + language + ", categories=" + rules.size() + ", rules=" + size() + '}';
  }
}
