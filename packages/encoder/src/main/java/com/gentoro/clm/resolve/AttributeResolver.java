package com.gentoro.clm.resolve;

import com.gentoro.clm.nlp.AnalyzedText;
import com.gentoro.clm.nlp.AnalyzedToken;
import com.gentoro.clm.rules.PatternRuleSet;
import com.gentoro.clm.rules.RuleCategory;
import com.gentoro.clm.vocabulary.PhraseIndex;
import com.gentoro.clm.vocabulary.Vocabulary;
import com.gentoro.clm.vocabulary.VocabularyCategory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Applies the attribute rule categories. New synonyms only need new rule entries: every category
 * with a context key becomes a CTX attribute, and ordering templates carry their own key.
 */
public final class AttributeResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(AttributeResolver.class);

  private final Vocabulary vocabulary;
  private final PatternRuleSet ruleSet;
  private final RuleEvaluator rules;

  public AttributeResolver(Vocabulary vocabulary, PatternRuleSet ruleSet, RuleEvaluator rules) {
    this.vocabulary = vocabulary;
    this.ruleSet = ruleSet;
    this.rules = rules;
  }

  public AttributeResolution resolve(AnalyzedText text) {
    Map<String, String> action = new LinkedHashMap<>();
    List<RuleMatch> ordering = new ArrayList<>(rules.all(RuleCategory.ORDERING, text.text()));
    ordering.sort(Comparator.comparingInt(RuleMatch::start));
    for (RuleMatch m : ordering) {
      int eq = m.value().indexOf('=');
      if (eq <= 0) continue;
      String key = m.value().substring(0, eq);
      String value = m.value().substring(eq + 1);
      if ("LIMIT".equals(key)) {
        Optional<Integer> n = ruleSet.number(value);
        if (n.isEmpty()) continue;
        value = String.valueOf(n.get());
      }
      if (!value.isBlank()) {
        action.putIfAbsent(key, value);
      }
    }
    modifier(text).ifPresent(mode -> action.putIfAbsent("MODE", mode));

    Map<String, List<String>> context = new LinkedHashMap<>();
    for (RuleCategory category : RuleCategory.values()) {
      if (category.contextKey() == null) continue;
      List<RuleMatch> matches = withoutOverlaps(rules.all(category, text.text()));
      if (matches.isEmpty()) continue;
      matches.sort(Comparator.comparingInt(RuleMatch::start));
      Set<String> values = new LinkedHashSet<>();
      matches.forEach(m -> values.add(m.value()));
      context.put(category.contextKey(), new ArrayList<>(values));
    }
    AttributeResolution resolution = new AttributeResolution(action, context);
    log.debug("Resolved attributes {}", resolution);
    return resolution;
  }

  /** Keeps matches in rule order, dropping any that overlap a span already kept. */
  static List<RuleMatch> withoutOverlaps(List<RuleMatch> matches) {
    List<RuleMatch> kept = new ArrayList<>();
    for (RuleMatch m : matches) {
      boolean overlaps = kept.stream().anyMatch(k -> m.start() < k.end() && k.start() < m.end());
      if (!overlaps) kept.add(m);
    }
    return kept;
  }

  private Optional<String> modifier(AnalyzedText text) {
    PhraseIndex phrases = vocabulary.phrases(VocabularyCategory.ACTION_MODIFIER);
    List<PhraseIndex.PhraseMatch> found = phrases.findAll(text.lower());
    int phrasePosition = found.isEmpty() ? Integer.MAX_VALUE : found.get(0).start();
    for (AnalyzedToken token : text.tokens()) {
      if (token.start() > phrasePosition) break;
      Optional<String> mode =
          vocabulary.lookup(VocabularyCategory.ACTION_MODIFIER, token.lower(), token.stem());
      if (mode.isPresent()) return mode;
    }
    return found.isEmpty() ? Optional.empty() : Optional.of(found.get(0).token());
  }
}
