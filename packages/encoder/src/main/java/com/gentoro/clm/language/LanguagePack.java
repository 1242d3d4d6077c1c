package com.gentoro.clm.language;

import com.gentoro.clm.nlp.LinguisticAnalyzer;
import com.gentoro.clm.rules.PatternRuleSet;
import com.gentoro.clm.vocabulary.Vocabulary;
import java.util.Objects;

/**
 * Everything that varies by natural language: the vocabulary table, the pattern rules and the
 * analyzer handle. Immutable and shared by every encode call of a configuration.
 */
public record LanguagePack(
    String code, Vocabulary vocabulary, PatternRuleSet rules, LinguisticAnalyzer analyzer) {

  public LanguagePack {
    Objects.requireNonNull(code, "code");
    Objects.requireNonNull(vocabulary, "vocabulary");
    Objects.requireNonNull(rules, "rules");
    Objects.requireNonNull(analyzer, "analyzer");
  }

  @Override
  public String toString() {
    return "LanguagePack{code=" + code + ", " + vocabulary + ", " + rules + '}';
  }
}
