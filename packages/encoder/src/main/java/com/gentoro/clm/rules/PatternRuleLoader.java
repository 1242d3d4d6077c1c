package com.gentoro.clm.rules;

import com.gentoro.clm.exception.ClmErrorCode;
import com.gentoro.clm.exception.ClmException;
import com.gentoro.clm.exception.VocabularyException;
import com.gentoro.clm.utility.JacksonUtility;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/** Loads {@code rules/<lang>.yaml} into a {@link PatternRuleSet}. */
public final class PatternRuleLoader {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(PatternRuleLoader.class);

  private PatternRuleLoader() {}

  /** Returns empty when the language ships no rules resource. */
  public static Optional<PatternRuleSet> load(String language) {
    String resource = "rules/" + language + ".yaml";
    PatternRuleDocument document;
    try (InputStream in = PatternRuleLoader.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        return Optional.empty();
      }
      document = JacksonUtility.getYamlMapper().readValue(in, PatternRuleDocument.class);
    } catch (IOException e) {
      throw new VocabularyException("Failed to read rules resource: " + resource, e);
    }
    PatternRuleSet set = compile(language, document);
    log.debug("Loaded {}", set);
    return Optional.of(set);
  }

  static PatternRuleSet compile(String language, PatternRuleDocument document) {
    Map<RuleCategory, List<PatternRule>> rules = new EnumMap<>(RuleCategory.class);
    if (document.getRules() != null) {
      for (Map.Entry<String, List<PatternRuleDocument.RuleSpec>> e : document.getRules().entrySet()) {
        RuleCategory category = category(e.getKey(), language);
        List<PatternRule> compiled = new ArrayList<>();
        for (PatternRuleDocument.RuleSpec spec : e.getValue()) {
          compiled.add(compile(category, spec, language));
        }
        rules.put(category, compiled);
      }
    }
    return new PatternRuleSet(
        language, rules, document.getNumbers() == null ? Map.of() : document.getNumbers());
  }

  private static RuleCategory category(String name, String language) {
    try {
      return RuleCategory.valueOf(name.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new ClmException(
          ClmErrorCode.RULE_ERROR,
          "Unknown rule category '" + name + "' in rules/" + language + ".yaml",
          e);
    }
  }

  private static PatternRule compile(
      RuleCategory category, PatternRuleDocument.RuleSpec spec, String language) {
    int flags = spec.caseSensitive() ? 0 : Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE;
    try {
      return new PatternRule(category, Pattern.compile(spec.pattern(), flags), spec.value());
    } catch (PatternSyntaxException | NullPointerException e) {
      throw new ClmException(
          ClmErrorCode.RULE_ERROR,
          "Invalid " + category + " pattern in rules/" + language + ".yaml: " + spec.pattern(), e);
    }
  }
}
