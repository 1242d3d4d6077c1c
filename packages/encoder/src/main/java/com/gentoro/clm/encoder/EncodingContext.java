package com.gentoro.clm.encoder;

import com.gentoro.clm.config.EncodingConfiguration;
import com.gentoro.clm.exception.PatternBudgetExceededException;
import com.gentoro.clm.language.LanguagePack;
import com.gentoro.clm.nlp.LinguisticAnalyzer;
import com.gentoro.clm.rules.BoundedPatternMatcher;
import com.gentoro.clm.rules.PatternRuleSet;
import com.gentoro.clm.vocabulary.Vocabulary;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of a single encode call. Holds the shared read-only configuration plus the diagnostics
 * gathered along the way. Never shared between calls.
 */
public final class EncodingContext {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(EncodingContext.class);

  private final EncodingConfiguration configuration;
  private final Map<String, Object> metadata;
  private final BoundedPatternMatcher matcher;
  private final List<String> diagnostics = new ArrayList<>();
  private final Set<String> degradedCategories = new LinkedHashSet<>();

  public EncodingContext(EncodingConfiguration configuration, Map<String, Object> metadata) {
    this.configuration = configuration;
    this.metadata =
        metadata == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    this.matcher = new BoundedPatternMatcher(configuration.patternBudget());
  }

  public EncodingConfiguration configuration() {
    return configuration;
  }

  public LanguagePack languagePack() {
    return configuration.languagePack();
  }

  public Vocabulary vocabulary() {
    return configuration.languagePack().vocabulary();
  }

  public PatternRuleSet rules() {
    return configuration.languagePack().rules();
  }

  public LinguisticAnalyzer analyzer() {
    return configuration.languagePack().analyzer();
  }

  public BoundedPatternMatcher matcher() {
    return matcher;
  }

  /** Caller supplied metadata of this call. */
  public Map<String, Object> metadata() {
    return metadata;
  }

  public String metadataString(String key) {
    Object value = metadata.get(key);
    return value == null || value.toString().isBlank() ? null : value.toString().trim();
  }

  public void diagnostic(String message) {
    if (!diagnostics.contains(message)) {
      diagnostics.add(message);
    }
  }

  public List<String> diagnostics() {
    return List.copyOf(diagnostics);
  }

  /** Record that a pattern rule hit its step budget; the result becomes partial. */
  public void markDegraded(String category, PatternBudgetExceededException cause) {
    if (degradedCategories.add(category)) {
      log.warn("Pattern budget exceeded in {} rules, result degraded: {}", category, cause.getMessage());
    }
  }

  public boolean isDegraded() {
    return !degradedCategories.isEmpty();
  }

  public Set<String> degradedCategories() {
    return Collections.unmodifiableSet(new LinkedHashSet<>(degradedCategories));
  }
}
