package com.gentoro.clm.language;

import com.gentoro.clm.exception.LanguageNotSupportedException;
import com.gentoro.clm.nlp.LanguageStemmer;
import com.gentoro.clm.nlp.OpenNlpAnalyzer;
import com.gentoro.clm.rules.PatternRuleLoader;
import com.gentoro.clm.rules.PatternRuleSet;
import com.gentoro.clm.vocabulary.Vocabulary;
import com.gentoro.clm.vocabulary.VocabularyCategory;
import com.gentoro.clm.vocabulary.VocabularyLoader;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-wide lookup from language code to {@link LanguagePack}. Packs are built on first use
 * and kept for the life of the process.
 */
public final class LanguageRegistry {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(LanguageRegistry.class);

  private record Key(String code, String overlay, String posModel) {}

  private static final Map<Key, LanguagePack> PACKS = new ConcurrentHashMap<>();

  private LanguageRegistry() {}

  /**
   * Resolve the pack for a language.
   *
   * @param code ISO 639-1 language code
   * @param overlay optional vocabulary overlay location, {@code classpath:} or a file path
   * @param posModel optional OpenNLP POS model file
   * @throws LanguageNotSupportedException when the language lacks a usable vocabulary
   */
  public static LanguagePack resolve(String code, String overlay, Path posModel) {
    String normalized = normalize(code);
    Key key = new Key(normalized, blankToNull(overlay), posModel == null ? null : posModel.toString());
    return PACKS.computeIfAbsent(key, k -> build(normalized, k.overlay(), posModel));
  }

  public static LanguagePack resolve(String code) {
    return resolve(code, null, null);
  }

  /** Whether the language ships a complete enough resource pack. */
  public static boolean isSupported(String code) {
    try {
      resolve(code);
      return true;
    } catch (LanguageNotSupportedException e) {
      log.debug("Language '{}' not supported: {}", code, e.getMessage());
      return false;
    }
  }

  private static LanguagePack build(String code, String overlay, Path posModel) {
    LanguageStemmer stemmer = new LanguageStemmer(code);
    Optional<Vocabulary> vocabulary = VocabularyLoader.load(code, overlay, stemmer);
    Optional<PatternRuleSet> rules = PatternRuleLoader.load(code);
    if (vocabulary.isEmpty()) {
      throw new LanguageNotSupportedException(
          code, rules.isPresent() ? "rules present but no vocabulary" : "no resources");
    }
    Vocabulary table = vocabulary.get();
    if (!table.hasEntries(VocabularyCategory.ACTION) || !table.hasEntries(VocabularyCategory.TARGET)) {
      throw new LanguageNotSupportedException(code, "vocabulary lacks actions or targets");
    }
    PatternRuleSet ruleSet = rules.orElseGet(() -> PatternRuleSet.empty(code));
    LanguagePack pack =
        new LanguagePack(code, table, ruleSet, new OpenNlpAnalyzer(table, stemmer, posModel));
    log.info("Language pack ready: {}", pack);
    return pack;
  }

  private static String normalize(String code) {
    if (code == null || code.isBlank()) {
      return "en";
    }
    String c = code.trim().toLowerCase(Locale.ROOT);
    int sep = c.indexOf('-') >= 0 ? c.indexOf('-') : c.indexOf('_');
    return sep > 0 ? c.substring(0, sep) : c;
  }

  private static String blankToNull(String value) {
    return value == null || value.isBlank() ? null : value.trim();
  }
}
