package com.gentoro.clm.nlp;

import java.util.Locale;
import java.util.Map;
import opennlp.tools.stemmer.Stemmer;
import opennlp.tools.stemmer.snowball.SnowballStemmer;

/**
 * Snowball stemmer bound to a language. OpenNLP stemmers keep per-call state, so each thread gets
 * its own instance.
 */
public final class LanguageStemmer implements Stemmer {
  private static final Map<String, SnowballStemmer.ALGORITHM> ALGORITHMS =
      Map.of(
          "en", SnowballStemmer.ALGORITHM.ENGLISH,
          "es", SnowballStemmer.ALGORITHM.SPANISH,
          "fr", SnowballStemmer.ALGORITHM.FRENCH,
          "pt", SnowballStemmer.ALGORITHM.PORTUGUESE,
          "de", SnowballStemmer.ALGORITHM.GERMAN,
          "it", SnowballStemmer.ALGORITHM.ITALIAN);

  private final String language;
  private final ThreadLocal<SnowballStemmer> delegate;

  public LanguageStemmer(String language) {
    this.language = language;
    SnowballStemmer.ALGORITHM algorithm =
        ALGORITHMS.getOrDefault(language, SnowballStemmer.ALGORITHM.PORTER);
    this.delegate = ThreadLocal.withInitial(() -> new SnowballStemmer(algorithm));
  }

  @Override
  public CharSequence stem(CharSequence word) {
    return stem(word == null ? null : word.toString());
  }

  public String stem(String word) {
    if (word == null || word.isEmpty()) {
      return "";
    }
    String lower = word.toLowerCase(Locale.ROOT);
    return delegate.get().stem(lower).toString();
  }

  public String language() {
    return language;
  }
}
