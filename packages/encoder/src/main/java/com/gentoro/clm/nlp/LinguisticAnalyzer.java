package com.gentoro.clm.nlp;

/**
 * Adapter over the NLP toolkit. Implementations are immutable after construction and safe to use
 * from concurrent encode calls.
 */
public interface LinguisticAnalyzer {

  /** Split, tokenize, tag and stem the text, and extract named entities. */
  AnalyzedText analyze(String text);

  /** Stem a single lower-cased word with the analyzer's language stemmer. */
  String stem(String word);

  /** Language code this analyzer was built for. */
  String language();
}
