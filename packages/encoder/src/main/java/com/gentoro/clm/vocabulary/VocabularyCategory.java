package com.gentoro.clm.vocabulary;

/** Categories of the per-language vocabulary. */
public enum VocabularyCategory {
  ACTION,
  ACTION_PHRASE,
  ACTION_MODIFIER,
  TARGET,
  COMPOUND_PHRASE,
  EXTRACTION_FIELD,
  OUTPUT_FORMAT,
  DOMAIN_KEYWORD,
  QUESTION_WORD,
  STOP_WORD,
  NOISE_VERB,
  ROLE_FILLER
}
