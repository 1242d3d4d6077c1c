package com.gentoro.clm.vocabulary;

import java.util.List;
import java.util.Objects;

/**
 * One canonical token and the surface phrases that map to it. Synonyms are stored lower-cased,
 * de-duplicated and in declaration order.
 */
public record VocabularyEntry(
    VocabularyCategory category, String canonicalToken, List<String> synonyms) {

  public VocabularyEntry {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(canonicalToken, "canonicalToken");
    synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
  }
}
