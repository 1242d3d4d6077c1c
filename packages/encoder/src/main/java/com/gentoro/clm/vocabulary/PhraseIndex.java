package com.gentoro.clm.vocabulary;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Longest-first phrase lookup over lower-cased text. Matches respect word boundaries, tolerate a
 * plural or past-tense suffix and never overlap each other or a masked span.
 */
public final class PhraseIndex {

  /** A phrase occurrence in the scanned text, with {@code end} exclusive. */
  public record PhraseMatch(String token, String phrase, int start, int end) {}

  private record Phrase(String text, String token, int order) {}

  private static final List<String> SUFFIXES = List.of("s", "es", "d", "ed");

  private static final PhraseIndex EMPTY = new PhraseIndex(List.of());

  private final List<Phrase> phrases;

  private PhraseIndex(List<Phrase> phrases) {
    this.phrases = phrases;
  }

  public static PhraseIndex empty() {
    return EMPTY;
  }

  /**
   * Build an index from a token to synonyms map.
   *
   * @param multiWordOnly keep only phrases that contain a space
   */
  public static PhraseIndex of(Map<String, List<String>> tokens, boolean multiWordOnly) {
    if (tokens == null || tokens.isEmpty()) {
      return EMPTY;
    }
    List<Phrase> list = new ArrayList<>();
    int order = 0;
    for (Map.Entry<String, List<String>> e : tokens.entrySet()) {
      if (e.getValue() == null) continue;
      String token = e.getKey().trim().toUpperCase(Locale.ROOT);
      for (String synonym : e.getValue()) {
        if (synonym == null || synonym.isBlank()) continue;
        String normalized = normalize(synonym);
        if (multiWordOnly && normalized.indexOf(' ') < 0) continue;
        list.add(new Phrase(normalized, token, order++));
      }
    }
    list.sort(
        Comparator.comparingInt((Phrase p) -> p.text().length())
            .reversed()
            .thenComparingInt(Phrase::order));
    return new PhraseIndex(List.copyOf(list));
  }

  public boolean isEmpty() {
    return phrases.isEmpty();
  }

  public List<PhraseMatch> findAll(String lowerText) {
    return findAll(lowerText, new BitSet());
  }

  /**
   * Find every non-overlapping occurrence. Longer phrases claim their span first.
   *
   * @param lowerText text already lower-cased with {@link Locale#ROOT}
   * @param masked character positions that may not take part in a match; not modified
   * @return matches sorted by start offset
   */
  public List<PhraseMatch> findAll(String lowerText, BitSet masked) {
    if (lowerText == null || lowerText.isEmpty() || phrases.isEmpty()) {
      return List.of();
    }
    BitSet claimed = (BitSet) masked.clone();
    List<PhraseMatch> out = new ArrayList<>();
    for (Phrase phrase : phrases) {
      int from = 0;
      while (from <= lowerText.length() - phrase.text().length()) {
        int idx = lowerText.indexOf(phrase.text(), from);
        if (idx < 0) break;
        int end = idx + phrase.text().length();
        int extended = inflectedEnd(lowerText, end);
        if (isBoundary(lowerText, idx - 1)
            && isBoundary(lowerText, extended)
            && claimed.get(idx, extended).isEmpty()) {
          claimed.set(idx, extended);
          out.add(new PhraseMatch(phrase.token(), phrase.text(), idx, extended));
        }
        from = idx + 1;
      }
    }
    out.sort(Comparator.comparingInt(PhraseMatch::start));
    return List.copyOf(out);
  }

  /** First token found in the text, by position; null if nothing matches. */
  public String first(String lowerText) {
    List<PhraseMatch> matches = findAll(lowerText);
    return matches.isEmpty() ? null : matches.get(0).token();
  }

  public boolean containsAny(String lowerText) {
    return !findAll(lowerText).isEmpty();
  }

  private static int inflectedEnd(String text, int end) {
    for (String suffix : SUFFIXES) {
      if (text.startsWith(suffix, end) && isBoundary(text, end + suffix.length())) {
        return end + suffix.length();
      }
    }
    return end;
  }

  private static boolean isBoundary(String text, int pos) {
    if (pos < 0 || pos >= text.length()) return true;
    return !Character.isLetterOrDigit(text.charAt(pos));
  }

  static String normalize(String phrase) {
    return phrase.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
  }

  @Override
  public String toString() {
    return "PhraseIndex{phrases=" + phrases.size() + '}';
  }
}
