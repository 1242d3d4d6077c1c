package com.gentoro.clm.nlp;

import com.gentoro.clm.vocabulary.Vocabulary;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Model-free tagger. Closed-class words come from the vocabulary, known action verbs are tagged
 * VERB unless a determiner or preposition precedes them or a genitive preposition ("list of")
 * follows them, and everything else falls back to suffix rules.
 */
final class HeuristicPosTagger implements PosTagger {
  private static final List<String> NOUN_SUFFIXES =
      List.of("tion", "sion", "ment", "ness", "ity", "ance", "ence", "ship", "ism", "ist");
  private static final List<String> ADJ_SUFFIXES =
      List.of("ous", "ful", "ive", "able", "ible", "less", "ical", "al", "ic");

  private final Vocabulary vocabulary;
  private final Set<String> determiners;
  private final Set<String> pronouns;
  private final Set<String> prepositions;
  private final Set<String> conjunctions;
  private final Set<String> modals;
  private final Set<String> genitives;

  HeuristicPosTagger(Vocabulary vocabulary) {
    this.vocabulary = vocabulary;
    this.determiners = vocabulary.closedClass("DET");
    this.pronouns = vocabulary.closedClass("PRON");
    this.prepositions = vocabulary.closedClass("PREP");
    this.conjunctions = vocabulary.closedClass("CONJ");
    this.modals = vocabulary.closedClass("MODAL");
    this.genitives = vocabulary.closedClass("GENITIVE");
  }

  @Override
  public List<PartOfSpeech> tag(List<String> tokens, List<String> stems) {
    List<PartOfSpeech> out = new ArrayList<>(tokens.size());
    PartOfSpeech previous = null;
    for (int i = 0; i < tokens.size(); i++) {
      String word = tokens.get(i).toLowerCase(Locale.ROOT);
      String next = i + 1 < tokens.size() ? tokens.get(i + 1).toLowerCase(Locale.ROOT) : null;
      boolean clauseStart = i == 0 || previous == PartOfSpeech.PUNCT;
      PartOfSpeech pos = tagWord(word, stems.get(i), previous, next, clauseStart);
      out.add(pos);
      previous = pos;
    }
    return out;
  }

  private PartOfSpeech tagWord(
      String word, String stem, PartOfSpeech previous, String next, boolean clauseStart) {
    if (word.chars().noneMatch(Character::isLetterOrDigit)) return PartOfSpeech.PUNCT;
    if (word.chars().allMatch(c -> Character.isDigit(c) || c == '.' || c == ',')) return PartOfSpeech.NUM;
    if (determiners.contains(word)) return PartOfSpeech.DET;
    if (pronouns.contains(word)) return PartOfSpeech.PRON;
    if (prepositions.contains(word)) return PartOfSpeech.PREP;
    if (conjunctions.contains(word)) return PartOfSpeech.CONJ;
    if (modals.contains(word)) return PartOfSpeech.MODAL;

    boolean verbLike =
        vocabulary.lookupAction(word, stem).isPresent()
            || vocabulary.isNoiseVerb(word, stem)
            || vocabulary.imperative(word).isPresent();
    if (verbLike) {
      if (!clauseStart && next != null && genitives.contains(next)) {
        return PartOfSpeech.NOUN;
      }
      if (!clauseStart
          && (previous == PartOfSpeech.DET
              || previous == PartOfSpeech.ADJ
              || previous == PartOfSpeech.PREP
              || previous == PartOfSpeech.NUM)) {
        return PartOfSpeech.NOUN;
      }
      return PartOfSpeech.VERB;
    }
    if (word.endsWith("ly") && word.length() > 4) return PartOfSpeech.ADV;
    for (String suffix : NOUN_SUFFIXES) {
      if (word.endsWith(suffix) && word.length() > suffix.length() + 2) return PartOfSpeech.NOUN;
    }
    for (String suffix : ADJ_SUFFIXES) {
      if (word.endsWith(suffix) && word.length() > suffix.length() + 2) return PartOfSpeech.ADJ;
    }
    if ((word.endsWith("ing") || word.endsWith("ed")) && word.length() > 5) return PartOfSpeech.VERB;
    return PartOfSpeech.NOUN;
  }

  @Override
  public String name() {
    return "heuristic";
  }
}
