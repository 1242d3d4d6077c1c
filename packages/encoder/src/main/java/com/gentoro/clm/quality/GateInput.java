package com.gentoro.clm.quality;

import com.gentoro.clm.nlp.AnalyzedText;
import com.gentoro.clm.nlp.AnalyzedToken;
import com.gentoro.clm.nlp.PartOfSpeech;
import java.util.ArrayList;
import java.util.List;

/**
 * What the gates look at.
 *
 * @param actions REQ actions in chain order
 * @param targets rendered TARGET, REF and EXTRACT tokens
 * @param nounPhrases runs of nouns in the source text, with their leading adjectives
 */
public record GateInput(
    String text, List<String> actions, List<String> targets, List<NounPhrase> nounPhrases) {

  public GateInput {
    actions = List.copyOf(actions);
    targets = List.copyOf(targets);
    nounPhrases = List.copyOf(nounPhrases);
  }

  public record NounPhrase(String text, List<String> stems) {}

  public static GateInput of(AnalyzedText analyzed, List<String> actions, List<String> targets) {
    return new GateInput(analyzed.text(), actions, targets, nounPhrases(analyzed));
  }

  static List<NounPhrase> nounPhrases(AnalyzedText analyzed) {
    List<NounPhrase> phrases = new ArrayList<>();
    List<AnalyzedToken> run = new ArrayList<>();
    AnalyzedToken previous = null;
    for (AnalyzedToken token : analyzed.tokens()) {
      boolean joins =
          previous != null
              && previous.sentenceIndex() == token.sentenceIndex()
              && previous.indexInSentence() + 1 == token.indexInSentence();
      if (!joins) {
        close(analyzed, run, phrases);
      }
      if (token.pos() == PartOfSpeech.NOUN || token.pos() == PartOfSpeech.ADJ) {
        run.add(token);
      } else {
        close(analyzed, run, phrases);
      }
      previous = token;
    }
    close(analyzed, run, phrases);
    return phrases;
  }

  private static void close(AnalyzedText analyzed, List<AnalyzedToken> run, List<NounPhrase> out) {
    // trailing adjectives do not make a noun phrase
    while (!run.isEmpty() && run.get(run.size() - 1).pos() != PartOfSpeech.NOUN) {
      run.remove(run.size() - 1);
    }
    if (!run.isEmpty()) {
      String text = analyzed.text().substring(run.get(0).start(), run.get(run.size() - 1).end());
      out.add(new NounPhrase(text, run.stream().map(t -> t.stem() != null ? t.stem() : t.lower()).toList()));
    }
    run.clear();
  }
}
