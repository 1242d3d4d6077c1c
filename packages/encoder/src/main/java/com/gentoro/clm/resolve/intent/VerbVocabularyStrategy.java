package com.gentoro.clm.resolve.intent;

import com.gentoro.clm.nlp.AnalyzedToken;
import com.gentoro.clm.nlp.PartOfSpeech;
import com.gentoro.clm.vocabulary.Vocabulary;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Verbs matched against the action synonyms by surface form and stem. Stem-only matches on target
 * nouns are ignored.
 */
public final class VerbVocabularyStrategy implements IntentStrategy {

  @Override
  public String name() {
    return "verb-vocabulary";
  }

  @Override
  public double confidence() {
    return 0.9;
  }

  @Override
  public List<IntentCandidate> detect(IntentContext context) {
    Vocabulary vocabulary = context.vocabulary();
    List<IntentCandidate> out = new ArrayList<>();
    for (AnalyzedToken token : context.text().tokens()) {
      if (token.pos() != PartOfSpeech.VERB || context.clauses().isExcluded(token.start())) {
        continue;
      }
      if (vocabulary.isNoiseVerb(token.lower(), token.stem())) {
        continue;
      }
      Optional<String> action = vocabulary.lookupAction(token.lower(), token.stem());
      action.ifPresent(a -> out.add(new IntentCandidate(a, confidence(), name(), token.start(), null)));
    }
    return out;
  }
}
