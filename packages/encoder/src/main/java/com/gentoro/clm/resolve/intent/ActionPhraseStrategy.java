package com.gentoro.clm.resolve.intent;

import com.gentoro.clm.vocabulary.PhraseIndex;
import com.gentoro.clm.vocabulary.VocabularyCategory;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/** Multi-word action phrases ("compare against", "rank by") that single verbs miss. */
public final class ActionPhraseStrategy implements IntentStrategy {

  @Override
  public String name() {
    return "action-phrase";
  }

  @Override
  public double confidence() {
    return 0.8;
  }

  @Override
  public List<IntentCandidate> detect(IntentContext context) {
    String lower = context.text().lower();
    List<IntentCandidate> out = new ArrayList<>();
    for (VocabularyCategory category :
        List.of(VocabularyCategory.ACTION_PHRASE, VocabularyCategory.ACTION)) {
      for (PhraseIndex.PhraseMatch match :
          context.vocabulary().phrases(category).findAll(lower, context.clauses().spans())) {
        out.add(new IntentCandidate(match.token(), confidence(), name(), match.start(), null));
      }
    }
    out.sort(Comparator.comparingInt(IntentCandidate::position));
    return out;
  }
}
