package com.gentoro.clm.resolve.intent;

import com.gentoro.clm.nlp.AnalyzedToken;
import com.gentoro.clm.nlp.Sentence;
import com.gentoro.clm.vocabulary.VocabularyCategory;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Questions without an action verb: "What is X?" asks to extract, "Why ...?" to explain. */
public final class QuestionFallbackStrategy implements IntentStrategy {

  @Override
  public String name() {
    return "question";
  }

  @Override
  public double confidence() {
    return 0.85;
  }

  @Override
  public List<IntentCandidate> detect(IntentContext context) {
    List<IntentCandidate> out = new ArrayList<>();
    for (Sentence sentence : context.text().sentences()) {
      AnalyzedToken first = sentence.firstWord();
      if (first == null) {
        continue;
      }
      Optional<String> action =
          context.vocabulary().lookup(VocabularyCategory.QUESTION_WORD, first.lower(), null);
      if (action.isPresent() && sentence.isQuestion()) {
        out.add(new IntentCandidate(action.get(), confidence(), name(), first.start(), null));
      }
    }
    return out;
  }
}
