package com.gentoro.clm.resolve.intent;

import com.gentoro.clm.nlp.AnalyzedToken;
import com.gentoro.clm.nlp.Sentence;
import com.gentoro.clm.vocabulary.ImperativeTemplate;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Sentence-initial commands such as "List ...", "Give ...", "Suggest ...". Works on surface forms
 * only, so a wrong part-of-speech tag cannot hide a command.
 */
public final class ImperativePatternStrategy implements IntentStrategy {

  @Override
  public String name() {
    return "imperative";
  }

  @Override
  public double confidence() {
    return 1.0;
  }

  @Override
  public List<IntentCandidate> detect(IntentContext context) {
    Set<String> polite = context.vocabulary().closedClass("POLITE");
    List<IntentCandidate> out = new ArrayList<>();
    for (Sentence sentence : context.text().sentences()) {
      AnalyzedToken first = null;
      for (AnalyzedToken token : sentence.tokens()) {
        if (!token.isWord() || polite.contains(token.lower())) {
          continue;
        }
        first = token;
        break;
      }
      if (first == null || context.clauses().isExcluded(first.start())) {
        continue;
      }
      Optional<ImperativeTemplate> template = context.vocabulary().imperative(first.lower());
      if (template.isPresent()) {
        out.add(
            new IntentCandidate(
                template.get().action(),
                confidence(),
                name(),
                first.start(),
                template.get().target()));
      }
    }
    return out;
  }
}
