package com.gentoro.clm.resolve.intent;

import com.gentoro.clm.config.PromptOptions;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs the strategy ladder in priority order. By default the first strategy that proposes
 * anything wins; in union mode every strategy runs and a repeated action keeps its highest
 * confidence.
 */
public final class IntentResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(IntentResolver.class);

  private final List<IntentStrategy> strategies;

  public IntentResolver(List<IntentStrategy> strategies) {
    this.strategies = List.copyOf(strategies);
  }

  /** Imperative, verb vocabulary, action phrase, question fallback. */
  public static IntentResolver standard() {
    return new IntentResolver(
        List.of(
            new ImperativePatternStrategy(),
            new VerbVocabularyStrategy(),
            new ActionPhraseStrategy(),
            new QuestionFallbackStrategy()));
  }

  public List<IntentStrategy> strategies() {
    return strategies;
  }

  public IntentResolution resolve(IntentContext context, PromptOptions options) {
    Map<String, IntentCandidate> byAction = new LinkedHashMap<>();
    List<String> contributing = new ArrayList<>();
    for (IntentStrategy strategy : strategies) {
      List<IntentCandidate> found =
          strategy.detect(context).stream()
              .filter(c -> c.confidence() >= options.minIntentConfidence())
              .toList();
      if (found.isEmpty()) {
        continue;
      }
      contributing.add(strategy.name());
      for (IntentCandidate candidate : found) {
        byAction.merge(candidate.action(), candidate, IntentResolver::stronger);
      }
      log.debug("Strategy {} proposed {}", strategy.name(), found);
      if (!options.unionStrategies()) {
        break;
      }
    }
    if (byAction.isEmpty()) {
      return IntentResolution.empty();
    }
    List<IntentCandidate> ordered = new ArrayList<>(byAction.values());
    ordered.sort(Comparator.comparingInt(IntentCandidate::position));
    return new IntentResolution(pipelineOrder(ordered, context), contributing);
  }

  private static IntentCandidate stronger(IntentCandidate a, IntentCandidate b) {
    IntentCandidate winner = b.confidence() > a.confidence() ? b : a;
    int position = Math.min(a.position(), b.position());
    String target = a.defaultTarget() != null ? a.defaultTarget() : b.defaultTarget();
    return new IntentCandidate(
        winner.action(), winner.confidence(), winner.strategy(), position, target);
  }

  /**
   * Members of a known pipeline are moved into pipeline order within the slots they already
   * occupy; other actions keep their source position.
   */
  static List<IntentCandidate> pipelineOrder(List<IntentCandidate> ordered, IntentContext context) {
    List<IntentCandidate> result = new ArrayList<>(ordered);
    for (List<String> pipeline : context.vocabulary().pipelines()) {
      List<Integer> slots = new ArrayList<>();
      for (int i = 0; i < result.size(); i++) {
        if (pipeline.contains(result.get(i).action())) {
          slots.add(i);
        }
      }
      if (slots.size() < 2) {
        continue;
      }
      List<IntentCandidate> members = new ArrayList<>();
      for (int slot : slots) {
        members.add(result.get(slot));
      }
      members.sort(Comparator.comparingInt(c -> pipeline.indexOf(c.action())));
      for (int i = 0; i < slots.size(); i++) {
        result.set(slots.get(i), members.get(i));
      }
    }
    return result;
  }
}
