package com.gentoro.clm.resolve.intent;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

import com.gentoro.clm.config.PromptOptions;
import com.gentoro.clm.language.LanguageRegistry;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class IntentResolverTest {

  private IntentContext context;

  @BeforeEach
  void setUp() {
    context = new IntentContext(null, LanguageRegistry.resolve("en").vocabulary(), null);
  }

  private static IntentStrategy strategy(String name, IntentCandidate... candidates) {
    IntentStrategy strategy = mock(IntentStrategy.class);
    when(strategy.name()).thenReturn(name);
    when(strategy.detect(any())).thenReturn(List.of(candidates));
    return strategy;
  }

  private static IntentCandidate candidate(String action, double confidence, int position) {
    return new IntentCandidate(action, confidence, "test", position, null);
  }

  @Test
  void testFirstMatchingStrategyWins() {
    IntentStrategy first = strategy("first", candidate("LIST", 1.0, 0));
    IntentStrategy second = strategy("second", candidate("RANK", 0.9, 5));

    IntentResolution resolution =
        new IntentResolver(List.of(first, second)).resolve(context, PromptOptions.defaults());

    assertEquals(List.of("LIST"), resolution.actions());
    assertEquals(List.of("first"), resolution.strategies());
    verify(second, never()).detect(any());
  }

  @Test
  void testEmptyStrategyFallsThrough() {
    IntentStrategy empty = strategy("empty");
    IntentStrategy question = strategy("question", candidate("EXPLAIN", 0.85, 0));

    IntentResolution resolution =
        new IntentResolver(List.of(empty, question)).resolve(context, PromptOptions.defaults());

    assertEquals(List.of("EXPLAIN"), resolution.actions());
    assertEquals(List.of("question"), resolution.strategies());
  }

  @Test
  void testUnionKeepsStrongestCandidate() {
    IntentStrategy first = strategy("first", candidate("COMPARE", 0.8, 12));
    IntentStrategy second =
        strategy("second", candidate("LIST", 0.9, 0), candidate("COMPARE", 0.9, 20));

    IntentResolution resolution =
        new IntentResolver(List.of(first, second))
            .resolve(context, PromptOptions.defaults().withUnionStrategies(true));

    assertEquals(List.of("LIST", "COMPARE"), resolution.actions());
    assertEquals(List.of("first", "second"), resolution.strategies());
    IntentCandidate compare = resolution.candidates().get(1);
    assertEquals(0.9, compare.confidence());
    assertEquals(12, compare.position());
  }

  @Test
  void testMinimumConfidence() {
    IntentStrategy weak = strategy("weak", candidate("GENERATE", 0.5, 0));
    IntentStrategy strong = strategy("strong", candidate("SUMMARIZE", 0.9, 0));

    IntentResolution resolution =
        new IntentResolver(List.of(weak, strong))
            .resolve(context, PromptOptions.defaults().withMinIntentConfidence(0.8));

    assertEquals(List.of("SUMMARIZE"), resolution.actions());
  }

  @Test
  void testNothingDetected() {
    IntentResolution resolution =
        new IntentResolver(List.of(strategy("empty"))).resolve(context, PromptOptions.defaults());

    assertTrue(resolution.isEmpty());
  }

  @Test
  void testPipelineOrder() {
    List<IntentCandidate> ordered =
        IntentResolver.pipelineOrder(
            List.of(
                candidate("RANK", 0.9, 0),
                candidate("EXTRACT", 0.9, 10),
                candidate("MATCH", 0.9, 20)),
            context);

    assertEquals(
        List.of("EXTRACT", "MATCH", "RANK"),
        ordered.stream().map(IntentCandidate::action).toList());
  }

  @Test
  void testPipelineOrderLeavesOtherActionsInPlace() {
    List<IntentCandidate> ordered =
        IntentResolver.pipelineOrder(
            List.of(
                candidate("RANK", 0.9, 0),
                candidate("TRANSLATE", 0.9, 5),
                candidate("FILTER", 0.9, 10)),
            context);

    assertEquals(
        List.of("FILTER", "TRANSLATE", "RANK"),
        ordered.stream().map(IntentCandidate::action).toList());
  }

  @Test
  void testStandardLadder() {
    List<String> names =
        IntentResolver.standard().strategies().stream().map(IntentStrategy::name).toList();

    assertEquals(List.of("imperative", "verb-vocabulary", "action-phrase", "question"), names);
  }
}
