package com.gentoro.clm.encoder.transcript;

import com.gentoro.clm.utility.TextUtility;
import com.gentoro.clm.vocabulary.PhraseIndex;
import java.util.ArrayList;
import java.util.List;

/**
 * Sentiment trajectory over customer turns. Each turn contributes the last emotion it mentions,
 * or {@code NEUTRAL}; consecutive repeats are collapsed and long trajectories are cut to the
 * first states plus the final one.
 */
final class SentimentAnalyzer {
  static final String NEUTRAL = "NEUTRAL";

  private final PhraseIndex emotions;
  private final int maxStates;

  SentimentAnalyzer(PhraseIndex emotions, int maxStates) {
    this.emotions = emotions;
    this.maxStates = maxStates;
  }

  List<String> trajectory(List<Turn> customerTurns) {
    List<String> states = new ArrayList<>();
    for (Turn turn : customerTurns) {
      List<PhraseIndex.PhraseMatch> found = emotions.findAll(TextUtility.lower(turn.text()));
      add(states, found.isEmpty() ? NEUTRAL : found.get(found.size() - 1).token());
    }
    if (states.size() > maxStates) {
      List<String> cut = new ArrayList<>();
      states.subList(0, maxStates - 1).forEach(s -> add(cut, s));
      add(cut, states.get(states.size() - 1));
      states = cut;
    }
    if (states.isEmpty()) {
      return List.of(NEUTRAL, NEUTRAL);
    }
    if (states.size() == 1) {
      return List.of(states.get(0), states.get(0));
    }
    return List.copyOf(states);
  }

  private static void add(List<String> states, String state) {
    if (states.isEmpty() || !states.get(states.size() - 1).equals(state)) {
      states.add(state);
    }
  }
}
