package com.gentoro.clm.encoder.transcript;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.language.LanguageRegistry;
import com.gentoro.clm.vocabulary.PhraseIndex;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class SentimentAnalyzerTest {

  private static PhraseIndex emotions;

  @BeforeAll
  static void loadLexicon() {
    emotions =
        LanguageRegistry.resolve("en").vocabulary().transcriptLexicon().orElseThrow().emotions();
  }

  private static List<Turn> customer(String... texts) {
    List<Turn> turns = new ArrayList<>();
    for (String text : texts) {
      turns.add(new Turn(turns.size(), "Customer", Speaker.CUSTOMER, null, text));
    }
    return turns;
  }

  @Test
  void testTrajectory() {
    List<String> states =
        new SentimentAnalyzer(emotions, 4)
            .trajectory(customer("I'm really frustrated", "ok", "thanks, that's great"));

    assertEquals(List.of("FRUSTRATED", "NEUTRAL", "SATISFIED"), states);
  }

  @Test
  void testConsecutiveRepeatsMerge() {
    List<String> states =
        new SentimentAnalyzer(emotions, 4).trajectory(customer("so frustrated", "I'm fed up"));

    assertEquals(List.of("FRUSTRATED", "FRUSTRATED"), states);
  }

  @Test
  void testLongTrajectoryKeepsFinalState() {
    List<String> states =
        new SentimentAnalyzer(emotions, 4)
            .trajectory(
                customer("I'm frustrated", "ok", "this is ridiculous", "fine", "thanks, great"));

    assertEquals(List.of("FRUSTRATED", "NEUTRAL", "ANGRY", "SATISFIED"), states);
  }

  @Test
  void testNoCustomerTurns() {
    assertEquals(
        List.of("NEUTRAL", "NEUTRAL"), new SentimentAnalyzer(emotions, 4).trajectory(List.of()));
  }
}
