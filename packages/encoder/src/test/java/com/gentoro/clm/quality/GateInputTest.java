package com.gentoro.clm.quality;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.language.LanguageRegistry;
import com.gentoro.clm.nlp.LinguisticAnalyzer;
import java.util.List;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

class GateInputTest {

  private static LinguisticAnalyzer analyzer;

  @BeforeAll
  static void loadAnalyzer() {
    analyzer = LanguageRegistry.resolve("en").analyzer();
  }

  private static List<String> phrases(String text) {
    return GateInput.nounPhrases(analyzer.analyze(text)).stream()
        .map(GateInput.NounPhrase::text)
        .toList();
  }

  @Test
  void testNounRuns() {
    List<String> phrases = phrases("Rank the support tickets by priority.");

    assertTrue(phrases.stream().anyMatch(p -> p.endsWith("tickets")), phrases.toString());
    assertEquals("priority", phrases.get(phrases.size() - 1));
    assertTrue(phrases.stream().noneMatch(p -> p.contains("Rank")), phrases.toString());
  }

  @Test
  void testActionWordBeforeGenitiveIsNoun() {
    List<String> phrases = phrases("Classify the ticket from the provided list of categories");

    assertTrue(phrases.contains("list"), phrases.toString());
    assertTrue(phrases.contains("categories"), phrases.toString());
  }
}
