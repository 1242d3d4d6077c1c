package com.gentoro.clm.encoder;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.exception.InvalidInputException;
import com.gentoro.clm.language.LanguageRegistry;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InputClassifierTest {

  private InputClassifier classifier;

  @BeforeEach
  void setUp() {
    classifier = new InputClassifier(LanguageRegistry.resolve("en").vocabulary());
  }

  @Test
  void testStructuredValues() {
    assertEquals(ComponentKind.STRUCTURED_DATA, classifier.classify(Map.of("id", 1)));
    assertEquals(ComponentKind.STRUCTURED_DATA, classifier.classify(List.of()));
    assertEquals(ComponentKind.STRUCTURED_DATA, classifier.classify("  [{\"id\": 1}]"));
    assertEquals(ComponentKind.STRUCTURED_DATA, classifier.classify("{'id': 1, status: 'open'}"));
  }

  @Test
  void testBracketedTextIsNotJson() {
    assertFalse(InputClassifier.isJsonDocument("[REQ:LIST] [TARGET:ITEMS]"));
    assertFalse(InputClassifier.isJsonDocument("{{customer_name}} called"));
    assertEquals(
        ComponentKind.SYSTEM_PROMPT, classifier.classify("[Important] summarize the call"));
  }

  @Test
  void testTranscript() {
    String text =
        """
        [00:01] Agent: Thanks for calling, how can I help?
        [00:05] Customer: My internet keeps dropping.
        """;

    assertEquals(ComponentKind.TRANSCRIPT, classifier.classify(text));
  }

  @Test
  void testNumberedTurnsTranscript() {
    String text =
        """
        [1] Agent: Thanks for calling, how can I help?
        [2] Customer: My internet keeps dropping.
        [3] Agent: Let me run a line test.
        """;

    assertEquals(ComponentKind.TRANSCRIPT, classifier.classify(text));
  }

  @Test
  void testTextAfterJsonIsPrompt() {
    String text = "{\"id\": 1, \"status\": \"open\"} summarize this ticket for the manager";

    assertFalse(InputClassifier.isJsonDocument(text));
    assertEquals(ComponentKind.SYSTEM_PROMPT, classifier.classify(text));
  }

  @Test
  void testSingleSpeakerIsPrompt() {
    String text =
        """
        Role: assistant
        Task: summarize the customer email
        """;

    assertEquals(ComponentKind.SYSTEM_PROMPT, classifier.classify(text));
  }

  @Test
  void testPrompt() {
    assertEquals(ComponentKind.SYSTEM_PROMPT, classifier.classify("List the top 5 issues"));
  }

  @Test
  void testInvalidInput() {
    assertThrows(InvalidInputException.class, () -> classifier.classify(null));
    assertThrows(InvalidInputException.class, () -> classifier.classify(""));
    assertThrows(InvalidInputException.class, () -> classifier.classify(42));
  }
}
