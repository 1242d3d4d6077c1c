package com.gentoro.clm.encoder;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.clm.encoder.transcript.Speaker;
import com.gentoro.clm.encoder.transcript.TranscriptParser;
import com.gentoro.clm.encoder.transcript.Turn;
import com.gentoro.clm.exception.InvalidInputException;
import com.gentoro.clm.utility.JacksonUtility;
import com.gentoro.clm.vocabulary.Vocabulary;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Routes an input to the encoder that understands it. */
public final class InputClassifier {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(InputClassifier.class);

  static final int MIN_TRANSCRIPT_TURNS = 2;

  private final Vocabulary vocabulary;

  public InputClassifier(Vocabulary vocabulary) {
    this.vocabulary = vocabulary;
  }

  public ComponentKind classify(Object input) {
    if (input == null) {
      throw new InvalidInputException("Input is null");
    }
    if (input instanceof Map<?, ?> || input instanceof List<?>) {
      return ComponentKind.STRUCTURED_DATA;
    }
    if (!(input instanceof CharSequence)) {
      throw new InvalidInputException(
          "Unsupported input type " + input.getClass().getName());
    }
    String text = input.toString();
    if (text.isBlank()) {
      throw new InvalidInputException("Input is blank");
    }
    if (isJsonDocument(text)) {
      return ComponentKind.STRUCTURED_DATA;
    }
    if (isTranscript(text)) {
      return ComponentKind.TRANSCRIPT;
    }
    return ComponentKind.SYSTEM_PROMPT;
  }

  static boolean isJsonDocument(String text) {
    String trimmed = text.strip();
    if (!(trimmed.startsWith("{") || trimmed.startsWith("["))) {
      return false;
    }
    try {
      JsonNode node = JacksonUtility.getLenientJsonMapper().readTree(trimmed);
      return node != null && (node.isObject() || node.isArray());
    } catch (JsonProcessingException e) {
      log.trace("Not a JSON document: {}", e.getOriginalMessage());
      return false;
    }
  }

  private boolean isTranscript(String text) {
    return vocabulary
        .transcriptLexicon()
        .map(
            lexicon -> {
              List<Turn> turns = new TranscriptParser(lexicon, null).parse(text);
              Set<Speaker> roles = TranscriptParser.roles(turns);
              return turns.size() >= MIN_TRANSCRIPT_TURNS && roles.size() >= 2;
            })
        .orElse(false);
  }
}
