package com.gentoro.clm;

import com.gentoro.clm.config.EncodingConfiguration;
import com.gentoro.clm.encoder.ComponentKind;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.encoder.InputClassifier;
import com.gentoro.clm.encoder.prompt.PromptEncoder;
import com.gentoro.clm.encoder.prompt.PromptTemplate;
import com.gentoro.clm.encoder.structured.StructuredDataEncoder;
import com.gentoro.clm.encoder.transcript.TranscriptEncoder;
import com.gentoro.clm.exception.InvalidInputException;
import com.gentoro.clm.exception.TemplateBindingException;
import com.gentoro.clm.output.EncoderOutput;
import com.gentoro.clm.output.EncodingResult;
import com.gentoro.clm.output.OutputAssembler;
import com.gentoro.clm.output.TokenEstimator;
import java.util.Map;

/**
 * Engine facade. Build it once from an {@link EncodingConfiguration} and share it; every call gets
 * its own {@link EncodingContext}, so concurrent calls never see each other's state.
 */
public final class ClmEncoder {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(ClmEncoder.class);

  private final EncodingConfiguration configuration;
  private final InputClassifier classifier;
  private final PromptEncoder promptEncoder;
  private final TranscriptEncoder transcriptEncoder = new TranscriptEncoder();
  private final StructuredDataEncoder structuredEncoder = new StructuredDataEncoder();
  private final OutputAssembler assembler;

  public ClmEncoder(EncodingConfiguration configuration) {
    this(configuration, new PromptEncoder());
  }

  ClmEncoder(EncodingConfiguration configuration, PromptEncoder promptEncoder) {
    this.configuration = configuration;
    this.classifier = new InputClassifier(configuration.languagePack().vocabulary());
    this.promptEncoder = promptEncoder;
    this.assembler = new OutputAssembler(new TokenEstimator(configuration.charsPerToken()));
    log.info("Encoder ready: {}", configuration);
  }

  public static ClmEncoder withDefaults() {
    return new ClmEncoder(EncodingConfiguration.defaults());
  }

  public EncodingConfiguration configuration() {
    return configuration;
  }

  public ComponentKind classify(Object input) {
    return classifier.classify(input);
  }

  public EncodingResult encode(Object input) {
    return encode(input, Map.of());
  }

  /** Classify the input and run the matching encoder. */
  public EncodingResult encode(Object input, Map<String, Object> metadata) {
    ComponentKind kind = classifier.classify(input);
    log.debug("Input classified as {}", kind);
    return switch (kind) {
      case SYSTEM_PROMPT -> encodePrompt(input.toString(), metadata);
      case TRANSCRIPT -> encodeTranscript(input.toString(), metadata);
      case STRUCTURED_DATA -> encodeStructured(input, metadata);
    };
  }

  public EncodingResult encodePrompt(String prompt) {
    return encodePrompt(prompt, Map.of());
  }

  public EncodingResult encodePrompt(String prompt, Map<String, Object> metadata) {
    requireText(prompt, "Prompt");
    EncodingContext context = new EncodingContext(configuration, metadata);
    return finish(promptEncoder.encode(prompt, context), context);
  }

  public EncodingResult encodeTranscript(String transcript) {
    return encodeTranscript(transcript, Map.of());
  }

  public EncodingResult encodeTranscript(String transcript, Map<String, Object> metadata) {
    requireText(transcript, "Transcript");
    EncodingContext context = new EncodingContext(configuration, metadata);
    return finish(transcriptEncoder.encode(transcript, context), context);
  }

  public EncodingResult encodeStructured(Object records) {
    return encodeStructured(records, Map.of());
  }

  public EncodingResult encodeStructured(Object records, Map<String, Object> metadata) {
    if (records == null) {
      throw new InvalidInputException("Structured input is null");
    }
    EncodingContext context = new EncodingContext(configuration, metadata);
    return finish(structuredEncoder.encode(records, context), context);
  }

  /**
   * Substitute runtime values into the placeholders of an encoded prompt.
   *
   * @throws TemplateBindingException when the result is not a prompt, a placeholder stays
   *     unresolved or the bound text is empty
   */
  public String bind(EncodingResult result, Map<String, String> values) {
    if (result == null || result.component() != ComponentKind.SYSTEM_PROMPT) {
      throw new TemplateBindingException(
          "Only system prompt results can be bound, got "
              + (result == null ? "null" : result.component()));
    }
    String text = result.isFallback() ? result.original() : result.compressed();
    return PromptTemplate.of(text).bind(values);
  }

  private EncodingResult finish(EncoderOutput output, EncodingContext context) {
    return assembler.assemble(output, context);
  }

  private static void requireText(String text, String what) {
    if (text == null || text.isBlank()) {
      throw new InvalidInputException(what + " is blank");
    }
  }
}
