package com.gentoro.clm.encoder.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.config.EncodingConfiguration;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.output.EncoderOutput;
import com.gentoro.clm.resolve.RuleEvaluator;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PromptEncoderTest {

  private RuleEvaluator rules;

  @BeforeEach
  void setUp() {
    rules = new RuleEvaluator(new EncodingContext(EncodingConfiguration.defaults(), Map.of()));
  }

  @Test
  void testTaskMode() {
    assertEquals(
        PromptEncoder.Mode.TASK,
        PromptEncoder.detectMode("Summarize this email in 3 bullets", rules));
  }

  @Test
  void testConfigurationCues() {
    assertEquals(
        PromptEncoder.Mode.CONFIGURATION,
        PromptEncoder.detectMode("You are an AI assistant for a bank.", rules));
    assertEquals(
        PromptEncoder.Mode.CONFIGURATION,
        PromptEncoder.detectMode("Role: billing assistant\nAnswer politely.", rules));
    assertEquals(
        PromptEncoder.Mode.CONFIGURATION,
        PromptEncoder.detectMode("Hello {{name}}, how can I help?", rules));
  }

  @Test
  void testCueOutsideWindowIsIgnored() {
    String text = "Summarize the thread. ".repeat(20) + "Your role is to be a judge.";

    assertEquals(PromptEncoder.Mode.TASK, PromptEncoder.detectMode(text, rules));
  }

  @Test
  void testTaskEncodingAddsStrategiesMetadata() {
    EncodingContext context = new EncodingContext(EncodingConfiguration.defaults(), Map.of());

    EncoderOutput output = new PromptEncoder().encode("Explain why the build failed", context);

    assertEquals("TASK", output.metadata().get("mode"));
    assertFalse(output.tokens().isEmpty());
    assertTrue(output.tokens().get(0).startsWith("[REQ:EXPLAIN"), output.tokens().toString());
  }
}
