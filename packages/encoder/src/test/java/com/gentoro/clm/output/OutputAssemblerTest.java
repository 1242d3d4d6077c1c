package com.gentoro.clm.output;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.config.EncodingConfiguration;
import com.gentoro.clm.encoder.ComponentKind;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.exception.PatternBudgetExceededException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class OutputAssemblerTest {

  private final OutputAssembler assembler = new OutputAssembler(new TokenEstimator(4));

  private static EncodingContext context(Map<String, Object> metadata) {
    return new EncodingContext(EncodingConfiguration.defaults(), metadata);
  }

  private static EncoderOutput output(String original, String compressed, List<String> tokens) {
    return new EncoderOutput(ComponentKind.SYSTEM_PROMPT, original, tokens, compressed, Map.of());
  }

  @Test
  void testCompressedResult() {
    String original = "Please could you list the five most important issues for me, thanks a lot";

    EncodingResult result =
        assembler.assemble(
            output(
                original,
                "[REQ:LIST:LIMIT=5]  [TARGET:ITEMS]",
                List.of("[REQ:LIST:LIMIT=5]", "[TARGET:ITEMS]")),
            context(Map.of("request_id", "r-1")));

    assertEquals("[REQ:LIST:LIMIT=5] [TARGET:ITEMS]", result.compressed());
    assertEquals(19, result.nTokens());
    assertEquals(9, result.cTokens());
    assertEquals(52.6, result.compressionRatio());
    assertFalse(result.isFallback());
    assertEquals("r-1", result.metadata().get("request_id"));
    assertEquals("SYSTEM_PROMPT", result.metadata().get(OutputAssembler.COMPONENT));
    assertEquals(List.of(), result.metadata().get(OutputAssembler.GRAMMAR_ISSUES));
  }

  @Test
  void testEmptyCompressedFallsBack() {
    EncodingResult result =
        assembler.assemble(output("summarize", " ", List.of()), context(Map.of()));

    assertTrue(result.isFallback());
    assertEquals("summarize", result.compressed());
    assertEquals("empty compressed form", result.metadata().get(OutputAssembler.FALLBACK_REASON));
    assertEquals(0.0, result.compressionRatio());
  }

  @Test
  void testLongerCompressedFallsBack() {
    EncodingResult result =
        assembler.assemble(
            output(
                "list issues",
                "[REQ:LIST] [EXTRACT:ISSUE]",
                List.of("[REQ:LIST]", "[EXTRACT:ISSUE]")),
            context(Map.of()));

    assertTrue(result.isFallback());
    assertEquals(result.nTokens(), result.cTokens());
  }

  @Test
  void testGrammarIssuesAndDegradation() {
    EncodingContext context = context(Map.of());
    context.markDegraded("ORDERING", new PatternBudgetExceededException("x", 10));
    String original = "a long enough original prompt that is clearly bigger than the tokens";

    EncodingResult result =
        assembler.assemble(output(original, "[CALL:X]", List.of("[CALL:X]")), context);

    assertEquals(
        List.of("unexpected category CALL"), result.metadata().get(OutputAssembler.GRAMMAR_ISSUES));
    assertTrue(result.isDegraded());
    assertEquals(List.of("ORDERING"), result.metadata().get(OutputAssembler.DEGRADED_CATEGORIES));
  }
}
