package com.gentoro.clm.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.exception.ClmErrorCode;
import com.gentoro.clm.exception.ClmException;
import com.gentoro.clm.rules.BoundedPatternMatcher;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import org.apache.commons.configuration2.BaseConfiguration;
import org.junit.jupiter.api.Test;

class EncodingConfigurationTest {

  @Test
  void testDefaults() {
    EncodingConfiguration config = EncodingConfiguration.defaults();

    assertEquals("en", config.language());
    assertEquals(4, config.charsPerToken());
    assertEquals(BoundedPatternMatcher.DEFAULT_MAX_STEPS, config.patternBudget());
    assertEquals(PromptOptions.defaults(), config.prompt());
    assertEquals(TranscriptOptions.defaults(), config.transcript());
    assertEquals(0.5, config.structured().importanceThreshold());
    assertEquals(List.of("id", "title", "name", "type"), config.structured().identityFields());
    assertEquals("en", config.languagePack().code());
  }

  @Test
  void testFromConfiguration() {
    BaseConfiguration source = new BaseConfiguration();
    source.setProperty("clm.language", "es");
    source.setProperty("clm.chars-per-token", "3");
    source.setProperty("clm.prompt.union-strategies", "true");
    source.setProperty("clm.prompt.min-intent-confidence", "0.8");
    source.setProperty("clm.transcript.default-channel", "CHAT");
    source.setProperty("clm.structured.required-fields", "id, status");
    source.setProperty("clm.structured.field-importance.notes", "critical");
    source.setProperty("clm.structured.field-importance.body", "0.3");
    source.setProperty("clm.structured.identity-fields", "key");
    source.setProperty("clm.structured.dataset-name", "orders");

    EncodingConfiguration config = EncodingConfiguration.fromConfiguration(source);

    assertEquals("es", config.languagePack().code());
    assertEquals(3, config.charsPerToken());
    assertTrue(config.prompt().unionStrategies());
    assertEquals(0.8, config.prompt().minIntentConfidence());
    assertEquals("CHAT", config.transcript().defaultChannel());
    assertEquals(Set.of("id", "status"), config.structured().requiredFields());
    assertEquals(1.0, config.structured().fieldImportance().get("notes"));
    assertEquals(0.3, config.structured().fieldImportance().get("body"));
    assertEquals(List.of("key"), config.structured().identityFields());
    assertEquals("orders", config.structured().datasetName());
  }

  @Test
  void testInvalidValues() {
    BaseConfiguration states = new BaseConfiguration();
    states.setProperty("clm.transcript.max-sentiment-states", "1");
    BaseConfiguration chars = new BaseConfiguration();
    chars.setProperty("clm.chars-per-token", "four");

    ClmException first =
        assertThrows(ClmException.class, () -> EncodingConfiguration.fromConfiguration(states));
    ClmException second =
        assertThrows(ClmException.class, () -> EncodingConfiguration.fromConfiguration(chars));

    assertEquals(ClmErrorCode.CONFIGURATION_ERROR, first.getCode());
    assertEquals(ClmErrorCode.CONFIGURATION_ERROR, second.getCode());
  }

  @Test
  void testBuilderValidation() {
    ClmException ex =
        assertThrows(
            ClmException.class, () -> EncodingConfiguration.builder().charsPerToken(0).build());
    assertEquals(ClmErrorCode.CONFIGURATION_ERROR, ex.getCode());

    assertThrows(
        ClmException.class,
        () -> EncodingConfiguration.builder().posModel(Path.of("missing-pos.bin")).build());
  }

  @Test
  void testFieldImportanceParsing() {
    assertEquals(0.8, FieldImportance.parseScore(" high "));
    assertEquals(0.35, FieldImportance.parseScore("0.35"));
    assertThrows(IllegalArgumentException.class, () -> FieldImportance.parseScore("urgent"));
    assertThrows(IllegalArgumentException.class, () -> FieldImportance.parseScore(""));
  }

  @Test
  void testTranscriptOptions() {
    assertEquals("VOICE", new TranscriptOptions(" ", 3).defaultChannel());
    assertThrows(IllegalArgumentException.class, () -> new TranscriptOptions("CHAT", 1));
  }
}
