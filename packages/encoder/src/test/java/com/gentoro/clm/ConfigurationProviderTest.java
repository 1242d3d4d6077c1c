package com.gentoro.clm;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.exception.ClmErrorCode;
import com.gentoro.clm.exception.ClmException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @AfterEach
  void clearSystemProperty() {
    System.clearProperty("clm.chars-per-token");
  }

  @Test
  void testBundledConfiguration() {
    Configuration config = new ConfigurationProvider().config();

    assertEquals("en", config.getString("clm.language"));
    assertEquals(4, config.getInt("clm.chars-per-token"));
    assertEquals("VOICE", config.getString("clm.transcript.default-channel"));
  }

  @Test
  void testFileConfiguration() throws Exception {
    Path file = tempDir.resolve("clm.yaml");
    Files.writeString(
        file,
        """
        clm:
          language: es
          structured:
            dataset-name: orders
        """);

    Configuration config = new ConfigurationProvider(file.toString()).config();

    assertEquals("es", config.getString("clm.language"));
    assertEquals("orders", config.getString("clm.structured.dataset-name"));
    assertNull(config.getString("clm.transcript.default-channel"));
  }

  @Test
  void testSystemPropertiesTakePrecedence() {
    System.setProperty("clm.chars-per-token", "7");

    Configuration config = new ConfigurationProvider().config();

    assertEquals(7, config.getInt("clm.chars-per-token"));
  }

  @Test
  void testMissingFile() {
    ClmException ex =
        assertThrows(
            ClmException.class,
            () -> new ConfigurationProvider(tempDir.resolve("nope.yaml").toString()));

    assertEquals(ClmErrorCode.CONFIGURATION_ERROR, ex.getCode());
  }

  @Test
  void testInvalidYaml() throws Exception {
    Path file = tempDir.resolve("broken.yaml");
    Files.writeString(file, "clm: [unclosed\n  language: en");

    ClmException ex =
        assertThrows(ClmException.class, () -> new ConfigurationProvider(file.toString()));

    assertEquals(ClmErrorCode.CONFIGURATION_ERROR, ex.getCode());
  }
}
