package com.gentoro.clm;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.clm.encoder.ComponentKind;
import com.gentoro.clm.exception.ClmException;
import com.gentoro.clm.exception.InvalidInputException;
import com.gentoro.clm.output.EncodingResult;
import com.gentoro.clm.utility.JacksonUtility;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ClmAppTest {

  @TempDir Path tempDir;

  private ByteArrayOutputStream buffer;
  private PrintStream out;

  @BeforeEach
  void setUp() {
    buffer = new ByteArrayOutputStream();
    out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
  }

  private String[] args(String... values) {
    return values;
  }

  @Test
  void testEncodesTranscriptFile() throws Exception {
    Path input = tempDir.resolve("call.txt");
    Files.writeString(input, ClmEncoderTest.SUPPORT_CALL);

    EncodingResult result = new ClmApp().run(args("--input", input.toString()), out);

    assertEquals(ComponentKind.TRANSCRIPT, result.component());
    String printed = buffer.toString(StandardCharsets.UTF_8);
    JsonNode json = JacksonUtility.getJsonMapper().readTree(printed);
    assertEquals("TRANSCRIPT", json.get("component").asText());
    assertEquals(result.compressed(), json.get("compressed").asText());
    assertTrue(json.has("compression_ratio"));
    assertTrue(json.get("metadata").get("tokens").isArray());
  }

  @Test
  void testExplicitTypeAndMetadata() throws Exception {
    Path input = tempDir.resolve("tickets.json");
    Files.writeString(
        input,
        """
        [{"id": 1, "status": "open", "title": "Printer offline", "created_at": "2024-01-01"},
         {"id": 2, "status": "closed", "title": "VPN drops", "created_at": "2024-01-02"}]""");

    EncodingResult result =
        new ClmApp()
            .run(
                args(
                    "--input", input.toString(),
                    "--type", "structured",
                    "--metadata", "{\"dataset\": \"tickets\"}"),
                out);

    assertEquals(ComponentKind.STRUCTURED_DATA, result.component());
    assertTrue(result.compressed().startsWith("[DATASET:TICKETS:COUNT=2]"), result.compressed());
  }

  @Test
  void testLanguageOverride() throws Exception {
    Path input = tempDir.resolve("prompt.txt");
    Files.writeString(input, "Lista los 5 principales problemas de los clientes");

    EncodingResult result =
        new ClmApp().run(args("--input", input.toString(), "--lang", "es"), out);

    assertEquals("es", result.metadata().get("language"));
  }

  @Test
  void testMissingInput() {
    assertThrows(InvalidInputException.class, () -> new ClmApp().run(args(), out));
    assertThrows(
        InvalidInputException.class,
        () -> new ClmApp().run(args("--input", tempDir.resolve("none.txt").toString()), out));
  }

  @Test
  void testBadMetadata() throws Exception {
    Path input = tempDir.resolve("prompt.txt");
    Files.writeString(input, "List the top 5 issues");

    assertThrows(
        InvalidInputException.class,
        () -> new ClmApp().run(args("--input", input.toString(), "--metadata", "[1]"), out));
  }

  @Test
  void testKind() {
    assertEquals(ComponentKind.SYSTEM_PROMPT, ClmApp.kind("Prompt"));
    assertEquals(ComponentKind.TRANSCRIPT, ClmApp.kind("transcript"));
    assertEquals(ComponentKind.STRUCTURED_DATA, ClmApp.kind(" data "));
    assertThrows(ClmException.class, () -> ClmApp.kind("audio"));
  }
}
