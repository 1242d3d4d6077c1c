package com.gentoro.clm;

import com.fasterxml.jackson.core.type.TypeReference;
import com.gentoro.clm.config.EncodingConfiguration;
import com.gentoro.clm.encoder.ComponentKind;
import com.gentoro.clm.exception.ClmErrorCode;
import com.gentoro.clm.exception.ClmException;
import com.gentoro.clm.exception.ExceptionUtil;
import com.gentoro.clm.exception.InvalidInputException;
import com.gentoro.clm.output.EncodingResult;
import com.gentoro.clm.utility.JacksonUtility;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;

/**
 * Command line entry point.
 *
 * <pre>
 * --input &lt;file&gt;     text or JSON to encode (required)
 * --config &lt;yaml&gt;    application configuration, defaults to the bundled application.yaml
 * --type &lt;kind&gt;      prompt | transcript | structured; classified automatically when absent
 * --lang &lt;code&gt;      overrides clm.language
 * --metadata &lt;json&gt;  caller metadata as a JSON object
 * </pre>
 *
 * Prints the {@code EncodingResult} as JSON on stdout.
 */
public class ClmApp {

  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(ClmApp.class);

  public static void main(String[] args) {
    try {
      new ClmApp().run(args, System.out);
    } catch (Exception e) {
      log.error("Encoding failed: {}", ExceptionUtil.extractErrorMessage(e));
      log.debug("at {}", ExceptionUtil.formatCompactStackTrace(e, 8));
      System.err.println(JacksonUtility.toJson(ExceptionUtil.toErrorDetails(e)));
      System.exit(1);
    }
  }

  public EncodingResult run(String[] args, PrintStream out) {
    StartupParameters parameters = new StartupParameters(args);
    Configuration configuration = new ConfigurationProvider(parameters.configFile()).config();
    com.gentoro.clm.logging.LoggingService.applyConfiguration(configuration);
    String lang = parameters.getParameter("lang", String.class);
    if (lang != null) {
      configuration.setProperty(EncodingConfiguration.PREFIX + ".language", lang);
    }
    ClmEncoder encoder = new ClmEncoder(EncodingConfiguration.fromConfiguration(configuration));

    Path input = parameters.getParameter("input", Path.class);
    if (input == null) {
      throw new InvalidInputException("Missing --input <file>");
    }
    String text = read(input);
    Map<String, Object> metadata = metadata(parameters.getParameter("metadata", String.class));
    String type = parameters.getParameter("type", String.class);

    EncodingResult result;
    if (type == null) {
      result = encoder.encode(text, metadata);
    } else {
      result =
          switch (kind(type)) {
            case SYSTEM_PROMPT -> encoder.encodePrompt(text, metadata);
            case TRANSCRIPT -> encoder.encodeTranscript(text, metadata);
            case STRUCTURED_DATA -> encoder.encodeStructured(text, metadata);
          };
    }
    out.println(JacksonUtility.toPrettyJson(result));
    return result;
  }

  static ComponentKind kind(String type) {
    return switch (type.trim().toLowerCase(Locale.ROOT)) {
      case "prompt", "system_prompt" -> ComponentKind.SYSTEM_PROMPT;
      case "transcript" -> ComponentKind.TRANSCRIPT;
      case "structured", "structured_data", "data" -> ComponentKind.STRUCTURED_DATA;
      default -> throw new ClmException(ClmErrorCode.CONFIGURATION_ERROR, "Invalid --type: " + type);
    };
  }

  private static String read(Path input) {
    try {
      return Files.readString(input, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new InvalidInputException("Cannot read input file " + input, e);
    }
  }

  private static Map<String, Object> metadata(String json) {
    if (json == null || json.isBlank()) {
      return Map.of();
    }
    try {
      return JacksonUtility.getJsonMapper().readValue(json, new TypeReference<Map<String, Object>>() {});
    } catch (IOException e) {
      throw new InvalidInputException("--metadata must be a JSON object", e);
    }
  }
}
