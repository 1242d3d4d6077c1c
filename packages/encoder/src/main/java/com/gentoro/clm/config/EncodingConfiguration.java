package com.gentoro.clm.config;

import com.gentoro.clm.exception.ClmErrorCode;
import com.gentoro.clm.exception.ClmException;
import com.gentoro.clm.language.LanguagePack;
import com.gentoro.clm.language.LanguageRegistry;
import com.gentoro.clm.rules.BoundedPatternMatcher;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.ex.ConversionException;
import org.apache.commons.lang3.StringUtils;

/**
 * Immutable encoder configuration: language selection plus the options of the three encoders.
 *
 * <p>Building an instance resolves the language pack (vocabulary, rules, analyzer) exactly once,
 * so an unsupported language fails here rather than on the first encode call. The instance can
 * then be shared freely between threads.
 */
public final class EncodingConfiguration {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(EncodingConfiguration.class);

  public static final String PREFIX = "clm";

  private final String language;
  private final String vocabularyOverlay;
  private final Path posModel;
  private final int charsPerToken;
  private final long patternBudget;
  private final PromptOptions prompt;
  private final TranscriptOptions transcript;
  private final StructuredDataOptions structured;
  private final LanguagePack languagePack;

  private EncodingConfiguration(Builder b) {
    if (b.charsPerToken <= 0) {
      throw new ClmException(
          ClmErrorCode.CONFIGURATION_ERROR, "chars-per-token must be positive, got " + b.charsPerToken);
    }
    if (b.posModel != null && !Files.isRegularFile(b.posModel)) {
      throw new ClmException(ClmErrorCode.CONFIGURATION_ERROR, "POS model not found: " + b.posModel)
          .withContext("path", b.posModel.toString());
    }
    this.language = b.language;
    this.vocabularyOverlay = b.vocabularyOverlay;
    this.posModel = b.posModel;
    this.charsPerToken = b.charsPerToken;
    this.patternBudget = b.patternBudget;
    this.prompt = b.prompt;
    this.transcript = b.transcript;
    this.structured = b.structured;
    this.languagePack = LanguageRegistry.resolve(language, vocabularyOverlay, posModel);
  }

  public static Builder builder() {
    return new Builder();
  }

  public static EncodingConfiguration defaults() {
    return builder().build();
  }

  /** Map the {@code clm.*} keys of an application configuration. */
  public static EncodingConfiguration fromConfiguration(Configuration configuration) {
    Configuration c = configuration.subset(PREFIX);
    Builder b = builder();
    try {
      b.language(c.getString("language", "en"))
          .charsPerToken(c.getInt("chars-per-token", 4))
          .patternBudget(c.getLong("pattern-budget.max-steps", BoundedPatternMatcher.DEFAULT_MAX_STEPS))
          .vocabularyOverlay(c.getString("vocabulary.overlay", null));
      String posModel = c.getString("analyzer.pos-model", null);
      if (StringUtils.isNotBlank(posModel)) {
        b.posModel(Path.of(posModel.trim()));
      }

      PromptOptions defaults = PromptOptions.defaults();
      b.prompt(
          new PromptOptions(
              c.getBoolean("prompt.infer-types", defaults.inferTypes()),
              c.getBoolean("prompt.add-attrs", defaults.addAttrs()),
              c.getBoolean("prompt.union-strategies", defaults.unionStrategies()),
              c.getDouble("prompt.min-intent-confidence", defaults.minIntentConfidence())));

      TranscriptOptions transcriptDefaults = TranscriptOptions.defaults();
      b.transcript(
          new TranscriptOptions(
              c.getString("transcript.default-channel", transcriptDefaults.defaultChannel()),
              c.getInt("transcript.max-sentiment-states", transcriptDefaults.maxSentimentStates())));

      StructuredDataOptions sd = StructuredDataOptions.defaults();
      StructuredDataOptions.Builder sb =
          sd.toBuilder()
              .requiredFields(stringList(c, "structured.required-fields"))
              .excludedFields(stringList(c, "structured.excluded-fields"))
              .fieldImportance(importanceMap(c.subset("structured.field-importance")))
              .importanceThreshold(c.getDouble("structured.importance-threshold", sd.importanceThreshold()))
              .maxFieldLength(c.getInt("structured.max-field-length", sd.maxFieldLength()))
              .preserveStructure(c.getBoolean("structured.preserve-structure", sd.preserveStructure()))
              .normalizeCase(c.getBoolean("structured.normalize-case", sd.normalizeCase()))
              .datasetName(c.getString("structured.dataset-name", sd.datasetName()));
      if (c.containsKey("structured.identity-fields")) {
        sb.identityFields(stringList(c, "structured.identity-fields"));
      }
      b.structured(sb.build());
    } catch (ConversionException | IllegalArgumentException e) {
      throw new ClmException(
          ClmErrorCode.CONFIGURATION_ERROR, "Invalid clm configuration: " + e.getMessage(), e);
    }
    return b.build();
  }

  private static List<String> stringList(Configuration c, String key) {
    List<String> out = new ArrayList<>();
    for (String value : c.getList(String.class, key, List.of())) {
      for (String part : StringUtils.split(value, ',')) {
        if (StringUtils.isNotBlank(part)) {
          out.add(part.trim());
        }
      }
    }
    return out;
  }

  private static Map<String, Double> importanceMap(Configuration subset) {
    Map<String, Double> out = new LinkedHashMap<>();
    Iterator<String> keys = subset.getKeys();
    while (keys.hasNext()) {
      String field = keys.next();
      out.put(field, FieldImportance.parseScore(subset.getString(field)));
    }
    return out;
  }

  public String language() {
    return languagePack.code();
  }

  public String vocabularyOverlay() {
    return vocabularyOverlay;
  }

  public int charsPerToken() {
    return charsPerToken;
  }

  public long patternBudget() {
    return patternBudget;
  }

  public PromptOptions prompt() {
    return prompt;
  }

  public TranscriptOptions transcript() {
    return transcript;
  }

  public StructuredDataOptions structured() {
    return structured;
  }

  public LanguagePack languagePack() {
    return languagePack;
  }

  @Override
  public String toString() {
    return "EncodingConfiguration{language="
        + language()
        + ", overlay="
        + vocabularyOverlay
        + ", charsPerToken="
        + charsPerToken
        + ", patternBudget="
        + patternBudget
        + ", prompt="
        + prompt
        + ", transcript="
        + transcript
        + ", structured="
        + structured
        + '}';
  }

  public static final class Builder {
    private String language = "en";
    private String vocabularyOverlay;
    private Path posModel;
    private int charsPerToken = 4;
    private long patternBudget = BoundedPatternMatcher.DEFAULT_MAX_STEPS;
    private PromptOptions prompt = PromptOptions.defaults();
    private TranscriptOptions transcript = TranscriptOptions.defaults();
    private StructuredDataOptions structured = StructuredDataOptions.defaults();

    private Builder() {}

    public Builder language(String v) {
      this.language = v;
      return this;
    }

    /** Overlay YAML with extra synonyms; {@code classpath:} prefix or a file path. */
    public Builder vocabularyOverlay(String v) {
      this.vocabularyOverlay = StringUtils.trimToNull(v);
      return this;
    }

    public Builder posModel(Path v) {
      this.posModel = v;
      return this;
    }

    public Builder charsPerToken(int v) {
      this.charsPerToken = v;
      return this;
    }

    public Builder patternBudget(long v) {
      this.patternBudget = v;
      return this;
    }

    public Builder prompt(PromptOptions v) {
      this.prompt = v == null ? PromptOptions.defaults() : v;
      return this;
    }

    public Builder transcript(TranscriptOptions v) {
      this.transcript = v == null ? TranscriptOptions.defaults() : v;
      return this;
    }

    public Builder structured(StructuredDataOptions v) {
      this.structured = v == null ? StructuredDataOptions.defaults() : v;
      return this;
    }

    /**
     * @throws com.gentoro.clm.exception.LanguageNotSupportedException if the language has no
     *     complete resource pack
     */
    public EncodingConfiguration build() {
      EncodingConfiguration configuration = new EncodingConfiguration(this);
      log.debug("Built {}", configuration);
      return configuration;
    }
  }
}
