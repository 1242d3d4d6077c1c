package com.gentoro.clm.resolve;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.clm.config.PromptOptions;
import com.gentoro.clm.nlp.AnalyzedText;
import com.gentoro.clm.nlp.AnalyzedToken;
import com.gentoro.clm.rules.RuleCategory;
import com.gentoro.clm.token.ResolvedToken;
import com.gentoro.clm.token.TokenCategory;
import com.gentoro.clm.utility.JacksonUtility;
import com.gentoro.clm.vocabulary.PhraseIndex;
import com.gentoro.clm.vocabulary.Vocabulary;
import com.gentoro.clm.vocabulary.VocabularyCategory;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Builds the {@code [OUT:...]} token: the response format, an inlined schema taken from a JSON
 * example or a "with fields a, b and c" phrase, and the item and empty-result behavior.
 */
public final class OutputFormatResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(OutputFormatResolver.class);

  private final Vocabulary vocabulary;
  private final RuleEvaluator rules;
  private final PromptOptions options;

  public OutputFormatResolver(Vocabulary vocabulary, RuleEvaluator rules, PromptOptions options) {
    this.vocabulary = vocabulary;
    this.rules = rules;
    this.options = options;
  }

  /**
   * @param outputItem item kind from target resolution, may be null
   * @return empty when the text states no output format, no schema, no item kind and no
   *     empty-result behavior
   */
  public Optional<ResolvedToken> resolve(AnalyzedText text, String outputItem) {
    String format = format(text);
    Optional<JsonNode> example = findJsonBlock(text.text());
    Map<String, String> types = new LinkedHashMap<>();
    Map<String, String> enums = new LinkedHashMap<>();
    List<String> keys = new ArrayList<>();

    if (example.isPresent()) {
      JsonNode node = example.get();
      if (node.isArray()) {
        if (format == null) format = "JSON_ARRAY";
        node = node.size() > 0 ? node.get(0) : node;
      }
      if (node.isObject()) {
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
          Map.Entry<String, JsonNode> field = fields.next();
          keys.add(field.getKey());
          types.put(field.getKey(), typeCode(field.getValue()));
          String enumeration = enumeration(field.getValue());
          if (enumeration != null) enums.put(field.getKey(), enumeration);
        }
      }
      if (format == null) format = "JSON";
    } else {
      rules
          .first(RuleCategory.SCHEMA_FIELDS, text.text())
          .ifPresent(m -> keys.addAll(splitFieldList(m.value())));
    }

    boolean emptyOnNoMatch = rules.matches(RuleCategory.EMPTY_ON_NO_MATCH, text.text());
    if (format == null && keys.isEmpty()) {
      if (outputItem == null && !emptyOnNoMatch) {
        return Optional.empty();
      }
      // an item kind or an empty-result rule implies a plain list of items
      format = "LIST";
    }
    ResolvedToken.Builder out =
        ResolvedToken.builder(TokenCategory.OUT).value(format == null ? "JSON" : format);
    if (!keys.isEmpty()) {
      out.attribute("SCHEMA", "{" + String.join(",", keys) + "}");
    }
    if (options.inferTypes() && !types.isEmpty()) {
      List<String> parts = new ArrayList<>();
      types.forEach((k, v) -> parts.add(k + ":" + v));
      out.attribute("TYPES", String.join(",", parts));
    }
    if (options.addAttrs() && !enums.isEmpty()) {
      List<String> parts = new ArrayList<>();
      enums.forEach((k, v) -> parts.add(k + "=" + v));
      out.attribute("ENUMS", String.join(";", parts));
    }
    out.attribute("ITEM", outputItem);
    if (emptyOnNoMatch) {
      out.attribute("ON_NO_MATCH", "EMPTY");
    }
    ResolvedToken token = out.build();
    log.debug("Resolved output {}", token);
    return Optional.of(token);
  }

  /** Earliest output-format mention; multi-word phrases claim their span first. */
  private String format(AnalyzedText text) {
    List<PhraseIndex.PhraseMatch> phrases =
        vocabulary.phrases(VocabularyCategory.OUTPUT_FORMAT).findAll(text.lower());
    BitSet masked = new BitSet();
    phrases.forEach(m -> masked.set(m.start(), m.end()));
    int best = phrases.isEmpty() ? Integer.MAX_VALUE : phrases.get(0).start();
    String format = phrases.isEmpty() ? null : phrases.get(0).token();
    for (AnalyzedToken token : text.tokens()) {
      if (token.start() >= best) break;
      if (!token.isWord() || masked.get(token.start())) continue;
      Optional<String> single =
          vocabulary.lookup(VocabularyCategory.OUTPUT_FORMAT, token.lower(), null);
      if (single.isPresent()) {
        return single.get();
      }
    }
    return format;
  }

  /** First balanced JSON object or array in the text that parses leniently. */
  static Optional<JsonNode> findJsonBlock(String text) {
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (c != '{' && c != '[') continue;
      int end = closing(text, i);
      if (end < 0) continue;
      String candidate = text.substring(i, end + 1);
      if (c == '[' && candidate.indexOf('{') < 0) continue;
      try {
        JsonNode node = JacksonUtility.getLenientJsonMapper().readTree(candidate);
        if (node != null && (node.isObject() || node.isArray())) {
          return Optional.of(node);
        }
      } catch (JsonProcessingException e) {
        log.trace("Not a JSON block at {}: {}", i, e.getOriginalMessage());
      }
    }
    return Optional.empty();
  }

  private static int closing(String text, int open) {
    int depth = 0;
    boolean quoted = false;
    char quote = 0;
    for (int i = open; i < text.length(); i++) {
      char c = text.charAt(i);
      if (quoted) {
        if (c == '\\') {
          i++;
        } else if (c == quote) {
          quoted = false;
        }
        continue;
      }
      if (c == '"' || c == '\'') {
        quoted = true;
        quote = c;
      } else if (c == '{' || c == '[') {
        depth++;
      } else if (c == '}' || c == ']') {
        depth--;
        if (depth == 0) return i;
      }
    }
    return -1;
  }

  static String typeCode(JsonNode value) {
    if (value == null || value.isNull()) return "STR";
    if (value.isBoolean()) return "BOOL";
    if (value.isIntegralNumber()) return "INT";
    if (value.isNumber()) return "FLOAT";
    if (value.isArray()) return "LIST";
    if (value.isObject()) return "OBJ";
    String s = value.asText().trim().toLowerCase(Locale.ROOT);
    return switch (s) {
      case "int", "integer", "number" -> "INT";
      case "float", "double", "decimal" -> "FLOAT";
      case "bool", "boolean", "true", "false" -> "BOOL";
      default -> "STR";
    };
  }

  /** {@code "high|medium|low"} style sample values. */
  private static String enumeration(JsonNode value) {
    if (value == null || !value.isTextual()) return null;
    String s = value.asText().trim();
    String sep = s.contains("|") ? "\\|" : null;
    if (sep == null) return null;
    Set<String> parts = new LinkedHashSet<>();
    for (String part : s.split(sep)) {
      if (!part.isBlank()) parts.add(part.trim().toLowerCase(Locale.ROOT).replace(' ', '_'));
    }
    return parts.size() < 2 ? null : String.join("|", parts);
  }

  static List<String> splitFieldList(String list) {
    List<String> keys = new ArrayList<>();
    for (String part : list.split("\\s*(?:,|\\band\\b|&)\\s*")) {
      String key = part.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
      if (!key.isEmpty() && !keys.contains(key)) keys.add(key);
    }
    return keys;
  }
}
