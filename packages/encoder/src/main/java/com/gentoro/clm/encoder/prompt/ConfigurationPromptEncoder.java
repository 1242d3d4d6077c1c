package com.gentoro.clm.encoder.prompt;

import com.gentoro.clm.config.PromptOptions;
import com.gentoro.clm.encoder.ComponentKind;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.output.EncoderOutput;
import com.gentoro.clm.resolve.OutputFormatResolver;
import com.gentoro.clm.resolve.RuleEvaluator;
import com.gentoro.clm.resolve.RuleMatch;
import com.gentoro.clm.rules.RuleCategory;
import com.gentoro.clm.token.ResolvedToken;
import com.gentoro.clm.token.TokenCategory;
import com.gentoro.clm.utility.TextUtility;
import com.gentoro.clm.vocabulary.Vocabulary;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Configuration mode: a header of {@code CTX} tokens (role, rule sets, priority) and an optional
 * {@code OUT} token, then a newline and the minimized prose. Placeholders pass through untouched.
 */
final class ConfigurationPromptEncoder {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(ConfigurationPromptEncoder.class);

  private final PromptTemplateValidator validator = new PromptTemplateValidator();

  EncoderOutput encode(String text, EncodingContext context, RuleEvaluator rules) {
    Vocabulary vocabulary = context.vocabulary();
    PromptOptions options = context.configuration().prompt();

    Optional<String> role = rules.first(RuleCategory.ROLE, text).map(m -> role(m, vocabulary));
    List<ResolvedToken> tokens = new ArrayList<>();
    role.ifPresent(r -> tokens.add(ctx("ROLE", r)));

    List<String> ruleSets = new ArrayList<>();
    if (rules.matches(RuleCategory.BASIC_RULES, text)) ruleSets.add("BASIC");
    if (rules.matches(RuleCategory.CUSTOM_RULES, text)) ruleSets.add("CUSTOM");
    if (!ruleSets.isEmpty()) {
      tokens.add(ctx("RULES", String.join(",", ruleSets)));
    }
    rules.first(RuleCategory.PRIORITY, text).ifPresent(m -> tokens.add(ctx("PRIORITY", m.value())));

    Optional<ResolvedToken> out =
        new OutputFormatResolver(vocabulary, rules, options)
            .resolve(context.analyzer().analyze(text), null);
    out.ifPresent(tokens::add);

    String remainder =
        new PromptMinimizer(vocabulary, context.analyzer(), rules)
            .minimize(text, role.isPresent(), out.isPresent());

    List<String> rendered = tokens.stream().map(ResolvedToken::render).toList();
    String header = String.join(" ", rendered);
    String compressed;
    if (remainder.isBlank()) {
      compressed = header;
    } else if (header.isEmpty()) {
      compressed = remainder;
    } else {
      compressed = header + "\n" + remainder;
    }

    PromptTemplate template = PromptTemplate.of(text);
    List<ValidationIssue> issues = validator.validate(template, role.isPresent());
    if (!issues.isEmpty()) {
      log.debug("Configuration prompt validation: {}", issues);
    }
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("mode", PromptEncoder.Mode.CONFIGURATION.name());
    role.ifPresent(r -> metadata.put("role", r));
    metadata.put("placeholders", template.names());
    metadata.put("validation", issues);
    return new EncoderOutput(ComponentKind.SYSTEM_PROMPT, text, rendered, compressed, metadata);
  }

  /** Rendered role value without its leading filler adjectives. */
  static String role(RuleMatch match, Vocabulary vocabulary) {
    List<String> words = Arrays.asList(match.value().split("_"));
    int first = 0;
    while (first < words.size() - 1
        && vocabulary.isRoleFiller(words.get(first).toLowerCase(Locale.ROOT))) {
      first++;
    }
    return TextUtility.toTokenValue(String.join(" ", words.subList(first, words.size())));
  }

  private static ResolvedToken ctx(String key, String value) {
    return ResolvedToken.builder(TokenCategory.CTX).attribute(key, value).build();
  }
}
