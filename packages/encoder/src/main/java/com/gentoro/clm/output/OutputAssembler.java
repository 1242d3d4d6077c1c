package com.gentoro.clm.output;

import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.token.TokenGrammar;
import com.gentoro.clm.utility.TextUtility;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Last stage of every encoder: normalizes whitespace, estimates token counts and enforces the
 * no-regression rule. A compressed form that is not strictly smaller than the original is
 * replaced by the original, and the ratio reported is zero.
 */
public final class OutputAssembler {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(OutputAssembler.class);

  public static final String COMPONENT = "component";
  public static final String LANGUAGE = "language";
  public static final String TOKENS = "tokens";
  public static final String DEGRADED = "degraded";
  public static final String DEGRADED_CATEGORIES = "degraded_categories";
  public static final String DIAGNOSTICS = "diagnostics";
  public static final String GRAMMAR_ISSUES = "grammar_issues";
  public static final String FALLBACK = "fallback";
  public static final String FALLBACK_REASON = "fallback_reason";

  private final TokenEstimator estimator;

  public OutputAssembler(TokenEstimator estimator) {
    this.estimator = estimator;
  }

  public EncodingResult assemble(EncoderOutput output, EncodingContext context) {
    String original = output.original() == null ? "" : output.original();
    String compressed = TextUtility.collapseHorizontalWhitespace(output.compressed());

    Map<String, Object> metadata = new LinkedHashMap<>(context.metadata());
    metadata.put(COMPONENT, output.component().name());
    metadata.put(LANGUAGE, context.languagePack().code());
    metadata.put(TOKENS, List.copyOf(output.tokens()));
    metadata.putAll(output.metadata());
    metadata.put(
        GRAMMAR_ISSUES,
        TokenGrammar.validate(
            String.join(" ", output.tokens()), output.component().tokenCategories()));
    metadata.put(DEGRADED, context.isDegraded());
    if (context.isDegraded()) {
      metadata.put(DEGRADED_CATEGORIES, List.copyOf(context.degradedCategories()));
    }
    if (!context.diagnostics().isEmpty()) {
      metadata.put(DIAGNOSTICS, context.diagnostics());
    }

    int nTokens = estimator.estimate(original);
    int cTokens = estimator.estimate(compressed);
    String reason = null;
    if (compressed.isBlank()) {
      reason = "empty compressed form";
    } else if (compressed.length() >= original.length()) {
      reason =
          "compressed form not smaller than original ("
              + compressed.length()
              + " >= "
              + original.length()
              + " chars)";
    } else if (cTokens >= nTokens) {
      reason = "no token saving (" + cTokens + " >= " + nTokens + " tokens)";
    }

    if (reason != null) {
      log.warn("{} encoding fell back to original: {}", output.component(), reason);
      metadata.put(FALLBACK, true);
      metadata.put(FALLBACK_REASON, reason);
      return new EncodingResult(original, output.component(), original, metadata, nTokens, nTokens);
    }
    metadata.put(FALLBACK, false);
    EncodingResult result =
        new EncodingResult(original, output.component(), compressed, metadata, nTokens, cTokens);
    log.debug("Encoded {}", result);
    return result;
  }
}
