package com.gentoro.clm.encoder.prompt;

import com.gentoro.clm.config.PromptOptions;
import com.gentoro.clm.encoder.ComponentKind;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.nlp.AnalyzedText;
import com.gentoro.clm.output.EncoderOutput;
import com.gentoro.clm.quality.GateInput;
import com.gentoro.clm.quality.GateResult;
import com.gentoro.clm.quality.QualityGates;
import com.gentoro.clm.resolve.AttributeResolution;
import com.gentoro.clm.resolve.AttributeResolver;
import com.gentoro.clm.resolve.ClauseFilter;
import com.gentoro.clm.resolve.OutputFormatResolver;
import com.gentoro.clm.resolve.RuleEvaluator;
import com.gentoro.clm.resolve.TargetResolution;
import com.gentoro.clm.resolve.TargetResolver;
import com.gentoro.clm.resolve.intent.IntentCandidate;
import com.gentoro.clm.resolve.intent.IntentContext;
import com.gentoro.clm.resolve.intent.IntentResolution;
import com.gentoro.clm.resolve.intent.IntentResolver;
import com.gentoro.clm.token.ResolvedToken;
import com.gentoro.clm.token.TokenCategory;
import com.gentoro.clm.vocabulary.Vocabulary;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/** Task mode: {@code REQ TARGET REF EXTRACT CTX... OUT}, space separated. */
final class TaskPromptEncoder {
  static final String INPUT = "INPUT";
  static final String CATALOG = "CATALOG";

  private static final Set<TokenCategory> TARGET_SIDE =
      Set.of(TokenCategory.TARGET, TokenCategory.REF, TokenCategory.EXTRACT);

  private final IntentResolver intents;

  TaskPromptEncoder(IntentResolver intents) {
    this.intents = intents;
  }

  EncoderOutput encode(String text, EncodingContext context, RuleEvaluator rules) {
    Vocabulary vocabulary = context.vocabulary();
    PromptOptions options = context.configuration().prompt();
    AnalyzedText analyzed = context.analyzer().analyze(text);
    ClauseFilter clauses = new ClauseFilter(rules, text);

    IntentResolution intent =
        intents.resolve(new IntentContext(analyzed, vocabulary, clauses), options);
    TargetResolution target =
        new TargetResolver(vocabulary, rules).resolve(analyzed, clauses, intent.defaultTarget());
    AttributeResolution attributes =
        new AttributeResolver(vocabulary, context.rules(), rules).resolve(analyzed);
    Optional<ResolvedToken> out =
        new OutputFormatResolver(vocabulary, rules, options).resolve(analyzed, target.outputItem());

    List<ResolvedToken> tokens = new ArrayList<>();
    if (intent.isEmpty()) {
      context.diagnostic("no_intent");
    } else {
      ResolvedToken.Builder req =
          ResolvedToken.builder(TokenCategory.REQ)
              .values(intent.actions())
              .join(ResolvedToken.Join.CHAIN);
      attributes.actionAttributes().forEach(req::attribute);
      tokens.add(req.build());
    }
    targetToken(target).ifPresentOrElse(tokens::add, () -> context.diagnostic("no_target"));
    if (target.catalogName() != null) {
      tokens.add(
          ResolvedToken.builder(TokenCategory.REF)
              .value(CATALOG)
              .attribute("NAME", target.catalogName())
              .build());
    }
    if (!target.extractionFields().isEmpty()) {
      tokens.add(ResolvedToken.builder(TokenCategory.EXTRACT).values(target.extractionFields()).build());
    }
    attributes
        .context()
        .forEach(
            (key, values) ->
                tokens.add(
                    ResolvedToken.builder(TokenCategory.CTX)
                        .attribute(key, String.join(",", values))
                        .build()));
    out.ifPresent(tokens::add);

    List<String> rendered = tokens.stream().map(ResolvedToken::render).toList();
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("mode", PromptEncoder.Mode.TASK.name());
    metadata.put("intents", intentMetadata(intent));
    metadata.put("strategies", intent.strategies());
    List<GateResult> gates =
        QualityGates.forVocabulary(vocabulary)
            .run(GateInput.of(analyzed, intent.actions(), targetSide(tokens)));
    metadata.put(QualityGates.RESULTS, gates);
    metadata.put(QualityGates.STATUS, QualityGates.overall(gates).name());
    return new EncoderOutput(
        ComponentKind.SYSTEM_PROMPT, text, rendered, String.join(" ", rendered), metadata);
  }

  static Optional<ResolvedToken> targetToken(TargetResolution target) {
    if (target.catalogImplied()) {
      ResolvedToken.Builder flow =
          ResolvedToken.builder(TokenCategory.TARGET)
              .join(ResolvedToken.Join.FLOW)
              .value(target.targets().isEmpty() ? INPUT : target.targets().get(0))
              .value(CATALOG);
      if (target.outputItem() != null) {
        flow.value(target.outputItem() + "[]");
      }
      flow.attribute("DOMAIN", target.domain());
      return Optional.of(flow.build());
    }
    if (target.targets().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(
        ResolvedToken.builder(TokenCategory.TARGET)
            .values(target.targets())
            .attribute("DOMAIN", target.domain())
            .build());
  }

  private static List<String> targetSide(List<ResolvedToken> tokens) {
    return tokens.stream()
        .filter(t -> TARGET_SIDE.contains(t.category()))
        .map(ResolvedToken::render)
        .toList();
  }

  private static List<Map<String, Object>> intentMetadata(IntentResolution intent) {
    List<Map<String, Object>> out = new ArrayList<>();
    for (IntentCandidate c : intent.candidates()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("action", c.action());
      entry.put("confidence", c.confidence());
      entry.put("strategy", c.strategy());
      out.add(entry);
    }
    return out;
  }
}
