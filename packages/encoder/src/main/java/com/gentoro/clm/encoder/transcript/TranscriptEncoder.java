package com.gentoro.clm.encoder.transcript;

import com.gentoro.clm.encoder.ComponentKind;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.encoder.transcript.TranscriptAnalysis.AgentAction;
import com.gentoro.clm.exception.InvalidInputException;
import com.gentoro.clm.exception.LanguageNotSupportedException;
import com.gentoro.clm.output.EncoderOutput;
import com.gentoro.clm.resolve.RuleEvaluator;
import com.gentoro.clm.token.ResolvedToken;
import com.gentoro.clm.token.TokenCategory;
import com.gentoro.clm.vocabulary.TranscriptLexicon;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Encodes a customer service transcript as
 * {@code CALL [CUSTOMER] [CONTACT] ISSUE ACTION* RESOLUTION SENTIMENT}.
 */
public final class TranscriptEncoder {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(TranscriptEncoder.class);

  public EncoderOutput encode(String transcript, EncodingContext context) {
    TranscriptLexicon lexicon =
        context
            .vocabulary()
            .transcriptLexicon()
            .orElseThrow(
                () ->
                    new LanguageNotSupportedException(
                        context.languagePack().code(), "no transcript lexicon"));
    List<Turn> turns = new TranscriptParser(lexicon, context.metadataString("agent")).parse(transcript);
    if (turns.isEmpty()) {
      throw new InvalidInputException("Transcript has no speaker turns");
    }
    log.debug("Parsed {} transcript turns", turns.size());
    TranscriptAnalysis analysis =
        new TranscriptAnalyzer(context, new RuleEvaluator(context), lexicon).analyze(turns);

    List<String> tokens = render(analysis);
    Map<String, Object> metadata = new LinkedHashMap<>();
    metadata.put("turns", turns.size());
    metadata.put("speakers", TranscriptParser.roles(turns).stream().map(Enum::name).toList());
    return new EncoderOutput(
        ComponentKind.TRANSCRIPT, transcript, tokens, String.join(" ", tokens), metadata);
  }

  static List<String> render(TranscriptAnalysis analysis) {
    List<ResolvedToken> tokens = new ArrayList<>();
    TranscriptAnalysis.CallInfo call = analysis.call();
    tokens.add(
        ResolvedToken.builder(TokenCategory.CALL)
            .value(call.type())
            .attribute("AGENT", call.agent())
            .attribute("DURATION", call.durationMinutes() + "m")
            .attribute("CHANNEL", call.channel())
            .build());

    TranscriptAnalysis.CustomerProfile customer = analysis.customer();
    if (!customer.isEmpty()) {
      tokens.add(
          ResolvedToken.builder(TokenCategory.CUSTOMER)
              .attribute("NAME", customer.name() == null ? null : customer.name().replace(' ', '_'))
              .attribute("ACCOUNT", customer.account())
              .attribute("TIER", customer.tier())
              .build());
    }
    TranscriptAnalysis.ContactInfo contact = analysis.contact();
    if (!contact.isEmpty()) {
      tokens.add(
          ResolvedToken.builder(TokenCategory.CONTACT)
              .attribute("EMAIL", contact.email())
              .attribute("PHONE", contact.phone())
              .attribute("ORDER", contact.order())
              .attribute("TRACKING", contact.tracking())
              .build());
    }

    TranscriptAnalysis.Issue issue = analysis.issue();
    tokens.add(
        ResolvedToken.builder(TokenCategory.ISSUE)
            .value(issue.type())
            .attribute("SEVERITY", issue.severity())
            .attribute("AMOUNTS", String.join("+", issue.amounts()))
            .attribute("FREQ", issue.frequency())
            .attribute("IMPACT", issue.impact())
            .build());

    for (AgentAction action : analysis.actions()) {
      tokens.add(
          ResolvedToken.builder(TokenCategory.ACTION)
              .value(action.type())
              .attribute("RESULT", action.result())
              .attribute("REFERENCE", action.reference())
              .attribute("TIMELINE", action.timeline())
              .attribute("AMOUNT", action.amount())
              .attribute("METHOD", action.method())
              .build());
    }

    TranscriptAnalysis.Resolution resolution = analysis.resolution();
    tokens.add(
        ResolvedToken.builder(TokenCategory.RESOLUTION)
            .value(resolution.state())
            .attribute("TIMELINE", resolution.timeline())
            .attribute("TICKET", resolution.ticket())
            .build());

    tokens.add(ResolvedToken.builder(TokenCategory.SENTIMENT).sequence(analysis.sentiment()).build());
    return tokens.stream().map(ResolvedToken::render).toList();
  }
}
