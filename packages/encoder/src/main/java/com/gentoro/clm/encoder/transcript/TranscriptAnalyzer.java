package com.gentoro.clm.encoder.transcript;

import com.gentoro.clm.config.TranscriptOptions;
import com.gentoro.clm.encoder.EncodingContext;
import com.gentoro.clm.encoder.transcript.TranscriptAnalysis.AgentAction;
import com.gentoro.clm.encoder.transcript.TranscriptAnalysis.CallInfo;
import com.gentoro.clm.encoder.transcript.TranscriptAnalysis.ContactInfo;
import com.gentoro.clm.encoder.transcript.TranscriptAnalysis.CustomerProfile;
import com.gentoro.clm.encoder.transcript.TranscriptAnalysis.Issue;
import com.gentoro.clm.encoder.transcript.TranscriptAnalysis.Resolution;
import com.gentoro.clm.nlp.AnalyzedText;
import com.gentoro.clm.nlp.EntityType;
import com.gentoro.clm.nlp.NamedEntity;
import com.gentoro.clm.resolve.RuleEvaluator;
import com.gentoro.clm.utility.TextUtility;
import com.gentoro.clm.vocabulary.PhraseIndex;
import com.gentoro.clm.vocabulary.TranscriptLexicon;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Derives call, customer, issue, action, resolution and sentiment facts from parsed turns.
 * Issue and call type are scored by distinct keyword hits in customer turns; ties go to the type
 * declared first in the lexicon.
 */
public final class TranscriptAnalyzer {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(TranscriptAnalyzer.class);

  static final String GENERAL_INQUIRY = "GENERAL_INQUIRY";
  static final String SUPPORT = "SUPPORT";
  static final String SALES = "SALES";
  static final String UNKNOWN = "UNKNOWN";
  static final List<String> SEVERITY_ORDER = List.of("LOW", "MEDIUM", "HIGH", "CRITICAL");
  /** Turns from the end inspected for the resolution state. */
  static final int RESOLUTION_WINDOW = 3;

  private static final Pattern LABEL_NAME = Pattern.compile("\\(([^)]+)\\)");
  private static final Pattern DIGITS = Pattern.compile("\\d+");

  private final EncodingContext context;
  private final TranscriptLexicon lexicon;
  private final TimelineNormalizer timelines;

  public TranscriptAnalyzer(EncodingContext context, RuleEvaluator rules, TranscriptLexicon lexicon) {
    this.context = context;
    this.lexicon = lexicon;
    this.timelines = new TimelineNormalizer(rules, context.rules());
  }

  public TranscriptAnalysis analyze(List<Turn> turns) {
    List<AnalyzedText> analyzed = new ArrayList<>(turns.size());
    for (Turn turn : turns) {
      analyzed.add(context.analyzer().analyze(turn.text()));
    }
    List<Turn> customerTurns = bySpeaker(turns, Speaker.CUSTOMER);
    String customerText =
        TextUtility.lower(joined(customerTurns.isEmpty() ? turns : customerTurns));
    String allText = TextUtility.lower(joined(turns));

    Issue issue = issue(turns, analyzed, customerText);
    TranscriptAnalysis analysis =
        new TranscriptAnalysis(
            call(turns, analyzed, customerText),
            customer(turns, analyzed, allText),
            contact(analyzed),
            issue,
            actions(turns, analyzed),
            resolution(turns, analyzed),
            new SentimentAnalyzer(
                    lexicon.emotions(), context.configuration().transcript().maxSentimentStates())
                .trajectory(customerTurns));
    log.debug("Transcript analysis: {}", analysis);
    return analysis;
  }

  private CallInfo call(List<Turn> turns, List<AnalyzedText> analyzed, String customerText) {
    TranscriptOptions options = context.configuration().transcript();
    Map<String, Integer> scores = scores(lexicon.callTypes(), customerText);
    String type;
    if (scores.containsKey(SALES)) {
      type = SALES;
    } else {
      type = best(scores, lexicon.callTypeOrder()).orElse(SUPPORT);
    }
    String channel = context.metadataString("channel");
    return new CallInfo(
        type,
        agent(turns, analyzed),
        duration(turns),
        channel == null ? options.defaultChannel() : channel.toUpperCase(Locale.ROOT));
  }

  private String agent(List<Turn> turns, List<AnalyzedText> analyzed) {
    String name = context.metadataString("agent");
    if (name == null) {
      for (Turn turn : bySpeaker(turns, Speaker.AGENT)) {
        Matcher m = LABEL_NAME.matcher(turn.label());
        if (m.find()) {
          name = m.group(1).trim();
          break;
        }
      }
    }
    if (name == null) {
      name = firstEntity(turns, analyzed, Speaker.AGENT, EntityType.PERSON);
    }
    return name == null ? null : name.replaceAll("\\s+", "_");
  }

  /** Minutes from metadata, else from timestamps, else two turns per minute. */
  int duration(List<Turn> turns) {
    String declared = context.metadataString("duration");
    if (declared != null) {
      Matcher m = DIGITS.matcher(declared);
      if (m.find()) {
        return Math.max(1, Integer.parseInt(m.group()));
      }
    }
    Integer first = null;
    Integer last = null;
    for (Turn turn : turns) {
      if (turn.seconds() == null) continue;
      if (first == null) first = turn.seconds();
      last = turn.seconds();
    }
    if (first != null && last > first) {
      return Math.max(1, (int) Math.ceil((last - first) / 60.0));
    }
    return Math.max(1, turns.size() / 2);
  }

  private CustomerProfile customer(List<Turn> turns, List<AnalyzedText> analyzed, String allText) {
    return new CustomerProfile(
        firstEntity(turns, analyzed, Speaker.CUSTOMER, EntityType.PERSON),
        firstEntity(turns, analyzed, null, EntityType.ACCOUNT),
        lexicon.tiers().first(allText));
  }

  private static ContactInfo contact(List<AnalyzedText> analyzed) {
    return new ContactInfo(
        firstEntity(analyzed, EntityType.EMAIL),
        firstEntity(analyzed, EntityType.PHONE),
        firstEntity(analyzed, EntityType.ORDER),
        firstEntity(analyzed, EntityType.TRACKING));
  }

  private Issue issue(List<Turn> turns, List<AnalyzedText> analyzed, String customerText) {
    String type =
        best(scores(lexicon.issueTypes(), customerText), lexicon.issueTypeOrder())
            .orElse(GENERAL_INQUIRY);
    String severity = "LOW";
    for (PhraseIndex.PhraseMatch m : lexicon.severity().findAll(customerText)) {
      if (SEVERITY_ORDER.indexOf(m.token()) > SEVERITY_ORDER.indexOf(severity)) {
        severity = m.token();
      }
    }
    Set<String> amounts = new LinkedHashSet<>();
    for (int i = 0; i < turns.size(); i++) {
      if (turns.get(i).speaker() == Speaker.CUSTOMER) {
        analyzed.get(i).entities(EntityType.MONEY).forEach(e -> amounts.add(e.value()));
      }
    }
    return new Issue(
        type,
        severity,
        new ArrayList<>(amounts),
        lexicon.frequency().first(customerText),
        lexicon.impact().first(customerText));
  }

  /** One action per type, from agent turns in chronological order. */
  private List<AgentAction> actions(List<Turn> turns, List<AnalyzedText> analyzed) {
    List<AgentAction> actions = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (int i = 0; i < turns.size(); i++) {
      Turn turn = turns.get(i);
      if (turn.speaker() != Speaker.AGENT) continue;
      String lower = TextUtility.lower(turn.text());
      for (PhraseIndex.PhraseMatch m : lexicon.actionTypes().findAll(lower)) {
        if (!seen.add(m.token())) continue;
        AnalyzedText text = analyzed.get(i);
        actions.add(
            new AgentAction(
                m.token(),
                lexicon.actionResults().first(lower),
                firstValue(text, EntityType.REFERENCE),
                timelines.find(turn.text()).orElse(null),
                firstValue(text, EntityType.MONEY),
                lexicon.paymentMethods().first(lower)));
      }
    }
    return actions;
  }

  private Resolution resolution(List<Turn> turns, List<AnalyzedText> analyzed) {
    String state = null;
    String ticket = null;
    int from = Math.max(0, turns.size() - RESOLUTION_WINDOW);
    for (int i = turns.size() - 1; i >= from; i--) {
      Turn turn = turns.get(i);
      if (turn.speaker() == Speaker.SYSTEM) continue;
      if (state == null) {
        state = lexicon.resolutionStates().first(TextUtility.lower(turn.text()));
      }
      if (ticket == null) {
        ticket = firstValue(analyzed.get(i), EntityType.REFERENCE);
      }
    }
    String timeline = null;
    for (int i = turns.size() - 1; i >= 0 && timeline == null; i--) {
      if (turns.get(i).speaker() == Speaker.AGENT) {
        timeline = timelines.find(turns.get(i).text()).orElse(null);
      }
    }
    return new Resolution(state == null ? UNKNOWN : state, timeline, ticket);
  }

  /** Distinct keyword hits per token. */
  static Map<String, Integer> scores(PhraseIndex index, String lowerText) {
    Map<String, Set<String>> phrases = new LinkedHashMap<>();
    for (PhraseIndex.PhraseMatch m : index.findAll(lowerText)) {
      phrases.computeIfAbsent(m.token(), k -> new HashSet<>()).add(m.phrase());
    }
    Map<String, Integer> scores = new HashMap<>();
    phrases.forEach((token, hits) -> scores.put(token, hits.size()));
    return scores;
  }

  static Optional<String> best(Map<String, Integer> scores, List<String> order) {
    String best = null;
    int bestScore = 0;
    for (String token : order) {
      int score = scores.getOrDefault(token, 0);
      if (score > bestScore) {
        best = token;
        bestScore = score;
      }
    }
    return Optional.ofNullable(best);
  }

  private static List<Turn> bySpeaker(List<Turn> turns, Speaker speaker) {
    return turns.stream().filter(t -> t.speaker() == speaker).toList();
  }

  private static String joined(List<Turn> turns) {
    StringBuilder sb = new StringBuilder();
    for (Turn turn : turns) {
      sb.append(turn.text()).append('\n');
    }
    return sb.toString();
  }

  private static String firstEntity(
      List<Turn> turns, List<AnalyzedText> analyzed, Speaker speaker, EntityType type) {
    for (int i = 0; i < turns.size(); i++) {
      if (speaker != null && turns.get(i).speaker() != speaker) continue;
      String value = firstValue(analyzed.get(i), type);
      if (value != null) return value;
    }
    return null;
  }

  private static String firstEntity(List<AnalyzedText> analyzed, EntityType type) {
    for (AnalyzedText text : analyzed) {
      String value = firstValue(text, type);
      if (value != null) return value;
    }
    return null;
  }

  private static String firstValue(AnalyzedText text, EntityType type) {
    List<NamedEntity> entities = text.entities(type);
    return entities.isEmpty() ? null : entities.get(0).value();
  }
}
