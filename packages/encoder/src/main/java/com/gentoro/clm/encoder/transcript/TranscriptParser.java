package com.gentoro.clm.encoder.transcript;

import com.gentoro.clm.utility.TextUtility;
import com.gentoro.clm.vocabulary.TranscriptLexicon;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a transcript into turns of the form {@code [timestamp] Speaker: text}. The timestamp is
 * a clock time or a bracketed turn number. Lines without a speaker prefix continue the previous
 * turn.
 *
 * <p>Labels are classified with the speaker keywords of the lexicon and the agent name passed in
 * by the caller. A label that is still unknown takes the role opposite to the one the known
 * labels already cover (a bare name next to {@code Agent:} is the customer); otherwise it is
 * {@link Speaker#SYSTEM}.
 */
public final class TranscriptParser {
  private static final String CLOCK = "\\d{1,2}:\\d{2}(?::\\d{2})?";

  // group 1 or 2: clock time; a bracketed plain number is a turn counter and carries no time
  private static final Pattern LINE =
      Pattern.compile(
          "^\\s*(?:(?:\\[(?:("
              + CLOCK
              + ")|\\d+)\\]|("
              + CLOCK
              + "))\\s*[-–]?\\s*)?"
              + "([A-Za-z][\\w.'()-]*(?:\\s[\\w.'()-]+){0,3})\\s*:\\s*(.*)$");

  private final TranscriptLexicon lexicon;
  private final String agentName;

  /**
   * @param agentName agent name supplied by the caller, may be null
   */
  public TranscriptParser(TranscriptLexicon lexicon, String agentName) {
    this.lexicon = lexicon;
    this.agentName = agentName == null ? null : agentName.trim().toLowerCase(Locale.ROOT);
  }

  public List<Turn> parse(String transcript) {
    List<Turn> turns = new ArrayList<>();
    if (transcript == null) return turns;
    for (String line : transcript.split("\\R")) {
      if (line.isBlank()) continue;
      Matcher m = LINE.matcher(line);
      if (m.matches() && !m.group(4).startsWith("//")) {
        String label = m.group(3).trim();
        String clock = m.group(1) != null ? m.group(1) : m.group(2);
        turns.add(new Turn(turns.size(), label, known(label), seconds(clock), m.group(4).trim()));
      } else if (!turns.isEmpty()) {
        int last = turns.size() - 1;
        turns.set(last, turns.get(last).append(line));
      }
    }
    return resolveUnknown(turns);
  }

  /** Distinct roles among the parsed turns. */
  public static Set<Speaker> roles(List<Turn> turns) {
    Set<Speaker> roles = EnumSet.noneOf(Speaker.class);
    turns.forEach(t -> roles.add(t.speaker()));
    return roles;
  }

  private Speaker known(String label) {
    String lower = TextUtility.lower(label);
    if (agentName != null && (lower.equals(agentName) || lower.contains("(" + agentName + ")"))) {
      return Speaker.AGENT;
    }
    String role = lexicon.speakers().first(lower);
    if (role == null) return null;
    try {
      return Speaker.valueOf(role);
    } catch (IllegalArgumentException e) {
      return Speaker.SYSTEM;
    }
  }

  private static List<Turn> resolveUnknown(List<Turn> turns) {
    Set<Speaker> seen = EnumSet.noneOf(Speaker.class);
    turns.stream().filter(t -> t.speaker() != null).forEach(t -> seen.add(t.speaker()));
    Speaker fill = Speaker.SYSTEM;
    if (seen.contains(Speaker.AGENT) && !seen.contains(Speaker.CUSTOMER)) {
      fill = Speaker.CUSTOMER;
    } else if (seen.contains(Speaker.CUSTOMER) && !seen.contains(Speaker.AGENT)) {
      fill = Speaker.AGENT;
    }
    List<Turn> out = new ArrayList<>(turns.size());
    for (Turn t : turns) {
      out.add(t.speaker() == null ? t.withSpeaker(fill) : t);
    }
    return out;
  }

  static Integer seconds(String timestamp) {
    if (timestamp == null) return null;
    String[] parts = timestamp.split(":");
    int total = 0;
    for (String part : parts) {
      total = total * 60 + Integer.parseInt(part);
    }
    return total;
  }
}
