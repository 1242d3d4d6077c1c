package com.gentoro.clm.vocabulary;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/** Immutable keyword indexes used by the transcript encoder. */
public final class TranscriptLexicon {
  private final PhraseIndex speakers;
  private final PhraseIndex callTypes;
  private final PhraseIndex issueTypes;
  private final PhraseIndex severity;
  private final PhraseIndex frequency;
  private final PhraseIndex impact;
  private final PhraseIndex actionTypes;
  private final PhraseIndex actionResults;
  private final PhraseIndex paymentMethods;
  private final PhraseIndex resolutionStates;
  private final PhraseIndex emotions;
  private final PhraseIndex tiers;
  private final List<String> issueTypeOrder;
  private final List<String> callTypeOrder;

  TranscriptLexicon(TranscriptLexiconDocument doc) {
    this.speakers = PhraseIndex.of(doc.getSpeakers(), false);
    this.callTypes = PhraseIndex.of(doc.getCallTypes(), false);
    this.issueTypes = PhraseIndex.of(doc.getIssueTypes(), false);
    this.severity = PhraseIndex.of(doc.getSeverity(), false);
    this.frequency = PhraseIndex.of(doc.getFrequency(), false);
    this.impact = PhraseIndex.of(doc.getImpact(), false);
    this.actionTypes = PhraseIndex.of(doc.getActionTypes(), false);
    this.actionResults = PhraseIndex.of(doc.getActionResults(), false);
    this.paymentMethods = PhraseIndex.of(doc.getPaymentMethods(), false);
    this.resolutionStates = PhraseIndex.of(doc.getResolutionStates(), false);
    this.emotions = PhraseIndex.of(doc.getEmotions(), false);
    this.tiers = PhraseIndex.of(doc.getTiers(), false);
    this.issueTypeOrder = keys(doc.getIssueTypes());
    this.callTypeOrder = keys(doc.getCallTypes());
  }

  public PhraseIndex speakers() {
    return speakers;
  }

  public PhraseIndex callTypes() {
    return callTypes;
  }

  public PhraseIndex issueTypes() {
    return issueTypes;
  }

  public PhraseIndex severity() {
    return severity;
  }

  public PhraseIndex frequency() {
    return frequency;
  }

  public PhraseIndex impact() {
    return impact;
  }

  public PhraseIndex actionTypes() {
    return actionTypes;
  }

  public PhraseIndex actionResults() {
    return actionResults;
  }

  public PhraseIndex paymentMethods() {
    return paymentMethods;
  }

  public PhraseIndex resolutionStates() {
    return resolutionStates;
  }

  public PhraseIndex emotions() {
    return emotions;
  }

  public PhraseIndex tiers() {
    return tiers;
  }

  /** Declaration order of issue types; earlier types win score ties. */
  public List<String> issueTypeOrder() {
    return issueTypeOrder;
  }

  public List<String> callTypeOrder() {
    return callTypeOrder;
  }

  private static List<String> keys(Map<String, List<String>> map) {
    if (map == null) return List.of();
    return map.keySet().stream().map(k -> k.trim().toUpperCase(Locale.ROOT)).toList();
  }
}
