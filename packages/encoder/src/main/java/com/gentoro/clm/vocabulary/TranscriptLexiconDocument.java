package com.gentoro.clm.vocabulary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.clm.utility.CollectionUtility;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** The {@code transcript:} section of a vocabulary resource. Token to keyword lists. */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TranscriptLexiconDocument {

  @JsonProperty("speakers")
  private Map<String, List<String>> speakers = new LinkedHashMap<>();

  @JsonProperty("call_types")
  private Map<String, List<String>> callTypes = new LinkedHashMap<>();

  @JsonProperty("issue_types")
  private Map<String, List<String>> issueTypes = new LinkedHashMap<>();

  @JsonProperty("severity")
  private Map<String, List<String>> severity = new LinkedHashMap<>();

  @JsonProperty("frequency")
  private Map<String, List<String>> frequency = new LinkedHashMap<>();

  @JsonProperty("impact")
  private Map<String, List<String>> impact = new LinkedHashMap<>();

  @JsonProperty("action_types")
  private Map<String, List<String>> actionTypes = new LinkedHashMap<>();

  @JsonProperty("action_results")
  private Map<String, List<String>> actionResults = new LinkedHashMap<>();

  @JsonProperty("payment_methods")
  private Map<String, List<String>> paymentMethods = new LinkedHashMap<>();

  @JsonProperty("resolution_states")
  private Map<String, List<String>> resolutionStates = new LinkedHashMap<>();

  @JsonProperty("emotions")
  private Map<String, List<String>> emotions = new LinkedHashMap<>();

  @JsonProperty("tiers")
  private Map<String, List<String>> tiers = new LinkedHashMap<>();

  public Map<String, List<String>> getSpeakers() {
    return speakers;
  }

  public void setSpeakers(Map<String, List<String>> speakers) {
    this.speakers = speakers;
  }

  public Map<String, List<String>> getCallTypes() {
    return callTypes;
  }

  public void setCallTypes(Map<String, List<String>> callTypes) {
    this.callTypes = callTypes;
  }

  public Map<String, List<String>> getIssueTypes() {
    return issueTypes;
  }

  public void setIssueTypes(Map<String, List<String>> issueTypes) {
    this.issueTypes = issueTypes;
  }

  public Map<String, List<String>> getSeverity() {
    return severity;
  }

  public void setSeverity(Map<String, List<String>> severity) {
    this.severity = severity;
  }

  public Map<String, List<String>> getFrequency() {
    return frequency;
  }

  public void setFrequency(Map<String, List<String>> frequency) {
    this.frequency = frequency;
  }

  public Map<String, List<String>> getImpact() {
    return impact;
  }

  public void setImpact(Map<String, List<String>> impact) {
    this.impact = impact;
  }

  public Map<String, List<String>> getActionTypes() {
    return actionTypes;
  }

  public void setActionTypes(Map<String, List<String>> actionTypes) {
    this.actionTypes = actionTypes;
  }

  public Map<String, List<String>> getActionResults() {
    return actionResults;
  }

  public void setActionResults(Map<String, List<String>> actionResults) {
    this.actionResults = actionResults;
  }

  public Map<String, List<String>> getPaymentMethods() {
    return paymentMethods;
  }

  public void setPaymentMethods(Map<String, List<String>> paymentMethods) {
    this.paymentMethods = paymentMethods;
  }

  public Map<String, List<String>> getResolutionStates() {
    return resolutionStates;
  }

  public void setResolutionStates(Map<String, List<String>> resolutionStates) {
    this.resolutionStates = resolutionStates;
  }

  public Map<String, List<String>> getEmotions() {
    return emotions;
  }

  public void setEmotions(Map<String, List<String>> emotions) {
    this.emotions = emotions;
  }

  public Map<String, List<String>> getTiers() {
    return tiers;
  }

  public void setTiers(Map<String, List<String>> tiers) {
    this.tiers = tiers;
  }

  TranscriptLexiconDocument merge(TranscriptLexiconDocument overlay) {
    if (overlay == null) {
      return this;
    }
    TranscriptLexiconDocument out = new TranscriptLexiconDocument();
    out.speakers = CollectionUtility.mergeListMaps(speakers, overlay.speakers);
    out.callTypes = CollectionUtility.mergeListMaps(callTypes, overlay.callTypes);
    out.issueTypes = CollectionUtility.mergeListMaps(issueTypes, overlay.issueTypes);
    out.severity = CollectionUtility.mergeListMaps(severity, overlay.severity);
    out.frequency = CollectionUtility.mergeListMaps(frequency, overlay.frequency);
    out.impact = CollectionUtility.mergeListMaps(impact, overlay.impact);
    out.actionTypes = CollectionUtility.mergeListMaps(actionTypes, overlay.actionTypes);
    out.actionResults = CollectionUtility.mergeListMaps(actionResults, overlay.actionResults);
    out.paymentMethods = CollectionUtility.mergeListMaps(paymentMethods, overlay.paymentMethods);
    out.resolutionStates =
        CollectionUtility.mergeListMaps(resolutionStates, overlay.resolutionStates);
    out.emotions = CollectionUtility.mergeListMaps(emotions, overlay.emotions);
    out.tiers = CollectionUtility.mergeListMaps(tiers, overlay.tiers);
    return out;
  }
}
