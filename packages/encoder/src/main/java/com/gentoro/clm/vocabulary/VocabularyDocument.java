package com.gentoro.clm.vocabulary;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gentoro.clm.utility.CollectionUtility;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Vocabulary resource as written in {@code vocabulary/<lang>.yaml}.
 *
 * <p>The document is a plain data holder. Maps go from a canonical token to its synonyms, so
 * new synonyms are added by editing YAML, never code. A base document and an optional overlay
 * are merged with {@link #merge(VocabularyDocument)} into a new document; neither input is
 * modified.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class VocabularyDocument {

  @JsonProperty("language")
  private String language;

  @JsonProperty("actions")
  private Map<String, List<String>> actions = new LinkedHashMap<>();

  @JsonProperty("action_phrases")
  private Map<String, List<String>> actionPhrases = new LinkedHashMap<>();

  @JsonProperty("action_modifiers")
  private Map<String, List<String>> actionModifiers = new LinkedHashMap<>();

  @JsonProperty("imperatives")
  private List<ImperativeTemplate> imperatives = new ArrayList<>();

  @JsonProperty("question_intents")
  private Map<String, List<String>> questionIntents = new LinkedHashMap<>();

  @JsonProperty("pipelines")
  private List<List<String>> pipelines = new ArrayList<>();

  @JsonProperty("targets")
  private Map<String, List<String>> targets = new LinkedHashMap<>();

  @JsonProperty("compound_phrases")
  private Map<String, List<String>> compoundPhrases = new LinkedHashMap<>();

  @JsonProperty("target_subsumes")
  private Map<String, List<String>> targetSubsumes = new LinkedHashMap<>();

  @JsonProperty("extraction_fields")
  private Map<String, List<String>> extractionFields = new LinkedHashMap<>();

  @JsonProperty("output_formats")
  private Map<String, List<String>> outputFormats = new LinkedHashMap<>();

  @JsonProperty("domain_keywords")
  private Map<String, List<String>> domainKeywords = new LinkedHashMap<>();

  @JsonProperty("stop_words")
  private List<String> stopWords = new ArrayList<>();

  @JsonProperty("noise_verbs")
  private List<String> noiseVerbs = new ArrayList<>();

  @JsonProperty("role_fillers")
  private List<String> roleFillers = new ArrayList<>();

  @JsonProperty("closed_class")
  private Map<String, List<String>> closedClass = new LinkedHashMap<>();

  @JsonProperty("transcript")
  private TranscriptLexiconDocument transcript;

  public VocabularyDocument() {}

  public String getLanguage() {
    return language;
  }

  public void setLanguage(String language) {
    this.language = language;
  }

  public Map<String, List<String>> getActions() {
    return actions;
  }

  public void setActions(Map<String, List<String>> actions) {
    this.actions = actions;
  }

  public Map<String, List<String>> getActionPhrases() {
    return actionPhrases;
  }

  public void setActionPhrases(Map<String, List<String>> actionPhrases) {
    this.actionPhrases = actionPhrases;
  }

  public Map<String, List<String>> getActionModifiers() {
    return actionModifiers;
  }

  public void setActionModifiers(Map<String, List<String>> actionModifiers) {
    this.actionModifiers = actionModifiers;
  }

  public List<ImperativeTemplate> getImperatives() {
    return imperatives;
  }

  public void setImperatives(List<ImperativeTemplate> imperatives) {
    this.imperatives = imperatives;
  }

  public Map<String, List<String>> getQuestionIntents() {
    return questionIntents;
  }

  public void setQuestionIntents(Map<String, List<String>> questionIntents) {
    this.questionIntents = questionIntents;
  }

  public List<List<String>> getPipelines() {
    return pipelines;
  }

  public void setPipelines(List<List<String>> pipelines) {
    this.pipelines = pipelines;
  }

  public Map<String, List<String>> getTargets() {
    return targets;
  }

  public void setTargets(Map<String, List<String>> targets) {
    this.targets = targets;
  }

  public Map<String, List<String>> getCompoundPhrases() {
    return compoundPhrases;
  }

  public void setCompoundPhrases(Map<String, List<String>> compoundPhrases) {
    this.compoundPhrases = compoundPhrases;
  }

  public Map<String, List<String>> getTargetSubsumes() {
    return targetSubsumes;
  }

  public void setTargetSubsumes(Map<String, List<String>> targetSubsumes) {
    this.targetSubsumes = targetSubsumes;
  }

  public Map<String, List<String>> getExtractionFields() {
    return extractionFields;
  }

  public void setExtractionFields(Map<String, List<String>> extractionFields) {
    this.extractionFields = extractionFields;
  }

  public Map<String, List<String>> getOutputFormats() {
    return outputFormats;
  }

  public void setOutputFormats(Map<String, List<String>> outputFormats) {
    this.outputFormats = outputFormats;
  }

  public Map<String, List<String>> getDomainKeywords() {
    return domainKeywords;
  }

  public void setDomainKeywords(Map<String, List<String>> domainKeywords) {
    this.domainKeywords = domainKeywords;
  }

  public List<String> getStopWords() {
    return stopWords;
  }

  public void setStopWords(List<String> stopWords) {
    this.stopWords = stopWords;
  }

  public List<String> getNoiseVerbs() {
    return noiseVerbs;
  }

  public void setNoiseVerbs(List<String> noiseVerbs) {
    this.noiseVerbs = noiseVerbs;
  }

  public List<String> getRoleFillers() {
    return roleFillers;
  }

  public void setRoleFillers(List<String> roleFillers) {
    this.roleFillers = roleFillers;
  }

  public Map<String, List<String>> getClosedClass() {
    return closedClass;
  }

  public void setClosedClass(Map<String, List<String>> closedClass) {
    this.closedClass = closedClass;
  }

  public TranscriptLexiconDocument getTranscript() {
    return transcript;
  }

  public void setTranscript(TranscriptLexiconDocument transcript) {
    this.transcript = transcript;
  }

  /**
   * Merge an overlay on top of this document. Synonym lists are concatenated per token, overlay
   * imperatives and pipelines are appended, and an overlay transcript lexicon is merged the same
   * way. Returns a new instance.
   */
  public VocabularyDocument merge(VocabularyDocument overlay) {
    VocabularyDocument out = new VocabularyDocument();
    out.language = language;
    if (overlay == null) {
      overlay = new VocabularyDocument();
    }
    out.actions = CollectionUtility.mergeListMaps(actions, overlay.actions);
    out.actionPhrases = CollectionUtility.mergeListMaps(actionPhrases, overlay.actionPhrases);
    out.actionModifiers = CollectionUtility.mergeListMaps(actionModifiers, overlay.actionModifiers);
    out.questionIntents = CollectionUtility.mergeListMaps(questionIntents, overlay.questionIntents);
    out.targets = CollectionUtility.mergeListMaps(targets, overlay.targets);
    out.compoundPhrases = CollectionUtility.mergeListMaps(compoundPhrases, overlay.compoundPhrases);
    out.targetSubsumes = CollectionUtility.mergeListMaps(targetSubsumes, overlay.targetSubsumes);
    out.extractionFields =
        CollectionUtility.mergeListMaps(extractionFields, overlay.extractionFields);
    out.outputFormats = CollectionUtility.mergeListMaps(outputFormats, overlay.outputFormats);
    out.domainKeywords = CollectionUtility.mergeListMaps(domainKeywords, overlay.domainKeywords);
    out.closedClass = CollectionUtility.mergeListMaps(closedClass, overlay.closedClass);
    out.stopWords = concat(stopWords, overlay.stopWords);
    out.noiseVerbs = concat(noiseVerbs, overlay.noiseVerbs);
    out.roleFillers = concat(roleFillers, overlay.roleFillers);
    out.imperatives = concat(imperatives, overlay.imperatives);
    out.pipelines = concat(pipelines, overlay.pipelines);
    if (transcript == null) {
      out.transcript = overlay.transcript;
    } else {
      out.transcript = transcript.merge(overlay.transcript);
    }
    return out;
  }

  private static <T> List<T> concat(List<T> base, List<T> extra) {
    List<T> out = new ArrayList<>();
    if (base != null) out.addAll(base);
    if (extra != null) extra.stream().filter(e -> !out.contains(e)).forEach(out::add);
    return out;
  }

  @Override
  public String toString() {
    return "VocabularyDocument{"
        + "language="
        + language
        + ", actions="
        + (actions == null ? 0 : actions.size())
        + ", targets="
        + (targets == null ? 0 : targets.size())
        + ", extractionFields="
        + (extractionFields == null ? 0 : extractionFields.size())
        + ", transcript="
        + (transcript != null)
        + '}';
  }
}
