package com.gentoro.clm.vocabulary;

import com.gentoro.clm.nlp.LanguageStemmer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable per-language vocabulary table. Built once per configuration from a base resource plus
 * an optional overlay and shared read-only by every resolver and encoder afterwards.
 *
 * <p>Single-word synonyms are looked up by exact surface form first and by stem second;
 * multi-word synonyms go through a {@link PhraseIndex}.
 */
public final class Vocabulary {
  private final String language;
  private final Map<VocabularyCategory, List<VocabularyEntry>> entries;
  private final Map<VocabularyCategory, Map<String, String>> wordIndex;
  private final Map<VocabularyCategory, Map<String, String>> stemIndex;
  private final Map<VocabularyCategory, PhraseIndex> phraseIndex;
  private final List<ImperativeTemplate> imperatives;
  private final Map<String, ImperativeTemplate> imperativeByTrigger;
  private final List<List<String>> pipelines;
  private final Map<String, Set<String>> targetSubsumes;
  private final Map<String, Set<String>> closedClass;
  private final TranscriptLexicon transcriptLexicon;

  Vocabulary(VocabularyDocument document, LanguageStemmer stemmer) {
    this.language = document.getLanguage();

    Map<VocabularyCategory, Map<String, List<String>>> raw = new EnumMap<>(VocabularyCategory.class);
    raw.put(VocabularyCategory.ACTION, document.getActions());
    raw.put(VocabularyCategory.ACTION_PHRASE, document.getActionPhrases());
    raw.put(VocabularyCategory.ACTION_MODIFIER, document.getActionModifiers());
    raw.put(VocabularyCategory.TARGET, document.getTargets());
    raw.put(VocabularyCategory.COMPOUND_PHRASE, document.getCompoundPhrases());
    raw.put(VocabularyCategory.EXTRACTION_FIELD, document.getExtractionFields());
    raw.put(VocabularyCategory.OUTPUT_FORMAT, document.getOutputFormats());
    raw.put(VocabularyCategory.DOMAIN_KEYWORD, document.getDomainKeywords());
    raw.put(VocabularyCategory.QUESTION_WORD, document.getQuestionIntents());
    raw.put(VocabularyCategory.STOP_WORD, Map.of("STOP", nonNull(document.getStopWords())));
    raw.put(VocabularyCategory.NOISE_VERB, Map.of("NOISE", nonNull(document.getNoiseVerbs())));
    raw.put(VocabularyCategory.ROLE_FILLER, Map.of("FILLER", nonNull(document.getRoleFillers())));

    Map<VocabularyCategory, List<VocabularyEntry>> entryMap = new EnumMap<>(VocabularyCategory.class);
    Map<VocabularyCategory, Map<String, String>> words = new EnumMap<>(VocabularyCategory.class);
    Map<VocabularyCategory, Map<String, String>> stems = new EnumMap<>(VocabularyCategory.class);
    Map<VocabularyCategory, PhraseIndex> phrases = new EnumMap<>(VocabularyCategory.class);
    for (VocabularyCategory category : VocabularyCategory.values()) {
      Map<String, List<String>> source = raw.getOrDefault(category, Map.of());
      List<VocabularyEntry> list = new ArrayList<>();
      Map<String, String> byWord = new HashMap<>();
      Map<String, String> byStem = new HashMap<>();
      Map<String, List<String>> normalized = new LinkedHashMap<>();
      if (source != null) {
        for (Map.Entry<String, List<String>> e : source.entrySet()) {
          String token = e.getKey().trim().toUpperCase(Locale.ROOT);
          List<String> synonyms = new ArrayList<>(new LinkedHashSet<>(normalize(e.getValue())));
          list.add(new VocabularyEntry(category, token, synonyms));
          normalized.put(token, synonyms);
          for (String synonym : synonyms) {
            if (synonym.indexOf(' ') >= 0) continue;
            byWord.putIfAbsent(synonym, token);
            byStem.putIfAbsent(stemmer.stem(synonym), token);
          }
        }
      }
      entryMap.put(category, List.copyOf(list));
      words.put(category, Map.copyOf(byWord));
      stems.put(category, Map.copyOf(byStem));
      phrases.put(category, PhraseIndex.of(normalized, true));
    }
    this.entries = Collections.unmodifiableMap(entryMap);
    this.wordIndex = Collections.unmodifiableMap(words);
    this.stemIndex = Collections.unmodifiableMap(stems);
    this.phraseIndex = Collections.unmodifiableMap(phrases);

    this.imperatives = List.copyOf(nonNull(document.getImperatives()));
    Map<String, ImperativeTemplate> byTrigger = new HashMap<>();
    for (ImperativeTemplate template : imperatives) {
      for (String trigger : template.triggers()) {
        byTrigger.putIfAbsent(trigger, template);
      }
    }
    this.imperativeByTrigger = Map.copyOf(byTrigger);

    List<List<String>> pipelineList = new ArrayList<>();
    for (List<String> pipeline : nonNull(document.getPipelines())) {
      pipelineList.add(pipeline.stream().map(p -> p.trim().toUpperCase(Locale.ROOT)).toList());
    }
    this.pipelines = List.copyOf(pipelineList);
    this.targetSubsumes = upperSets(document.getTargetSubsumes());

    Map<String, Set<String>> closed = new HashMap<>();
    if (document.getClosedClass() != null) {
      document
          .getClosedClass()
          .forEach((k, v) -> closed.put(k.toUpperCase(Locale.ROOT), Set.copyOf(normalize(v))));
    }
    this.closedClass = Map.copyOf(closed);
    this.transcriptLexicon =
        document.getTranscript() == null ? null : new TranscriptLexicon(document.getTranscript());
  }

  public String language() {
    return language;
  }

  public List<VocabularyEntry> entries(VocabularyCategory category) {
    return entries.getOrDefault(category, List.of());
  }

  public boolean hasEntries(VocabularyCategory category) {
    return !entries(category).isEmpty();
  }

  /** Canonical token for a single word, by exact form and then by stem. */
  public Optional<String> lookup(VocabularyCategory category, String lowerWord, String stem) {
    String token = wordIndex.getOrDefault(category, Map.of()).get(lowerWord);
    if (token == null && stem != null && !stem.isEmpty()) {
      token = stemIndex.getOrDefault(category, Map.of()).get(stem);
    }
    return Optional.ofNullable(token);
  }

  /**
   * Action for a single word. A match that only holds by stem is dropped when the word is also a
   * target or extraction-field noun, so {@code items} does not read as {@code itemize}.
   */
  public Optional<String> lookupAction(String lowerWord, String stem) {
    String exact = wordIndex.getOrDefault(VocabularyCategory.ACTION, Map.of()).get(lowerWord);
    if (exact != null) {
      return Optional.of(exact);
    }
    Optional<String> byStem = lookup(VocabularyCategory.ACTION, lowerWord, stem);
    if (byStem.isEmpty()
        || lookup(VocabularyCategory.TARGET, lowerWord, stem).isPresent()
        || lookup(VocabularyCategory.EXTRACTION_FIELD, lowerWord, stem).isPresent()) {
      return Optional.empty();
    }
    return byStem;
  }

  /** Multi-word synonyms of a category. */
  public PhraseIndex phrases(VocabularyCategory category) {
    return phraseIndex.getOrDefault(category, PhraseIndex.empty());
  }

  public boolean isStopWord(String lowerWord) {
    return wordIndex.get(VocabularyCategory.STOP_WORD).containsKey(lowerWord);
  }

  public boolean isNoiseVerb(String lowerWord, String stem) {
    return lookup(VocabularyCategory.NOISE_VERB, lowerWord, stem).isPresent();
  }

  public boolean isRoleFiller(String lowerWord) {
    return wordIndex.get(VocabularyCategory.ROLE_FILLER).containsKey(lowerWord);
  }

  public Optional<ImperativeTemplate> imperative(String lowerWord) {
    return Optional.ofNullable(imperativeByTrigger.get(lowerWord));
  }

  public List<ImperativeTemplate> imperatives() {
    return imperatives;
  }

  public List<List<String>> pipelines() {
    return pipelines;
  }

  /** Generic targets made redundant by a more specific one. */
  public Set<String> subsumedBy(String target) {
    return targetSubsumes.getOrDefault(target, Set.of());
  }

  /** Closed-class word lists keyed by tag name (DET, PRON, PREP, CONJ, MODAL, GENITIVE). */
  public Set<String> closedClass(String tag) {
    return closedClass.getOrDefault(tag, Set.of());
  }

  public Optional<TranscriptLexicon> transcriptLexicon() {
    return Optional.ofNullable(transcriptLexicon);
  }

  private static List<String> normalize(List<String> values) {
    if (values == null) return List.of();
    return values.stream()
        .filter(v -> v != null && !v.isBlank())
        .map(PhraseIndex::normalize)
        .toList();
  }

  private static <T> List<T> nonNull(List<T> values) {
    return values == null ? List.of() : values;
  }

  private static Map<String, Set<String>> upperSets(Map<String, List<String>> source) {
    Map<String, Set<String>> out = new HashMap<>();
    if (source != null) {
      source.forEach(
          (k, v) ->
              out.put(
                  k.toUpperCase(Locale.ROOT),
                  Set.copyOf(
                      nonNull(v).stream().map(s -> s.trim().toUpperCase(Locale.ROOT)).toList())));
    }
    return Map.copyOf(out);
  }

  @Override
  public String toString() {
    return "Vocabulary{language="
        + language
        + ", actions="
        + entries(VocabularyCategory.ACTION).size()
        + ", targets="
        + entries(VocabularyCategory.TARGET).size()
        + ", transcript="
        + (transcriptLexicon != null)
        + '}';
  }
}
