package com.gentoro.clm.resolve;

import com.gentoro.clm.nlp.AnalyzedText;
import com.gentoro.clm.nlp.AnalyzedToken;
import com.gentoro.clm.nlp.PartOfSpeech;
import com.gentoro.clm.rules.RuleCategory;
import com.gentoro.clm.utility.TextUtility;
import com.gentoro.clm.vocabulary.PhraseIndex;
import com.gentoro.clm.vocabulary.Vocabulary;
import com.gentoro.clm.vocabulary.VocabularyCategory;
import com.gentoro.clm.vocabulary.VocabularyEntry;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Finds targets, the implied catalog flow, the output item and the fields to extract.
 *
 * <p>Compound phrases are collapsed before single nouns are looked at: their spans are masked so
 * "customer interaction transcript" yields one {@code TRANSCRIPT} instead of three targets.
 */
public final class TargetResolver {
  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(TargetResolver.class);

  /** Distinct keyword hits a domain needs before it is reported. */
  static final int MIN_DOMAIN_HITS = 2;

  private record Hit(String token, int position) {}

  private final Vocabulary vocabulary;
  private final RuleEvaluator rules;

  public TargetResolver(Vocabulary vocabulary, RuleEvaluator rules) {
    this.vocabulary = vocabulary;
    this.rules = rules;
  }

  /**
   * @param defaultTarget target implied by an imperative command, used when nothing else is found
   */
  public TargetResolution resolve(AnalyzedText text, ClauseFilter clauses, String defaultTarget) {
    String lower = text.lower();
    BitSet masked = clauses.spans();
    List<Hit> hits = new ArrayList<>();

    for (VocabularyCategory category :
        List.of(VocabularyCategory.COMPOUND_PHRASE, VocabularyCategory.TARGET)) {
      for (PhraseIndex.PhraseMatch m : vocabulary.phrases(category).findAll(lower, masked)) {
        hits.add(new Hit(m.token(), m.start()));
        masked.set(m.start(), m.end());
      }
    }
    for (AnalyzedToken token : text.tokens()) {
      if (!token.isWord() || token.pos() == PartOfSpeech.VERB || masked.get(token.start())) {
        continue;
      }
      Optional<String> target =
          vocabulary.lookup(VocabularyCategory.TARGET, token.lower(), token.stem());
      if (target.isPresent()) {
        hits.add(new Hit(target.get(), token.start()));
        masked.set(token.start(), token.end());
      }
    }
    hits.sort(Comparator.comparingInt(Hit::position));

    Set<String> ordered = new LinkedHashSet<>();
    hits.forEach(h -> ordered.add(h.token()));
    Set<String> subsumed = new HashSet<>();
    for (String target : ordered) {
      subsumed.addAll(vocabulary.subsumedBy(target));
    }
    List<String> targets = new ArrayList<>(ordered);
    targets.removeIf(subsumed::contains);
    if (targets.isEmpty() && defaultTarget != null) {
      targets.add(defaultTarget);
    }

    Optional<RuleMatch> catalog = rules.first(RuleCategory.CATALOG, text.text());
    String catalogName = catalog.map(m -> attributeValue(m.value(), "NAME")).orElse(null);
    String outputItem =
        rules
            .first(RuleCategory.OUTPUT_ITEM, text.text())
            .map(m -> TextUtility.singularize(m.value()))
            .orElse(null);

    TargetResolution resolution =
        new TargetResolution(
            targets,
            catalog.isPresent(),
            catalogName,
            outputItem,
            domain(text, lower),
            extractionFields(text, lower, masked));
    log.debug("Resolved targets {}", resolution);
    return resolution;
  }

  private List<String> extractionFields(AnalyzedText text, String lower, BitSet targetMask) {
    BitSet masked = (BitSet) targetMask.clone();
    List<Hit> hits = new ArrayList<>();
    for (PhraseIndex.PhraseMatch m :
        vocabulary.phrases(VocabularyCategory.EXTRACTION_FIELD).findAll(lower, masked)) {
      hits.add(new Hit(m.token(), m.start()));
      masked.set(m.start(), m.end());
    }
    for (AnalyzedToken token : text.tokens()) {
      if (!token.isWord() || token.pos() == PartOfSpeech.VERB || masked.get(token.start())) {
        continue;
      }
      vocabulary
          .lookup(VocabularyCategory.EXTRACTION_FIELD, token.lower(), token.stem())
          .ifPresent(f -> hits.add(new Hit(f, token.start())));
    }
    hits.sort(Comparator.comparingInt(Hit::position));
    Set<String> fields = new LinkedHashSet<>();
    hits.forEach(h -> fields.add(h.token()));
    return List.copyOf(fields);
  }

  /** Domain with the most distinct keyword hits; ties go to the domain declared first. */
  private String domain(AnalyzedText text, String lower) {
    Map<String, Set<String>> evidence = new LinkedHashMap<>();
    for (VocabularyEntry entry : vocabulary.entries(VocabularyCategory.DOMAIN_KEYWORD)) {
      evidence.put(entry.canonicalToken(), new HashSet<>());
    }
    for (PhraseIndex.PhraseMatch m :
        vocabulary.phrases(VocabularyCategory.DOMAIN_KEYWORD).findAll(lower)) {
      evidence.get(m.token()).add(m.phrase());
    }
    for (AnalyzedToken token : text.tokens()) {
      if (!token.isWord()) continue;
      vocabulary
          .lookup(VocabularyCategory.DOMAIN_KEYWORD, token.lower(), token.stem())
          .ifPresent(d -> evidence.get(d).add(token.stem()));
    }
    String best = null;
    int bestScore = MIN_DOMAIN_HITS - 1;
    for (Map.Entry<String, Set<String>> e : evidence.entrySet()) {
      if (e.getValue().size() > bestScore) {
        best = e.getKey();
        bestScore = e.getValue().size();
      }
    }
    return best;
  }

  /** Read {@code KEY=value} out of a rendered rule value; blank values yield null. */
  static String attributeValue(String rendered, String key) {
    String prefix = key + "=";
    int idx = rendered.indexOf(prefix);
    if (idx < 0) return null;
    int end = rendered.indexOf(':', idx);
    String value = rendered.substring(idx + prefix.length(), end < 0 ? rendered.length() : end);
    return value.isBlank() ? null : value;
  }
}
