package com.gentoro.clm.quality;

import com.gentoro.clm.vocabulary.ImperativeTemplate;
import com.gentoro.clm.vocabulary.Vocabulary;
import com.gentoro.clm.vocabulary.VocabularyCategory;
import com.gentoro.clm.vocabulary.VocabularyEntry;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Runs the REQ and TARGET gates over a task-mode encoding. Results land in the encoding metadata
 * under {@link #RESULTS}, the worst status under {@link #STATUS}.
 */
public final class QualityGates {
  public static final String RESULTS = "quality_gates";
  public static final String STATUS = "quality_status";

  private static final org.slf4j.Logger log =
      com.gentoro.clm.logging.LoggingService.getLogger(QualityGates.class);

  private final List<QualityGate> gates;

  public QualityGates(List<QualityGate> gates) {
    this.gates = List.copyOf(gates);
  }

  /** The default gate set, validating actions against the canonical actions of a vocabulary. */
  public static QualityGates forVocabulary(Vocabulary vocabulary) {
    return new QualityGates(
        List.of(
            new RequestPresenceGate(),
            new RequestValidityGate(canonicalActions(vocabulary)),
            new TargetPresenceGate(),
            new TargetCoverageGate()));
  }

  static Set<String> canonicalActions(Vocabulary vocabulary) {
    Set<String> actions = new HashSet<>();
    for (VocabularyCategory category :
        List.of(
            VocabularyCategory.ACTION,
            VocabularyCategory.ACTION_PHRASE,
            VocabularyCategory.QUESTION_WORD)) {
      vocabulary.entries(category).stream()
          .map(VocabularyEntry::canonicalToken)
          .forEach(actions::add);
    }
    vocabulary.imperatives().stream()
        .map(ImperativeTemplate::action)
        .filter(Objects::nonNull)
        .forEach(actions::add);
    return actions;
  }

  public List<GateResult> run(GateInput input) {
    List<GateResult> results = new ArrayList<>(gates.size());
    for (QualityGate gate : gates) {
      GateResult result = gate.validate(input);
      if (result.status() != GateStatus.PASS) {
        log.debug("Gate {} {}: {}", result.gate(), result.status(), result.message());
      }
      results.add(result);
    }
    return results;
  }

  public static GateStatus overall(List<GateResult> results) {
    GateStatus status = GateStatus.PASS;
    for (GateResult result : results) {
      status = status.worst(result.status());
    }
    return status;
  }
}
