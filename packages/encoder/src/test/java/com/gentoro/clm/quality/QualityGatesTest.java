package com.gentoro.clm.quality;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.clm.language.LanguageRegistry;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

class QualityGatesTest {

  private static final GateInput.NounPhrase REFUNDS =
      new GateInput.NounPhrase("refund requests", List.of("refund", "request"));
  private static final GateInput.NounPhrase WEATHER =
      new GateInput.NounPhrase("weather", List.of("weather"));

  private static GateInput input(List<String> actions, List<String> targets) {
    return new GateInput("text", actions, targets, List.of(REFUNDS, WEATHER));
  }

  @Test
  void testRequestPresence() {
    RequestPresenceGate gate = new RequestPresenceGate();

    GateResult missing = gate.validate(input(List.of(), List.of()));
    GateResult longChain =
        gate.validate(input(List.of("EXTRACT", "ANALYZE", "MATCH", "RANK"), List.of()));

    assertEquals(GateStatus.FAIL, missing.status());
    assertEquals(0.0, missing.score());
    assertEquals(List.of("NO_REQ_TOKEN"), missing.failures());
    assertEquals(GateStatus.DEGRADED, longChain.status());
    assertEquals(0.7, longChain.score());
    assertEquals(GateStatus.PASS, gate.validate(input(List.of("LIST"), List.of())).status());
  }

  @Test
  void testRequestValidity() {
    RequestValidityGate gate = new RequestValidityGate(Set.of("LIST", "RANK"));

    GateResult result = gate.validate(input(List.of("LIST", "DANCE"), List.of()));

    assertEquals(GateStatus.FAIL, result.status());
    assertEquals(List.of("INVALID_REQ_DANCE"), result.failures());
    assertEquals(GateStatus.PASS, gate.validate(input(List.of("RANK"), List.of())).status());
  }

  @Test
  void testCanonicalActionsFromVocabulary() {
    Set<String> actions =
        QualityGates.canonicalActions(LanguageRegistry.resolve("en").vocabulary());

    assertTrue(actions.containsAll(List.of("LIST", "SUMMARIZE", "EXTRACT", "EXPLAIN")));
    assertFalse(actions.contains("ITEMS"));
  }

  @Test
  void testTargetPresence() {
    TargetPresenceGate gate = new TargetPresenceGate();

    GateResult withNouns = gate.validate(input(List.of("LIST"), List.of()));
    GateResult withoutNouns =
        gate.validate(new GateInput("go", List.of("LIST"), List.of(), List.of()));

    assertEquals(GateStatus.FAIL, withNouns.status());
    assertEquals(List.of("MISSING_TARGET_WITH_NOUNS"), withNouns.failures());
    assertEquals(GateStatus.DEGRADED, withoutNouns.status());
    assertEquals(0.3, withoutNouns.score());
    assertEquals(
        GateStatus.PASS, gate.validate(input(List.of(), List.of("[TARGET:ITEMS]"))).status());
  }

  @Test
  void testTargetCoverage() {
    GateInput half = input(List.of("EXTRACT"), List.of("[TARGET:REFUNDS]"));

    GateResult lenient = new TargetCoverageGate().validate(half);
    GateResult strict = new TargetCoverageGate(0.75).validate(half);

    assertEquals(GateStatus.PASS, lenient.status());
    assertEquals(0.5, lenient.score());
    assertEquals(GateStatus.DEGRADED, strict.status());
    assertEquals(List.of("LOW_COVERAGE"), strict.failures());
    assertTrue(strict.message().contains("weather"), strict.message());
  }

  @Test
  void testOverallIsWorstStatus() {
    QualityGates gates = QualityGates.forVocabulary(LanguageRegistry.resolve("en").vocabulary());

    List<GateResult> results = gates.run(input(List.of("LIST"), List.of("[TARGET:REFUNDS]")));

    assertEquals(4, results.size());
    assertEquals(GateStatus.PASS, QualityGates.overall(results));
    assertEquals(
        GateStatus.FAIL, QualityGates.overall(gates.run(input(List.of(), List.of()))));
    assertEquals(GateStatus.PASS, QualityGates.overall(List.of()));
  }
}
