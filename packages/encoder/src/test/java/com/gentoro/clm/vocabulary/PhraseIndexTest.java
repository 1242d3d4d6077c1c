package com.gentoro.clm.vocabulary;

import static org.junit.jupiter.api.Assertions.*;

import java.util.BitSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class PhraseIndexTest {

  private static PhraseIndex billing() {
    Map<String, List<String>> tokens = new LinkedHashMap<>();
    tokens.put("billing_dispute", List.of("charge", "charged twice", "Double  Charge"));
    tokens.put("REFUND", List.of("refund"));
    return PhraseIndex.of(tokens, false);
  }

  @Test
  void testLongestPhraseClaimsSpan() {
    List<PhraseIndex.PhraseMatch> found = billing().findAll("i was charged twice on my bill");

    assertEquals(1, found.size());
    assertEquals("BILLING_DISPUTE", found.get(0).token());
    assertEquals("charged twice", found.get(0).phrase());
    assertEquals(6, found.get(0).start());
  }

  @Test
  void testInflectedSuffix() {
    String text = "two refunds and a double charge";
    List<PhraseIndex.PhraseMatch> found = billing().findAll(text);

    assertEquals(2, found.size());
    assertEquals("REFUND", found.get(0).token());
    assertEquals("refunds", text.substring(found.get(0).start(), found.get(0).end()));
    assertEquals("double charge", found.get(1).phrase());
  }

  @Test
  void testWordBoundaries() {
    assertTrue(billing().findAll("the fee is non-refundable").isEmpty());
    assertTrue(billing().findAll("surcharges apply").isEmpty());
  }

  @Test
  void testMaskedSpansAreSkipped() {
    String text = "refund the charge";
    BitSet masked = new BitSet();
    masked.set(0, 6);

    List<PhraseIndex.PhraseMatch> found = billing().findAll(text, masked);

    assertEquals(1, found.size());
    assertEquals("BILLING_DISPUTE", found.get(0).token());
    assertEquals(6, masked.cardinality());
  }

  @Test
  void testMultiWordOnly() {
    PhraseIndex index =
        PhraseIndex.of(Map.of("CREDIT", List.of("credit", "account credit", "store credit")), true);

    assertNull(index.first("we added credit"));
    assertEquals("CREDIT", index.first("we added a store credit"));
  }

  @Test
  void testEmpty() {
    assertTrue(PhraseIndex.of(Map.of(), false).isEmpty());
    assertFalse(PhraseIndex.empty().containsAny("anything"));
    assertTrue(billing().findAll("").isEmpty());
  }
}
