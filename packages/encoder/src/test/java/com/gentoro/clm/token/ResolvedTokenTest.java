package com.gentoro.clm.token;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class ResolvedTokenTest {

  @Test
  void testRenderValuesAndAttributes() {
    ResolvedToken token =
        ResolvedToken.builder(TokenCategory.REQ)
            .values(List.of("ANALYZE", "MATCH", "RANK"))
            .join(ResolvedToken.Join.CHAIN)
            .attribute("BY", "RELEVANCE")
            .attribute("LIMIT", 5)
            .build();

    assertEquals("[REQ:ANALYZE>MATCH>RANK:BY=RELEVANCE:LIMIT=5]", token.render());
    assertEquals("ANALYZE", token.primaryValue());
  }

  @Test
  void testListJoinDropsDuplicates() {
    ResolvedToken token =
        ResolvedToken.builder(TokenCategory.CTX)
            .value("BASIC")
            .value("CUSTOM")
            .value("BASIC")
            .build();

    assertEquals("[CTX:BASIC,CUSTOM]", token.render());
  }

  @Test
  void testSequenceKeepsRepeats() {
    ResolvedToken token =
        ResolvedToken.builder(TokenCategory.SENTIMENT)
            .sequence(List.of("FRUSTRATED", "NEUTRAL", "FRUSTRATED", "SATISFIED"))
            .build();

    assertEquals("[SENTIMENT:FRUSTRATED→NEUTRAL→FRUSTRATED→SATISFIED]", token.render());
  }

  @Test
  void testAttributeOnlyToken() {
    ResolvedToken token =
        ResolvedToken.builder(TokenCategory.CUSTOMER)
            .attribute("NAME", "John_Smith")
            .attribute("ACCOUNT", null)
            .attribute("TIER", " ")
            .attribute("NAME", "Other")
            .build();

    assertEquals("[CUSTOMER:NAME=John_Smith]", token.render());
  }

  @Test
  void testEmptyTokenRejected() {
    ResolvedToken.Builder builder = ResolvedToken.builder(TokenCategory.ISSUE).value(" ");

    assertFalse(builder.hasValues());
    assertThrows(IllegalStateException.class, builder::build);
  }

  @Test
  void testEquality() {
    assertEquals(
        ResolvedToken.of(TokenCategory.OUT, "JSON"),
        ResolvedToken.builder(TokenCategory.OUT).value("JSON").build());
    assertNotEquals(
        ResolvedToken.of(TokenCategory.OUT, "JSON"), ResolvedToken.of(TokenCategory.OUT, "CSV"));
  }
}
