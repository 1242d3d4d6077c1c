package com.gentoro.clm.token;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class TokenGrammarTest {

  @Test
  void testValidPromptStream() {
    String stream = "[REQ:ANALYZE>MATCH] [TARGET:TRANSCRIPT→CATALOG→ID[]] [OUT:JSON_ARRAY]";

    assertEquals(List.of(), TokenGrammar.validate(stream, TokenCategory.PROMPT));
  }

  @Test
  void testEmptyStream() {
    assertEquals(List.of("empty token stream"), TokenGrammar.validate("  ", TokenCategory.PROMPT));
  }

  @Test
  void testUnbalancedBrackets() {
    List<String> unclosed = TokenGrammar.validate("[REQ:LIST", TokenCategory.PROMPT);
    List<String> extra = TokenGrammar.validate("[REQ:LIST]]", TokenCategory.PROMPT);

    assertEquals(List.of("unclosed '[' at 0"), unclosed);
    assertEquals(List.of("unbalanced ']' at 10"), extra);
  }

  @Test
  void testTextOutsideTokens() {
    List<String> issues = TokenGrammar.validate("[REQ:LIST] please", TokenCategory.PROMPT);

    assertEquals(List.of("text outside token at 11"), issues);
  }

  @Test
  void testCategoryNotAllowed() {
    List<String> issues = TokenGrammar.validate("[REQ:LIST] [CALL:BILLING]", TokenCategory.PROMPT);

    assertEquals(List.of("unexpected category CALL"), issues);
    assertEquals(
        List.of("unexpected category FOO"), TokenGrammar.validate("[FOO:BAR]", null));
    assertEquals(List.of("malformed token [req]"), TokenGrammar.validate("[req]", null));
  }

  @Test
  void testSplit() {
    assertEquals(
        List.of("[CALL:SUPPORT]", "[ISSUE:X:A=[1]]"),
        TokenGrammar.split("[CALL:SUPPORT] [ISSUE:X:A=[1]]"));
    assertTrue(TokenGrammar.split(null).isEmpty());
  }
}
