package com.gentoro.clm.utility;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class TextUtilityTest {

  @Test
  void testToTokenValue() {
    assertEquals("CUSTOMER_SUPPORT_AGENT", TextUtility.toTokenValue("customer  support agent"));
    assertEquals("E_COMMERCE", TextUtility.toTokenValue("e-commerce!"));
    assertEquals("", TextUtility.toTokenValue(null));
  }

  @Test
  void testSingularize() {
    assertEquals("id", TextUtility.singularize("ids"));
    assertEquals("category", TextUtility.singularize("categories"));
    assertEquals("box", TextUtility.singularize("boxes"));
    assertEquals("status", TextUtility.singularize("status"));
    assertEquals("class", TextUtility.singularize("classes"));
  }

  @Test
  void testTruncate() {
    assertEquals("abc...", TextUtility.truncate("abcdef", 3));
    assertEquals("abc", TextUtility.truncate("abc", 3));
    assertNull(TextUtility.truncate(null, 3));
  }

  @Test
  void testCollapseHorizontalWhitespace() {
    String collapsed = TextUtility.collapseHorizontalWhitespace("a   b\t c\n\n\n  d  \n");

    assertEquals("a b c\nd", collapsed);
  }
}
