package com.gentoro.clm.nlp;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;

class EntityRecognizerTest {

  private final EntityRecognizer recognizer = new EntityRecognizer();

  private Map<EntityType, String> byType(String text) {
    return recognizer.recognize(text).stream()
        .collect(Collectors.toMap(NamedEntity::type, NamedEntity::value, (a, b) -> a));
  }

  @Test
  void testContactDetails() {
    Map<EntityType, String> found =
        byType(
            "Call me at (555) 123-4567 or mail Jane.Doe@Example.com. My name is John Smith, "
                + "order number 88231, tracking number 1Z999AA10123456784.");

    assertEquals("5551234567", found.get(EntityType.PHONE));
    assertEquals("jane.doe@example.com", found.get(EntityType.EMAIL));
    assertEquals("John Smith", found.get(EntityType.PERSON));
    assertEquals("88231", found.get(EntityType.ORDER));
    assertEquals("1Z999AA10123456784", found.get(EntityType.TRACKING));
  }

  @Test
  void testReferencesAndMoney() {
    Map<EntityType, String> found =
        byType("I paid $1,200.50 and your ticket is ABC-12345.");

    assertEquals("$1,200.50", found.get(EntityType.MONEY));
    assertEquals("ABC-12345", found.get(EntityType.REFERENCE));
  }

  @Test
  void testReferenceAfterKeyword() {
    List<NamedEntity> found = recognizer.recognize("Your confirmation number is rx88412.");

    assertEquals(1, found.size());
    assertEquals(EntityType.REFERENCE, found.get(0).type());
    assertEquals("RX88412", found.get(0).value());
  }

  @Test
  void testSortedAndNonOverlapping() {
    List<NamedEntity> found = recognizer.recognize("$5 then $10 then $15");

    assertEquals(3, found.size());
    assertTrue(found.get(0).start() < found.get(1).start());
    assertTrue(found.get(1).end() <= found.get(2).start());
  }

  @Test
  void testNothingFound() {
    assertTrue(recognizer.recognize("").isEmpty());
    assertTrue(recognizer.recognize("thanks for your help").isEmpty());
  }
}
