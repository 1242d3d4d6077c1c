package com.gentoro.clm.encoder.prompt;

import static org.junit.jupiter.api.Assertions.*;

import java.util.List;
import org.junit.jupiter.api.Test;

class PromptTemplateValidatorTest {

  private final PromptTemplateValidator validator = new PromptTemplateValidator();

  private static List<String> codes(List<ValidationIssue> issues) {
    return issues.stream().map(ValidationIssue::code).toList();
  }

  @Test
  void testCleanTemplate() {
    assertTrue(validator.validate(PromptTemplate.of("Greet {{customer.name}}"), true).isEmpty());
  }

  @Test
  void testEmptyPlaceholder() {
    List<ValidationIssue> issues = validator.validate(PromptTemplate.of("Hello {{ }}"), true);

    assertEquals(List.of("EMPTY_PLACEHOLDER"), codes(issues));
    assertEquals(ValidationIssue.Severity.ERROR, issues.get(0).severity());
  }

  @Test
  void testInvalidName() {
    List<ValidationIssue> issues =
        validator.validate(PromptTemplate.of("Hello {{customer name}}"), true);

    assertEquals(List.of("INVALID_PLACEHOLDER_NAME"), codes(issues));
    assertEquals(ValidationIssue.Severity.WARNING, issues.get(0).severity());
  }

  @Test
  void testDuplicateSpellings() {
    List<ValidationIssue> issues =
        validator.validate(PromptTemplate.of("{{UserName}} or {{username}} or {{username}}"), true);

    assertEquals(List.of("DUPLICATE_PLACEHOLDER"), codes(issues));
  }

  @Test
  void testMissingRole() {
    List<ValidationIssue> issues = validator.validate(PromptTemplate.of("Greet {{name}}"), false);

    assertEquals(List.of("MISSING_ROLE"), codes(issues));
  }
}
