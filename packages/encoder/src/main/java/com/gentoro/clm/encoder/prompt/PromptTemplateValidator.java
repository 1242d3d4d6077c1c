package com.gentoro.clm.encoder.prompt;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/** Checks that placeholders are individually resolvable and that a role is declared. */
public final class PromptTemplateValidator {
  private static final Pattern NAME = Pattern.compile("[A-Za-z0-9_.]+");

  public List<ValidationIssue> validate(PromptTemplate template, boolean roleDeclared) {
    List<ValidationIssue> issues = new ArrayList<>();
    Map<String, Set<String>> spellings = new LinkedHashMap<>();
    for (Placeholder p : template.placeholders()) {
      String name = p.name();
      if (name.isEmpty()) {
        issues.add(ValidationIssue.error("EMPTY_PLACEHOLDER", "Empty placeholder " + p.raw()));
        continue;
      }
      if (!NAME.matcher(name).matches()) {
        issues.add(
            ValidationIssue.warning(
                "INVALID_PLACEHOLDER_NAME",
                "Placeholder name '" + name + "' should only use letters, digits, '_' and '.'"));
      }
      spellings.computeIfAbsent(name.toLowerCase(Locale.ROOT), k -> new LinkedHashSet<>()).add(name);
    }
    spellings.forEach(
        (key, variants) -> {
          if (variants.size() > 1) {
            issues.add(
                ValidationIssue.error(
                    "DUPLICATE_PLACEHOLDER", "Placeholder declared with different spellings: " + variants));
          }
        });
    if (!roleDeclared) {
      issues.add(ValidationIssue.warning("MISSING_ROLE", "No role declaration found"));
    }
    return issues;
  }
}
