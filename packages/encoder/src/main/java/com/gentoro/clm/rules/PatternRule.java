package com.gentoro.clm.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;

/**
 * A regular expression mapped to a token value. The template may reference capture groups as
 * {@code $1..$9}; without a template the whole match is used.
 */
public record PatternRule(RuleCategory category, Pattern pattern, String template) {

  public PatternRule {
    Objects.requireNonNull(category, "category");
    Objects.requireNonNull(pattern, "pattern");
  }

  /** Render the value for a match of this rule. */
  public String render(MatchResult match) {
    if (template == null || template.isEmpty()) {
      return normalize(match.group());
    }
    StringBuilder sb = new StringBuilder();
    for (int i = 0; i < template.length(); i++) {
      char c = template.charAt(i);
      if (c == '$' && i + 1 < template.length() && Character.isDigit(template.charAt(i + 1))) {
        int group = template.charAt(i + 1) - '0';
        String captured = group <= match.groupCount() ? match.group(group) : null;
        sb.append(captured == null ? "" : normalize(captured));
        i++;
      } else {
        sb.append(c);
      }
    }
    return sb.toString();
  }

  private String normalize(String captured) {
    String trimmed = captured.trim().replaceAll("\\s+", " ");
    if (!category.normalizeCase()) {
      return trimmed;
    }
    return trimmed.replace(' ', '_').replace('-', '_').toUpperCase(Locale.ROOT);
  }
}
