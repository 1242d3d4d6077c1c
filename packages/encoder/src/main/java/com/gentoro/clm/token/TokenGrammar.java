package com.gentoro.clm.token;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Structural checks on a rendered token stream: bracket balance and category membership. */
public final class TokenGrammar {
  private static final Pattern HEAD = Pattern.compile("^\\[([A-Z_]+)(?::|\\])");

  private TokenGrammar() {}

  /**
   * Validate a space separated token stream.
   *
   * @return human readable issues, empty when the stream is well formed
   */
  public static List<String> validate(String stream, Set<TokenCategory> allowed) {
    List<String> issues = new ArrayList<>();
    if (stream == null || stream.isBlank()) {
      issues.add("empty token stream");
      return issues;
    }
    List<String> groups = new ArrayList<>();
    int depth = 0;
    int start = -1;
    for (int i = 0; i < stream.length(); i++) {
      char c = stream.charAt(i);
      if (c == '[') {
        if (depth == 0) start = i;
        depth++;
      } else if (c == ']') {
        depth--;
        if (depth < 0) {
          issues.add("unbalanced ']' at " + i);
          depth = 0;
        } else if (depth == 0) {
          groups.add(stream.substring(start, i + 1));
        }
      } else if (depth == 0 && !Character.isWhitespace(c)) {
        issues.add("text outside token at " + i);
        break;
      }
    }
    if (depth > 0) {
      issues.add("unclosed '[' at " + start);
    }
    for (String group : groups) {
      Matcher m = HEAD.matcher(group);
      if (!m.find()) {
        issues.add("malformed token " + group);
        continue;
      }
      TokenCategory category = TokenCategory.parse(m.group(1)).orElse(null);
      if (category == null || (allowed != null && !allowed.contains(category))) {
        issues.add("unexpected category " + m.group(1));
      }
    }
    return issues;
  }

  /** Top-level bracket groups of a stream, in order. */
  public static List<String> split(String stream) {
    List<String> groups = new ArrayList<>();
    if (stream == null) return groups;
    int depth = 0;
    int start = -1;
    for (int i = 0; i < stream.length(); i++) {
      char c = stream.charAt(i);
      if (c == '[') {
        if (depth++ == 0) start = i;
      } else if (c == ']' && depth > 0 && --depth == 0) {
        groups.add(stream.substring(start, i + 1));
      }
    }
    return groups;
  }
}
