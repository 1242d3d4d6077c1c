package com.gentoro.clm.utility;

import java.util.Locale;
import java.util.regex.Pattern;

/** Small string helpers shared by the analyzers and encoders. */
public final class TextUtility {
  private static final Pattern HORIZONTAL_WS = Pattern.compile("[ \\t\\x0B\\f\\u00A0]+");
  private static final Pattern ANY_WS = Pattern.compile("\\s+");

  private TextUtility() {}

  /**
   * Lower-case character by character so that offsets in the result match the input. {@link
   * String#toLowerCase} may change the length for a few code points.
   */
  public static String lower(String text) {
    if (text == null) return "";
    char[] chars = text.toCharArray();
    for (int i = 0; i < chars.length; i++) {
      chars[i] = Character.toLowerCase(chars[i]);
    }
    return new String(chars);
  }

  /** Collapse all whitespace, newlines included, to single spaces and trim. */
  public static String collapseWhitespace(String text) {
    if (text == null) return "";
    return ANY_WS.matcher(text).replaceAll(" ").trim();
  }

  /** Collapse runs of spaces and tabs but keep line breaks; trims every line. */
  public static String collapseHorizontalWhitespace(String text) {
    if (text == null) return "";
    String[] lines = text.split("\\R", -1);
    StringBuilder sb = new StringBuilder();
    boolean previousBlank = true;
    for (String line : lines) {
      String cleaned = HORIZONTAL_WS.matcher(line).replaceAll(" ").trim();
      if (cleaned.isEmpty()) {
        if (!previousBlank) {
          sb.append('\n');
        }
        previousBlank = true;
        continue;
      }
      if (sb.length() > 0 && !previousBlank) {
        sb.append('\n');
      }
      sb.append(cleaned);
      previousBlank = false;
    }
    return sb.toString().strip();
  }

  /** Upper-case a phrase into token form: {@code "customer support agent" -> CUSTOMER_SUPPORT_AGENT}. */
  public static String toTokenValue(String phrase) {
    if (phrase == null) return "";
    return collapseWhitespace(phrase)
        .replaceAll("[^\\p{L}\\p{N} _-]", "")
        .trim()
        .replace(' ', '_')
        .replace('-', '_')
        .toUpperCase(Locale.ROOT);
  }

  /** Naive English singular form, enough for item names such as {@code ids} or {@code categories}. */
  public static String singularize(String word) {
    if (word == null || word.length() < 3) return word;
    String w = word.toLowerCase(Locale.ROOT);
    if (w.endsWith("ies") && w.length() > 4) return word.substring(0, word.length() - 3) + "y";
    if (w.endsWith("sses") || w.endsWith("xes") || w.endsWith("ches") || w.endsWith("shes")) {
      return word.substring(0, word.length() - 2);
    }
    if (w.endsWith("s") && !w.endsWith("ss") && !w.endsWith("us")) {
      return word.substring(0, word.length() - 1);
    }
    return word;
  }

  /** Truncate to {@code max} characters, appending {@code ...} when cut. */
  public static String truncate(String text, int max) {
    if (text == null || max <= 0 || text.length() <= max) return text;
    return text.substring(0, max) + "...";
  }
}
