package com.gentoro.clm.encoder.prompt;

import com.gentoro.clm.exception.TemplateBindingException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Prompt text with {@code {{name}}} placeholders that are substituted at run time. */
public final class PromptTemplate {
  static final Pattern MARKER = Pattern.compile("\\{\\{([^{}]*)\\}\\}");

  private final String text;
  private final List<Placeholder> placeholders;

  private PromptTemplate(String text, List<Placeholder> placeholders) {
    this.text = text;
    this.placeholders = List.copyOf(placeholders);
  }

  public static PromptTemplate of(String text) {
    String source = text == null ? "" : text;
    List<Placeholder> found = new ArrayList<>();
    Matcher m = MARKER.matcher(source);
    while (m.find()) {
      found.add(Placeholder.parse(m.group(), m.group(1)));
    }
    return new PromptTemplate(source, found);
  }

  public static boolean hasPlaceholders(String text) {
    return text != null && MARKER.matcher(text).find();
  }

  public String text() {
    return text;
  }

  /** Every occurrence, in text order. */
  public List<Placeholder> placeholders() {
    return placeholders;
  }

  /** Distinct non-empty names, sorted. */
  public List<String> names() {
    TreeSet<String> names = new TreeSet<>();
    for (Placeholder p : placeholders) {
      if (!p.name().isEmpty()) names.add(p.name());
    }
    return List.copyOf(names);
  }

  /**
   * Substitute every placeholder. Placeholders with a default fall back to it.
   *
   * @throws TemplateBindingException when a placeholder has no value or the result is empty
   */
  public String bind(Map<String, String> values) {
    Map<String, String> source = values == null ? Map.of() : values;
    List<String> unresolved = new ArrayList<>();
    StringBuilder sb = new StringBuilder();
    Matcher m = MARKER.matcher(text);
    while (m.find()) {
      Placeholder p = Placeholder.parse(m.group(), m.group(1));
      String value = source.get(p.name());
      if (value == null && p instanceof Placeholder.WithDefault withDefault) {
        value = withDefault.defaultValue();
      }
      if (value == null) {
        if (!unresolved.contains(p.name())) unresolved.add(p.name());
        value = m.group();
      }
      m.appendReplacement(sb, Matcher.quoteReplacement(value));
    }
    m.appendTail(sb);
    if (!unresolved.isEmpty()) {
      throw new TemplateBindingException("Unresolved placeholders: " + unresolved)
          .withContext("unresolved", unresolved);
    }
    String bound = sb.toString();
    if (bound.isBlank()) {
      throw new TemplateBindingException("Binding produced an empty prompt");
    }
    return bound;
  }
}
