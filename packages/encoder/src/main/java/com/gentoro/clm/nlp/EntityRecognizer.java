package com.gentoro.clm.nlp;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based named-entity recognition for the identifiers that matter to compression: contact
 * details, amounts and reference numbers. Patterns are linear (no nested quantifiers), so they run
 * outside the rule step budget.
 */
public final class EntityRecognizer {

  private record EntityPattern(EntityType type, Pattern pattern, int group) {}

  private static final List<EntityPattern> PATTERNS =
      List.of(
          new EntityPattern(
              EntityType.EMAIL,
              Pattern.compile("\\b[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}\\b"),
              0),
          new EntityPattern(
              EntityType.MONEY, Pattern.compile("\\$\\s?\\d+(?:,\\d{3})*(?:\\.\\d{1,2})?"), 0),
          new EntityPattern(
              EntityType.PHONE,
              Pattern.compile(
                  "(?<![\\w-])(?:\\+?1[\\s.-]?)?\\(?\\d{3}\\)?[\\s.-]?\\d{3}[\\s.-]\\d{4}(?![\\w-])"),
              0),
          new EntityPattern(
              EntityType.REFERENCE, Pattern.compile("\\b([A-Z]{2,5}-\\d{3,})\\b"), 1),
          new EntityPattern(
              EntityType.REFERENCE,
              Pattern.compile(
                  "(?i:\\b(?:reference|confirmation|ticket|case|ref)\\s*(?:number|no\\.?|#|id)?\\s*(?:is|:)?\\s*#?)"
                      + "((?=[A-Za-z0-9-]*\\d)[A-Za-z0-9-]{4,})"),
              1),
          new EntityPattern(
              EntityType.TRACKING,
              Pattern.compile(
                  "(?i:\\btracking\\s*(?:number|no\\.?|#|id)?\\s*(?:is|:)?\\s*#?)((?=[A-Za-z0-9]*\\d)[A-Za-z0-9]{6,})"),
              1),
          new EntityPattern(
              EntityType.ORDER,
              Pattern.compile(
                  "(?i:\\border\\s*(?:number|no\\.?|#|id)?\\s*(?:is|:)?\\s*#?)((?=[A-Za-z0-9-]*\\d)[A-Za-z0-9-]{3,})"),
              1),
          new EntityPattern(
              EntityType.ACCOUNT,
              Pattern.compile(
                  "(?i:\\baccount\\s*(?:number|no\\.?|#|id)?\\s*(?:is|:)?\\s*#?)((?=[A-Za-z0-9-]*\\d)[A-Za-z0-9-]{4,})"),
              1),
          new EntityPattern(
              EntityType.PERSON,
              Pattern.compile(
                  "(?:(?i:my name is|this is|name's)\\s+)([A-Z][a-z]+(?:\\s[A-Z][a-z]+)?)"),
              1));

  /** Entities sorted by position; spans never overlap, earlier patterns win. */
  public List<NamedEntity> recognize(String text) {
    if (text == null || text.isEmpty()) {
      return List.of();
    }
    BitSet claimed = new BitSet(text.length());
    List<NamedEntity> out = new ArrayList<>();
    for (EntityPattern ep : PATTERNS) {
      Matcher m = ep.pattern().matcher(text);
      while (m.find()) {
        int start = m.start(ep.group());
        int end = m.end(ep.group());
        if (start < 0 || !claimed.get(start, end).isEmpty()) {
          continue;
        }
        claimed.set(start, end);
        out.add(new NamedEntity(ep.type(), normalize(ep.type(), m.group(ep.group())), start, end));
      }
    }
    out.sort(Comparator.comparingInt(NamedEntity::start));
    return List.copyOf(out);
  }

  private static String normalize(EntityType type, String raw) {
    return switch (type) {
      case EMAIL -> raw.toLowerCase(Locale.ROOT);
      case MONEY -> raw.replace(" ", "");
      case PHONE -> raw.replaceAll("[^0-9+]", "");
      case REFERENCE, TRACKING, ORDER, ACCOUNT -> raw.toUpperCase(Locale.ROOT);
      case PERSON -> raw.trim();
    };
  }
}
