package com.gentoro.clm.encoder.structured;

import com.gentoro.clm.config.FieldImportance;
import com.gentoro.clm.config.StructuredDataOptions;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Decides which columns make it into the header. Required fields are always kept and win over
 * exclusions; other fields need an importance score at or above the threshold.
 */
final class FieldSelector {
  static final int LONG_TEXT = 500;
  static final int SHORT_TEXT = 3;

  static final Map<String, FieldImportance> DEFAULT_IMPORTANCE =
      Map.ofEntries(
          Map.entry("id", FieldImportance.CRITICAL),
          Map.entry("external_id", FieldImportance.CRITICAL),
          Map.entry("status", FieldImportance.CRITICAL),
          Map.entry("name", FieldImportance.HIGH),
          Map.entry("title", FieldImportance.HIGH),
          Map.entry("type", FieldImportance.HIGH),
          Map.entry("category", FieldImportance.HIGH),
          Map.entry("tags", FieldImportance.HIGH),
          Map.entry("description", FieldImportance.HIGH),
          Map.entry("priority", FieldImportance.HIGH),
          Map.entry("severity", FieldImportance.HIGH),
          Map.entry("resolution", FieldImportance.HIGH),
          Map.entry("owner", FieldImportance.HIGH),
          Map.entry("channel", FieldImportance.HIGH),
          Map.entry("subcategory", FieldImportance.MEDIUM),
          Map.entry("details", FieldImportance.MEDIUM),
          Map.entry("assignee", FieldImportance.MEDIUM),
          Map.entry("department", FieldImportance.MEDIUM),
          Map.entry("language", FieldImportance.MEDIUM),
          Map.entry("notes", FieldImportance.LOW),
          Map.entry("source", FieldImportance.LOW),
          Map.entry("metadata", FieldImportance.LOW));

  private final StructuredDataOptions options;

  FieldSelector(StructuredDataOptions options) {
    this.options = options;
  }

  /** Selected fields: identity fields first, then first-seen order. */
  List<String> select(List<Map<String, Object>> records) {
    Set<String> seen = new LinkedHashSet<>(options.requiredFields());
    for (Map<String, Object> record : records) {
      seen.addAll(record.keySet());
    }
    List<String> kept = new ArrayList<>();
    for (String field : seen) {
      if (include(field, records)) {
        kept.add(field);
      }
    }
    List<String> ordered = new ArrayList<>();
    for (String identity : options.identityFields()) {
      for (String field : kept) {
        if (field.equalsIgnoreCase(identity) && !ordered.contains(field)) {
          ordered.add(field);
        }
      }
    }
    for (String field : kept) {
      if (!ordered.contains(field)) ordered.add(field);
    }
    return ordered;
  }

  boolean include(String field, List<Map<String, Object>> records) {
    if (options.requiredFields().contains(field)) return true;
    if (options.excludedFields().contains(field)) return false;
    return importance(field, sample(field, records)) >= options.importanceThreshold();
  }

  double importance(String field, Object sample) {
    Double configured = options.fieldImportance().get(field);
    if (configured != null) {
      return configured;
    }
    return detect(field, sample).score();
  }

  static FieldImportance detect(String field, Object sample) {
    String key = field.toLowerCase(Locale.ROOT);
    FieldImportance known = DEFAULT_IMPORTANCE.get(key);
    if (known != null) return known;
    if (key.startsWith("_")) return FieldImportance.LOW;
    if (key.endsWith("_at") || key.endsWith("_date")) return FieldImportance.NEVER;
    if (isEmpty(sample)) return FieldImportance.NEVER;
    if (sample instanceof String s) {
      if (s.length() > LONG_TEXT) return FieldImportance.MEDIUM;
      if (s.strip().length() < SHORT_TEXT) return FieldImportance.LOW;
    }
    return FieldImportance.MEDIUM;
  }

  /** First non-empty value of the field across records, or null. */
  private static Object sample(String field, List<Map<String, Object>> records) {
    for (Map<String, Object> record : records) {
      Object value = record.get(field);
      if (!isEmpty(value)) return value;
    }
    return null;
  }

  static boolean isEmpty(Object value) {
    if (value == null) return true;
    if (value instanceof String s) return s.isBlank();
    if (value instanceof Collection<?> c) return c.isEmpty();
    if (value instanceof Map<?, ?> m) return m.isEmpty();
    return false;
  }
}
