package com.gentoro.clm.encoder.structured;

import com.gentoro.clm.config.StructuredDataOptions;
import com.gentoro.clm.utility.TextUtility;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Renders one cell. Delimiters inside values, nested keys and header names are replaced so rows
 * stay parseable.
 */
final class ValueFormatter {
  private final StructuredDataOptions options;

  ValueFormatter(StructuredDataOptions options) {
    this.options = options;
  }

  String format(Object value) {
    if (value == null) {
      return "";
    }
    if (value instanceof Map<?, ?> map) {
      List<String> parts = new ArrayList<>();
      map.forEach((k, v) -> parts.add(escape(String.valueOf(k)) + ':' + format(v)));
      return "{" + String.join(",", parts) + "}";
    }
    if (value instanceof Collection<?> list) {
      List<String> parts = new ArrayList<>();
      list.forEach(v -> parts.add(format(v)));
      return options.preserveStructure()
          ? "[" + String.join(",", parts) + "]"
          : String.join("+", parts);
    }
    if (value instanceof Boolean || value instanceof Number) {
      return value.toString();
    }
    return text(value.toString());
  }

  private String text(String raw) {
    String s = TextUtility.collapseWhitespace(raw);
    s = TextUtility.truncate(s, options.maxFieldLength());
    s = escape(s);
    return options.normalizeCase() ? TextUtility.lower(s) : s;
  }

  static String escape(String s) {
    return s.replace(',', ';')
        .replace('[', '(')
        .replace('{', '(')
        .replace(']', ')')
        .replace('}', ')');
  }
}
