package com.gentoro.clm.resolve;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Attributes found by pattern rules.
 *
 * @param actionAttributes attributes of the REQ token ({@code LIMIT}, {@code SORT}, {@code BY},
 *     {@code MODE}), in discovery order
 * @param context CTX values keyed by context key, in rule-category order
 */
public record AttributeResolution(
    Map<String, String> actionAttributes, Map<String, List<String>> context) {

  public AttributeResolution {
    actionAttributes = Collections.unmodifiableMap(new LinkedHashMap<>(actionAttributes));
    Map<String, List<String>> copy = new LinkedHashMap<>();
    context.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    context = Collections.unmodifiableMap(copy);
  }
}
