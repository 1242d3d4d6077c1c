package com.gentoro.clm.utility;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class CollectionUtility {

  private CollectionUtility() {}

  /**
   * Merge list-valued maps key by key. Lists for the same key are concatenated in argument order
   * with duplicates removed; insertion order of keys is preserved.
   */
  @SafeVarargs
  public static <K, V> Map<K, List<V>> mergeListMaps(Map<K, ? extends Collection<V>>... maps) {
    Map<K, LinkedHashSet<V>> merged = new LinkedHashMap<>();
    if (Objects.nonNull(maps)) {
      for (Map<K, ? extends Collection<V>> map : maps) {
        if (Objects.isNull(map)) {
          continue;
        }
        map.forEach(
            (k, values) -> {
              LinkedHashSet<V> target = merged.computeIfAbsent(k, key -> new LinkedHashSet<>());
              if (values != null) {
                values.stream().filter(Objects::nonNull).forEach(target::add);
              }
            });
      }
    }
    Map<K, List<V>> result = new LinkedHashMap<>();
    merged.forEach((k, v) -> result.put(k, List.copyOf(v)));
    return result;
  }
}
