package com.dataflow.pipeline.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deep, order-preserving unmodifiable copies for values that leave the pipeline. Unlike {@code
 * List.copyOf} these keep null elements and null map values, which JSON-safe records may contain.
 */
public final class ImmutableCopies {

  private ImmutableCopies() {}

  public static <T> List<T> list(List<T> source) {
    return source == null ? null : Collections.unmodifiableList(new ArrayList<>(source));
  }

  @SuppressWarnings("unchecked")
  public static Map<String, Object> tree(Map<String, Object> source) {
    return (Map<String, Object>) freeze(source);
  }

  public static List<Map<String, Object>> records(List<Map<String, Object>> source) {
    if (source == null) {
      return null;
    }
    List<Map<String, Object>> copy = new ArrayList<>(source.size());
    for (Map<String, Object> record : source) {
      copy.add(tree(record));
    }
    return Collections.unmodifiableList(copy);
  }

  private static Object freeze(Object value) {
    if (value instanceof Map) {
      Map<String, Object> copy = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
        copy.put(String.valueOf(entry.getKey()), freeze(entry.getValue()));
      }
      return Collections.unmodifiableMap(copy);
    }
    if (value instanceof Collection) {
      List<Object> copy = new ArrayList<>(((Collection<?>) value).size());
      for (Object item : (Collection<?>) value) {
        copy.add(freeze(item));
      }
      return Collections.unmodifiableList(copy);
    }
    return value;
  }
}
