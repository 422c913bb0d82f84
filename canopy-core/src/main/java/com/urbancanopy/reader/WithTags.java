package com.urbancanopy.reader;

import java.util.Collection;
import java.util.Map;

/** An input element with a set of string key/object value pairs. */
public interface WithTags {

  /** The key/value pairs on this element. */
  Map<String, Object> tags();

  default Object getTag(String key) {
    return tags().get(key);
  }

  default boolean hasTag(String key) {
    return tags().get(key) != null;
  }

  /** Returns true if the value for {@code key} is {@code value}, or is a list that contains {@code value}. */
  default boolean hasTag(String key, Object value) {
    Object actual = getTag(key);
    if (actual instanceof Collection<?> list) {
      return list.contains(value);
    }
    return value.equals(actual);
  }

  /** Returns the {@link Object#toString()} value for {@code key} or {@code null} if not present. */
  default String getString(String key) {
    Object value = getTag(key);
    return value == null ? null : value.toString();
  }

  /**
   * Returns the first value for {@code key} when it holds a list (OpenStreetMap ways merged from several ways carry a
   * list of tag values), otherwise the {@link Object#toString()} value, or {@code null} if not present.
   */
  default String getFirstString(String key) {
    Object value = getTag(key);
    if (value instanceof Collection<?> list) {
      for (Object item : list) {
        if (item != null) {
          return item.toString();
        }
      }
      return null;
    }
    return value == null ? null : value.toString();
  }
}
