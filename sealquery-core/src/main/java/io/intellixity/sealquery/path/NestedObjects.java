package io.intellixity.sealquery.path;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Builds the nested object a path-equality term compares against: {@code ("user.role", "admin")} gives
 * {@code {"user": {"role": "admin"}}}.
 */
public final class NestedObjects {
  /** Segments that must never become object keys. */
  public static final Set<String> FORBIDDEN_SEGMENTS = Set.of("__proto__", "prototype", "constructor");

  private NestedObjects() {}

  /**
   * Takes the segments of a dot or bracket path, as {@link JsonPaths#normalize(String)} reads them:
   * {@code $["a-b"].c} gives {@code {"a-b": {"c": value}}}.
   */
  public static Map<String, Object> build(String path, Object value) {
    if (path == null || path.isEmpty()) throw new InvalidPathException("Path cannot be empty");
    return build(JsonPaths.normalize(path).segments(), value);
  }

  public static Map<String, Object> build(List<String> segments, Object value) {
    Objects.requireNonNull(segments, "segments");
    if (segments.isEmpty()) throw new InvalidPathException("Path must contain at least one segment");
    for (String s : segments) {
      if (FORBIDDEN_SEGMENTS.contains(s)) throw new InvalidPathException("Path contains forbidden segment: " + s);
    }

    Object current = value;
    for (int i = segments.size() - 1; i >= 0; i--) {
      current = Collections.singletonMap(segments.get(i), current);
    }
    @SuppressWarnings("unchecked")
    Map<String, Object> out = (Map<String, Object>) current;
    return out;
  }
}
