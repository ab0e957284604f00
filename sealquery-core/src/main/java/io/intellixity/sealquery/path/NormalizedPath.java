package io.intellixity.sealquery.path;

import java.util.List;
import java.util.Objects;

/**
 * A JSONPath in canonical form together with its flat segment list.
 * <p>
 * Index and wildcard steps show up in {@code segments} by their bracket contents ({@code $[0].name} gives
 * {@code ["0", "name"]}).
 */
public record NormalizedPath(String jsonPath, List<String> segments) {
  public NormalizedPath {
    Objects.requireNonNull(jsonPath, "jsonPath");
    segments = List.copyOf(Objects.requireNonNull(segments, "segments"));
  }

  public boolean isRoot() { return segments.isEmpty(); }

  @Override
  public String toString() {
    return jsonPath;
  }
}
