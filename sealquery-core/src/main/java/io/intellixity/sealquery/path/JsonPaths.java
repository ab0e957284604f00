package io.intellixity.sealquery.path;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Canonicalizes user-supplied paths ({@code user.email}, {@code $.user.email}, {@code ["user", "email"]})
 * into JSONPath selectors.
 * <p>
 * Rules:
 * <ul>
 *   <li>empty input and {@code $} map to the root {@code $}</li>
 *   <li>names made of letters, digits and underscores use dot notation, anything else is bracket-quoted</li>
 *   <li>index and wildcard steps ({@code [0]}, {@code [*]}, {@code [@]}) are kept as bracket suffixes</li>
 *   <li>empty segments from doubled dots are dropped</li>
 * </ul>
 * Normalizing an already normalized path returns it unchanged.
 */
public final class JsonPaths {
  public static final String ROOT = "$";

  private static final Pattern PLAIN_NAME = Pattern.compile("[A-Za-z0-9_]+");
  private static final Pattern INDEX_SUFFIXES = Pattern.compile("^(.*?)((?:\\[[^\\[\\]\"]*\\])+)$");

  private JsonPaths() {}

  public static NormalizedPath normalize(String path) {
    if (path == null) return root();
    String p = path.trim();
    if (p.isEmpty() || ROOT.equals(p)) return root();
    if (p.startsWith("$.")) p = p.substring(2);
    else if (p.startsWith("$")) p = p.substring(1);
    else if (p.startsWith(".")) p = p.substring(1);
    return render(parse(p));
  }

  public static NormalizedPath normalize(List<String> segments) {
    Objects.requireNonNull(segments, "segments");
    List<Step> steps = new ArrayList<>();
    for (String s : segments) {
      if (s == null || s.isEmpty()) continue;
      Matcher m = INDEX_SUFFIXES.matcher(s);
      if (m.matches()) {
        if (!m.group(1).isEmpty()) steps.add(Step.name(m.group(1)));
        String suffixes = m.group(2);
        int i = 0;
        while (i < suffixes.length()) {
          int close = suffixes.indexOf(']', i);
          addIndex(suffixes.substring(i + 1, close), steps);
          i = close + 1;
        }
      } else {
        steps.add(Step.name(s));
      }
    }
    return render(steps);
  }

  private static NormalizedPath root() {
    return new NormalizedPath(ROOT, List.of());
  }

  private static List<Step> parse(String p) {
    List<Step> steps = new ArrayList<>();
    StringBuilder name = new StringBuilder();
    int i = 0;
    while (i < p.length()) {
      char c = p.charAt(i);
      if (c == '.') {
        flushName(name, steps);
        i++;
      } else if (c == '[') {
        flushName(name, steps);
        i = p.startsWith("[\"", i) ? readQuoted(p, i + 2, steps) : readIndex(p, i + 1, steps);
      } else {
        name.append(c);
        i++;
      }
    }
    flushName(name, steps);
    return steps;
  }

  private static void flushName(StringBuilder name, List<Step> steps) {
    if (name.length() == 0) return;
    steps.add(Step.name(name.toString()));
    name.setLength(0);
  }

  // Reads a ["..."] step starting after the opening quote; returns the index after the closing bracket.
  private static int readQuoted(String p, int from, List<Step> steps) {
    StringBuilder sb = new StringBuilder();
    int i = from;
    while (i < p.length()) {
      char c = p.charAt(i);
      if (c == '\\' && i + 1 < p.length()) {
        sb.append(p.charAt(i + 1));
        i += 2;
        continue;
      }
      if (c == '"' && i + 1 < p.length() && p.charAt(i + 1) == ']') {
        if (sb.length() > 0) steps.add(Step.name(sb.toString()));
        return i + 2;
      }
      sb.append(c);
      i++;
    }
    throw new InvalidPathException("Unterminated quoted segment in path: " + p);
  }

  private static int readIndex(String p, int from, List<Step> steps) {
    int close = p.indexOf(']', from);
    if (close < 0) throw new InvalidPathException("Unterminated index in path: " + p);
    addIndex(p.substring(from, close), steps);
    return close + 1;
  }

  // Index contents are trimmed; empty brackets add no step.
  private static void addIndex(String content, List<Step> steps) {
    String c = content.trim();
    if (!c.isEmpty()) steps.add(Step.index(c));
  }

  private static NormalizedPath render(List<Step> steps) {
    if (steps.isEmpty()) return root();
    StringBuilder sb = new StringBuilder(ROOT);
    List<String> segments = new ArrayList<>(steps.size());
    for (Step s : steps) {
      segments.add(s.value());
      if (s.isIndex()) {
        sb.append('[').append(s.value()).append(']');
      } else if (PLAIN_NAME.matcher(s.value()).matches()) {
        sb.append('.').append(s.value());
      } else {
        sb.append("[\"").append(escape(s.value())).append("\"]");
      }
    }
    return new NormalizedPath(sb.toString(), segments);
  }

  private static String escape(String name) {
    return name.replace("\\", "\\\\").replace("\"", "\\\"");
  }

  private record Step(String value, boolean isIndex) {
    static Step name(String v) { return new Step(v, false); }
    static Step index(String v) { return new Step(v, true); }
  }
}
