package io.intellixity.sealquery.client.internal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * The non-null entries of a list plus the positions they came from, so engine results for the compacted
 * entries can be put back in place with nulls where the skipped entries were.
 */
public final class CompactedList<T> {
  private final int originalSize;
  private final List<T> values;
  private final int[] positions;

  private CompactedList(int originalSize, List<T> values, int[] positions) {
    this.originalSize = originalSize;
    this.values = values;
    this.positions = positions;
  }

  public static <T> CompactedList<T> of(List<? extends T> items, Predicate<? super T> skip) {
    List<T> values = new ArrayList<>();
    int[] positions = new int[items.size()];
    int n = 0;
    for (int i = 0; i < items.size(); i++) {
      T item = items.get(i);
      if (skip.test(item)) continue;
      values.add(item);
      positions[n++] = i;
    }
    int[] trimmed = new int[n];
    System.arraycopy(positions, 0, trimmed, 0, n);
    return new CompactedList<>(items.size(), Collections.unmodifiableList(values), trimmed);
  }

  public List<T> values() { return values; }
  public int originalSize() { return originalSize; }
  public boolean isEmpty() { return values.isEmpty(); }

  /** Original index of the i-th compacted value. */
  public int positionOf(int i) { return positions[i]; }

  /**
   * Spreads {@code results} (one per compacted value, same order) back over the original positions.
   *
   * @throws IllegalStateException when the result count does not match the compacted count
   */
  public <R> List<R> expand(List<? extends R> results) {
    if (results.size() != values.size()) {
      throw new IllegalStateException("Engine returned " + results.size() + " results for " + values.size() + " items");
    }
    List<R> out = new ArrayList<>(Collections.nCopies(originalSize, (R) null));
    for (int i = 0; i < results.size(); i++) {
      out.set(positions[i], results.get(i));
    }
    return out;
  }
}
