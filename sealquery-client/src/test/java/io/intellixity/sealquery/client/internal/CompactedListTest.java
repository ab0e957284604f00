package io.intellixity.sealquery.client.internal;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

import static org.junit.jupiter.api.Assertions.*;

final class CompactedListTest {

  @Test
  void expandsResultsBackToOriginalPositions() {
    CompactedList<String> c = CompactedList.of(Arrays.asList(null, "a", null, null, "b"), Objects::isNull);
    assertEquals(List.of("a", "b"), c.values());
    assertEquals(4, c.positionOf(1));
    assertEquals(Arrays.asList(null, "A", null, null, "B"), c.expand(List.of("A", "B")));
  }

  @Test
  void mismatchedResultCountFails() {
    CompactedList<String> c = CompactedList.of(List.of("a", "b"), Objects::isNull);
    assertThrows(IllegalStateException.class, () -> c.expand(List.of("A")));
  }
}
