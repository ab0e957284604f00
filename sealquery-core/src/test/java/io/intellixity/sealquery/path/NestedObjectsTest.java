package io.intellixity.sealquery.path;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class NestedObjectsTest {

  @Test
  void buildsNestedObjectFromDotPath() {
    assertEquals(Map.of("user", Map.of("role", "admin")), NestedObjects.build("user.role", "admin"));
    assertEquals(Map.of("a", Map.of("b", Map.of("c", 1))), NestedObjects.build("$.a.b.c", 1));
  }

  @Test
  void nullLeafIsKept() {
    Map<String, Object> out = NestedObjects.build("user.data", null);
    Object user = out.get("user");
    assertTrue(user instanceof Map<?, ?>);
    assertTrue(((Map<?, ?>) user).containsKey("data"));
    assertNull(((Map<?, ?>) user).get("data"));
  }

  @Test
  void emptyPathFails() {
    InvalidPathException e = assertThrows(InvalidPathException.class, () -> NestedObjects.build("", "x"));
    assertEquals("Path cannot be empty", e.getMessage());
  }

  @Test
  void rootOnlyPathFails() {
    InvalidPathException e = assertThrows(InvalidPathException.class, () -> NestedObjects.build("$", "x"));
    assertEquals("Path must contain at least one segment", e.getMessage());
    assertThrows(InvalidPathException.class, () -> NestedObjects.build("$.", "x"));
  }

  @Test
  void forbiddenSegmentsFail() {
    InvalidPathException e = assertThrows(InvalidPathException.class, () -> NestedObjects.build("__proto__.x", "y"));
    assertEquals("Path contains forbidden segment: __proto__", e.getMessage());
    assertThrows(InvalidPathException.class, () -> NestedObjects.build("a.constructor.b", "y"));
    assertThrows(InvalidPathException.class, () -> NestedObjects.build(List.of("a", "prototype"), "y"));
  }

  @Test
  void bracketPathsUseSegmentNames() {
    assertEquals(Map.of("a-b", Map.of("c", 1)), NestedObjects.build("$[\"a-b\"].c", 1));
    assertEquals(Map.of("items", Map.of("0", Map.of("id", 7))), NestedObjects.build("items[0].id", 7));
  }

  @Test
  void bracketedForbiddenSegmentsFail() {
    InvalidPathException e = assertThrows(InvalidPathException.class,
        () -> NestedObjects.build("$[\"__proto__\"].polluted", true));
    assertEquals("Path contains forbidden segment: __proto__", e.getMessage());
    assertThrows(InvalidPathException.class, () -> NestedObjects.build("a[\"constructor\"]", "y"));
  }

  @Test
  void segmentListIsUsedVerbatim() {
    assertEquals(Map.of("field-name", Map.of("x", true)), NestedObjects.build(List.of("field-name", "x"), true));
  }
}
