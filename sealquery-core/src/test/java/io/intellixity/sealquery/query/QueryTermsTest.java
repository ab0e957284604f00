package io.intellixity.sealquery.query;

import io.intellixity.sealquery.path.InvalidPathException;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class QueryTermsTest {
  private static final TableRef USERS = TableRef.of("users",
      ColumnRef.of("email").equality(),
      ColumnRef.of("profile").searchableJson());

  @Test
  void parsesScalarTerm() {
    QueryTerm t = QueryTerms.fromMap(Map.of("column", "email", "value", "a@b.c", "returnType", "composite-literal"), USERS);
    assertTrue(t instanceof ScalarTerm);
    assertEquals("a@b.c", ((ScalarTerm) t).value());
    assertEquals(ReturnType.COMPOSITE_LITERAL, t.returnType());
    assertNull(t.queryType());
  }

  @Test
  void parsesPathTermWithValue() {
    QueryTerm t = QueryTerms.fromMap(Map.of("column", "profile", "path", "user.email", "value", "a@b.c"), USERS);
    JsonPathTerm p = (JsonPathTerm) t;
    assertEquals("$.user.email", p.normalizedPath().jsonPath());
    assertTrue(p.hasValue());
  }

  @Test
  void pathIsKeptAsGivenUntilClassified() {
    JsonPathTerm bad = QueryTerms.path("items[0", USERS.column("profile"), USERS);
    assertEquals("items[0", bad.rawPath());
    assertThrows(InvalidPathException.class, bad::normalizedPath);

    JsonPathTerm segments = QueryTerms.pathEquals(List.of("items[ 0 ]", "id"), 7, USERS.column("profile"), USERS);
    assertEquals(List.of("items[ 0 ]", "id"), segments.rawSegments());
    assertEquals("$.items[0].id", segments.normalizedPath().jsonPath());
  }

  @Test
  void explicitNullValueOnPathCountsAsPresent() {
    Map<String, Object> m = new HashMap<>();
    m.put("column", "profile");
    m.put("path", List.of("user", "email"));
    m.put("value", null);
    JsonPathTerm p = (JsonPathTerm) QueryTerms.fromMap(m, USERS);
    assertTrue(p.hasValue());
    assertNull(p.value());
  }

  @Test
  void parsesContainmentAndQueryType() {
    QueryTerm t = QueryTerms.fromMap(
        Map.of("column", "profile", "containedBy", Map.of("a", 1), "queryType", "steVecTerm"), USERS);
    ContainmentTerm c = (ContainmentTerm) t;
    assertEquals(ContainmentTerm.Direction.CONTAINED_BY, c.direction());
    assertEquals(OperationKind.STE_VEC_TERM, c.queryType());
  }

  @Test
  void rejectsMoreThanOneShape() {
    assertThrows(QueryValidationException.class, () -> QueryTerms.fromMap(
        Map.of("column", "profile", "path", "a", "contains", Map.of("a", 1)), USERS));
    assertThrows(QueryValidationException.class, () -> QueryTerms.fromMap(
        Map.of("column", "profile", "contains", Map.of("a", 1), "value", 1), USERS));
  }

  @Test
  void rejectsUnknownColumnAndEmptyTerm() {
    assertThrows(QueryValidationException.class, () -> QueryTerms.fromMap(Map.of("column", "nope", "value", 1), USERS));
    assertThrows(QueryValidationException.class, () -> QueryTerms.fromMap(Map.of("column", "email"), USERS));
    assertThrows(QueryValidationException.class,
        () -> QueryTerms.fromMap(Map.of("column", "email", "value", 1, "queryType", "fuzzy"), USERS));
  }

  @Test
  void withersCopy() {
    ScalarTerm t = QueryTerms.value("x", USERS.column("email"), USERS);
    ScalarTerm forced = t.withQueryType(OperationKind.EQUALITY).withReturnType(ReturnType.ESCAPED_COMPOSITE_LITERAL);
    assertNull(t.queryType());
    assertEquals(ReturnType.RAW, t.returnType());
    assertEquals(OperationKind.EQUALITY, forced.queryType());
    assertEquals(ReturnType.ESCAPED_COMPOSITE_LITERAL, forced.returnType());
  }
}
