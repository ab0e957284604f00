package io.intellixity.sealquery.query;

import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;

import java.util.List;
import java.util.Map;

public final class QueryTerms {
  private QueryTerms() {}

  public static ScalarTerm value(Object value, ColumnRef column, TableRef table) {
    return new ScalarTerm(value, column, table, null, null);
  }

  public static ScalarTerm value(Object value, ColumnRef column, TableRef table, OperationKind queryType) {
    return new ScalarTerm(value, column, table, queryType, null);
  }

  /** Selects a path: {@code "user.email"}, {@code "$.user.email"} or {@code "items[0]"}. */
  public static JsonPathTerm path(String path, ColumnRef column, TableRef table) {
    return new JsonPathTerm(path, false, null, column, table, null, null);
  }

  public static JsonPathTerm path(List<String> segments, ColumnRef column, TableRef table) {
    return new JsonPathTerm(segments, false, null, column, table, null, null);
  }

  /** The content at {@code path} equals {@code value}. */
  public static JsonPathTerm pathEquals(String path, Object value, ColumnRef column, TableRef table) {
    return new JsonPathTerm(path, true, value, column, table, null, null);
  }

  public static JsonPathTerm pathEquals(List<String> segments, Object value, ColumnRef column, TableRef table) {
    return new JsonPathTerm(segments, true, value, column, table, null, null);
  }

  public static ContainmentTerm contains(Object value, ColumnRef column, TableRef table) {
    return new ContainmentTerm(ContainmentTerm.Direction.CONTAINS, value, column, table, null, null);
  }

  public static ContainmentTerm containedBy(Object value, ColumnRef column, TableRef table) {
    return new ContainmentTerm(ContainmentTerm.Direction.CONTAINED_BY, value, column, table, null, null);
  }

  /**
   * Parses a term from its map form, e.g. {@code {"column": "profile", "path": "user.email", "value": "a@b.c"}}.
   * <p>
   * Exactly one of {@code path}, {@code contains} or {@code containedBy} may be present; {@code value} alone
   * makes a scalar term and is allowed next to {@code path} only. {@code queryType} and {@code returnType}
   * take their wire names ({@code "steVecSelector"}, {@code "composite-literal"}).
   */
  public static QueryTerm fromMap(Map<String, Object> m, TableRef table) {
    if (m == null) throw new QueryValidationException("Query term must not be null");
    if (table == null) throw new QueryValidationException("Query term requires a table");

    Object columnName = m.get("column");
    if (!(columnName instanceof String name)) throw new QueryValidationException("Query term requires a column name");
    ColumnRef column = table.column(name);
    if (column == null) {
      throw new QueryValidationException("Column \"" + name + "\" is not declared on table \"" + table.name() + "\"");
    }

    OperationKind queryType = m.get("queryType") == null ? null : OperationKind.fromWireName(String.valueOf(m.get("queryType")));
    ReturnType returnType = m.get("returnType") == null ? null : ReturnType.fromWireName(String.valueOf(m.get("returnType")));

    int shapes = (m.containsKey("path") ? 1 : 0) + (m.containsKey("contains") ? 1 : 0) + (m.containsKey("containedBy") ? 1 : 0);
    if (shapes > 1) {
      throw new QueryValidationException("Query term must use only one of path, contains or containedBy: " + m.keySet());
    }

    if (m.containsKey("path")) {
      Object p = m.get("path");
      boolean hasValue = m.containsKey("value");
      if (p instanceof String s) {
        return new JsonPathTerm(s, hasValue, m.get("value"), column, table, queryType, returnType);
      }
      if (p instanceof List<?> l) {
        List<String> segments = l.stream().map(String::valueOf).toList();
        return new JsonPathTerm(segments, hasValue, m.get("value"), column, table, queryType, returnType);
      }
      throw new QueryValidationException("path must be a string or a list of segments");
    }
    if (m.containsKey("contains") || m.containsKey("containedBy")) {
      if (m.containsKey("value")) {
        throw new QueryValidationException("Query term must not combine value with contains or containedBy");
      }
      return m.containsKey("contains")
          ? new ContainmentTerm(ContainmentTerm.Direction.CONTAINS, m.get("contains"), column, table, queryType, returnType)
          : new ContainmentTerm(ContainmentTerm.Direction.CONTAINED_BY, m.get("containedBy"), column, table, queryType, returnType);
    }
    if (m.containsKey("value")) {
      return new ScalarTerm(m.get("value"), column, table, queryType, returnType);
    }
    throw new QueryValidationException("Query term must have one of value, path, contains or containedBy");
  }
}
