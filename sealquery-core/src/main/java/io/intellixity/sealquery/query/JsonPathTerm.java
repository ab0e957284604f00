package io.intellixity.sealquery.query;

import io.intellixity.sealquery.path.InvalidPathException;
import io.intellixity.sealquery.path.JsonPaths;
import io.intellixity.sealquery.path.NormalizedPath;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Path into a JSON column, optionally with a value the path must equal.
 * <p>
 * A term without a value selects the path. A term with a value compares the path's content; an explicitly
 * supplied {@code null} value counts as present.
 * <p>
 * The path is kept as given, a string or a segment list, and only normalized when the term is classified.
 */
public final class JsonPathTerm extends QueryTerm {
  private final String path;
  private final List<String> segments;
  private final boolean hasValue;
  private final Object value;

  public JsonPathTerm(String path, boolean hasValue, Object value,
                      ColumnRef column, TableRef table, OperationKind queryType, ReturnType returnType) {
    this(path, null, hasValue, value, column, table, queryType, returnType);
  }

  public JsonPathTerm(List<String> segments, boolean hasValue, Object value,
                      ColumnRef column, TableRef table, OperationKind queryType, ReturnType returnType) {
    this(null, Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(segments, "segments"))), hasValue, value, column, table, queryType, returnType);
  }

  private JsonPathTerm(String path, List<String> segments, boolean hasValue, Object value,
                       ColumnRef column, TableRef table, OperationKind queryType, ReturnType returnType) {
    super(column, table, queryType, returnType);
    this.path = path;
    this.segments = segments;
    this.hasValue = hasValue;
    this.value = hasValue ? value : null;
  }

  /** The path string as given, or {@code null} when the term was built from segments. */
  public String rawPath() { return path; }
  /** The segments as given, or {@code null} when the term was built from a string. */
  public List<String> rawSegments() { return segments; }
  public boolean hasValue() { return hasValue; }
  public Object value() { return value; }

  /** @throws InvalidPathException when the path does not parse */
  public NormalizedPath normalizedPath() {
    return segments != null ? JsonPaths.normalize(segments) : JsonPaths.normalize(path);
  }

  @Override
  public JsonPathTerm withQueryType(OperationKind queryType) {
    return new JsonPathTerm(path, segments, hasValue, value, column(), table(), queryType, returnType());
  }

  @Override
  public JsonPathTerm withReturnType(ReturnType returnType) {
    return new JsonPathTerm(path, segments, hasValue, value, column(), table(), queryType(), returnType);
  }

  @Override
  public String toString() {
    return "JsonPathTerm{" + table().name() + "." + column().name() + ", path=" + (segments != null ? segments : path)
        + ", hasValue=" + hasValue + "}";
  }
}
