package io.intellixity.sealquery.query;

import io.intellixity.sealquery.path.NestedObjects;
import io.intellixity.sealquery.path.NormalizedPath;
import io.intellixity.sealquery.result.EncryptionError;
import io.intellixity.sealquery.result.Result;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.IndexKind;

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Decides which operation a {@link QueryTerm} is encrypted for and which engine calls it needs.
 * <p>
 * Resolution order:
 * <ol>
 *   <li>a null plaintext is a passthrough and needs no engine call</li>
 *   <li>an explicit {@code queryType} wins, provided its index is configured on the column</li>
 *   <li>otherwise the column's single configured index decides; several indexes are ambiguous</li>
 *   <li>on ste_vec columns the plaintext shape picks selector (string) or term (object/array)</li>
 * </ol>
 * Classification is pure: it never calls the engine.
 */
public final class QueryTermClassifier {

  public Result<ClassifiedTerm> classify(QueryTerm term) {
    try {
      return Result.data(resolve(term));
    } catch (QueryValidationException e) {
      return Result.failure(EncryptionError.validation(e.getMessage()));
    }
  }

  /** @throws QueryValidationException when the term cannot be encrypted for querying */
  public ClassifiedTerm resolve(QueryTerm term) {
    Objects.requireNonNull(term, "term");
    if (term instanceof ScalarTerm s) return resolveScalar(s);
    if (term instanceof JsonPathTerm p) return resolvePath(p);
    if (term instanceof ContainmentTerm c) return resolveContainment(c);
    throw new QueryValidationException("Unsupported query term: " + term.getClass().getName());
  }

  private ClassifiedTerm resolveScalar(ScalarTerm term) {
    Object value = term.value();
    PlaintextShape shape = PlaintextShape.of(value);
    if (shape == PlaintextShape.NULL) return ClassifiedTerm.passthrough(term);
    Plaintexts.requireEncryptable(value);

    ColumnRef column = term.column();
    OperationKind explicit = term.queryType();
    OperationKind op;
    boolean strict;
    if (explicit == null) {
      op = inferFromColumn(column);
      strict = false;
    } else {
      requireIndex(column, explicit);
      op = explicit;
      strict = true;
    }
    if (op == OperationKind.SEARCHABLE_JSON) {
      op = shape == PlaintextShape.STRING ? OperationKind.STE_VEC_SELECTOR : OperationKind.STE_VEC_TERM;
      strict = false;
    }
    checkShape(op, shape, column, strict);
    return ClassifiedTerm.of(term, op, List.of(new QueryPart(QueryPart.Role.VALUE, value, op.index(), op)));
  }

  private ClassifiedTerm resolvePath(JsonPathTerm term) {
    ColumnRef column = term.column();
    requireSteVec(column);
    if (term.hasValue() && term.value() == null) return ClassifiedTerm.passthrough(term);

    OperationKind explicit = term.queryType();
    if (explicit != null && explicit.index() != IndexKind.STE_VEC) {
      throw new QueryValidationException("Query type \"" + explicit.wireName()
          + "\" cannot be used with a JSON path; use steVecSelector or steVecTerm");
    }
    NormalizedPath path = term.normalizedPath();

    if (explicit == OperationKind.STE_VEC_TERM) {
      if (!term.hasValue()) {
        throw new QueryValidationException("steVecTerm on path " + path + " requires a value");
      }
      Object nested = nestedValue(path, term.value());
      return ClassifiedTerm.of(term, OperationKind.STE_VEC_TERM,
          List.of(new QueryPart(QueryPart.Role.TERM, nested, IndexKind.STE_VEC, OperationKind.STE_VEC_TERM)));
    }

    QueryPart selector = new QueryPart(QueryPart.Role.SELECTOR, path.jsonPath(), IndexKind.STE_VEC,
        OperationKind.STE_VEC_SELECTOR);
    if (!term.hasValue()) return ClassifiedTerm.of(term, OperationKind.STE_VEC_SELECTOR, List.of(selector));

    Object nested = nestedValue(path, term.value());
    return ClassifiedTerm.of(term, OperationKind.STE_VEC_SELECTOR, List.of(
        selector,
        new QueryPart(QueryPart.Role.TERM, nested, IndexKind.STE_VEC, OperationKind.STE_VEC_TERM)));
  }

  private ClassifiedTerm resolveContainment(ContainmentTerm term) {
    ColumnRef column = term.column();
    requireSteVec(column);
    Object value = term.value();
    PlaintextShape shape = PlaintextShape.of(value);
    if (shape == PlaintextShape.NULL) return ClassifiedTerm.passthrough(term);
    Plaintexts.requireEncryptable(value);

    OperationKind explicit = term.queryType();
    if (explicit != null && explicit.index() != IndexKind.STE_VEC) {
      throw new QueryValidationException("Query type \"" + explicit.wireName()
          + "\" cannot be used with a containment query; use steVecTerm");
    }
    OperationKind op = explicit == OperationKind.STE_VEC_SELECTOR ? OperationKind.STE_VEC_SELECTOR : OperationKind.STE_VEC_TERM;
    checkShape(op, shape, column, true);
    QueryPart.Role role = op == OperationKind.STE_VEC_SELECTOR ? QueryPart.Role.SELECTOR : QueryPart.Role.TERM;
    return ClassifiedTerm.of(term, op, List.of(new QueryPart(role, value, IndexKind.STE_VEC, op)));
  }

  private static Object nestedValue(NormalizedPath path, Object value) {
    Plaintexts.requireEncryptable(value);
    return NestedObjects.build(path.segments(), value);
  }

  private static OperationKind inferFromColumn(ColumnRef column) {
    Set<IndexKind> indexes = column.indexes();
    if (indexes.isEmpty()) {
      throw new QueryValidationException("Column \"" + column.name() + "\" has no indexes configured");
    }
    if (indexes.size() > 1) {
      String names = indexes.stream().map(IndexKind::engineName).collect(Collectors.joining(", "));
      throw new QueryValidationException("Ambiguous index selection on column \"" + column.name()
          + "\": configured indexes [" + names + "]; pass an explicit queryType");
    }
    return OperationKind.forIndex(indexes.iterator().next());
  }

  private static void requireIndex(ColumnRef column, OperationKind op) {
    if (op.index() == IndexKind.STE_VEC) {
      requireSteVec(column);
      return;
    }
    if (!column.hasIndex(op.index())) {
      throw new QueryValidationException("Index type \"" + op.index().engineName()
          + "\" is not configured on column \"" + column.name() + "\"");
    }
  }

  private static void requireSteVec(ColumnRef column) {
    if (!column.hasIndex(IndexKind.STE_VEC)) {
      throw new QueryValidationException("Column \"" + column.name()
          + "\" does not have ste_vec index configured. Use searchableJson() when declaring the column.");
    }
  }

  /**
   * {@code strict} is set for explicitly requested operations; inferred ste_vec terms let bare numbers and
   * booleans through for the engine to judge.
   */
  private static void checkShape(OperationKind op, PlaintextShape shape, ColumnRef column, boolean strict) {
    switch (op) {
      case FREE_TEXT_SEARCH -> {
        if (shape == PlaintextShape.NUMBER) {
          throw new QueryValidationException("Cannot use freeTextSearch with a numeric value on column \""
              + column.name() + "\"; match indexes require string plaintext");
        }
      }
      case STE_VEC_SELECTOR -> {
        if (shape != PlaintextShape.STRING) {
          throw new QueryValidationException("steVecSelector on column \"" + column.name()
              + "\" requires a JSONPath string, got " + shape.name().toLowerCase());
        }
      }
      case STE_VEC_TERM -> {
        if (shape == PlaintextShape.STRING) {
          throw new QueryValidationException("steVecTerm on column \"" + column.name()
              + "\" does not accept a string; use steVecSelector for JSONPath queries");
        }
        if (strict && !shape.isContainer()) {
          throw new QueryValidationException("steVecTerm on column \"" + column.name() + "\" requires an object or array; "
              + "wrap the " + shape.name().toLowerCase() + " in an object, e.g. {\"field\": value}");
        }
      }
      default -> {
      }
    }
  }
}
