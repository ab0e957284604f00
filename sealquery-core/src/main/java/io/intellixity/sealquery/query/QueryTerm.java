package io.intellixity.sealquery.query;

import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;

import java.util.Objects;

/**
 * A single value to encrypt for querying against one column.
 * <p>
 * Subtypes: {@link ScalarTerm}, {@link JsonPathTerm} and {@link ContainmentTerm}. Terms are immutable.
 */
public abstract class QueryTerm {
  private final ColumnRef column;
  private final TableRef table;
  private final OperationKind queryType;
  private final ReturnType returnType;

  protected QueryTerm(ColumnRef column, TableRef table, OperationKind queryType, ReturnType returnType) {
    this.column = Objects.requireNonNull(column, "column");
    this.table = Objects.requireNonNull(table, "table");
    this.queryType = queryType;
    this.returnType = returnType == null ? ReturnType.RAW : returnType;
  }

  public ColumnRef column() { return column; }
  public TableRef table() { return table; }

  /** Explicit operation, or {@code null} to infer it from the column and value. */
  public OperationKind queryType() { return queryType; }
  public ReturnType returnType() { return returnType; }

  public abstract QueryTerm withQueryType(OperationKind queryType);
  public abstract QueryTerm withReturnType(ReturnType returnType);
}
