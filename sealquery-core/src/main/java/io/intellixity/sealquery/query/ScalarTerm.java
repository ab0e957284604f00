package io.intellixity.sealquery.query;

import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;

/** Plain value compared against a column: equality, range, match, or a JSON selector/term. */
public final class ScalarTerm extends QueryTerm {
  private final Object value;

  public ScalarTerm(Object value, ColumnRef column, TableRef table, OperationKind queryType, ReturnType returnType) {
    super(column, table, queryType, returnType);
    this.value = value;
  }

  public Object value() { return value; }

  @Override
  public ScalarTerm withQueryType(OperationKind queryType) {
    return new ScalarTerm(value, column(), table(), queryType, returnType());
  }

  @Override
  public ScalarTerm withReturnType(ReturnType returnType) {
    return new ScalarTerm(value, column(), table(), queryType(), returnType);
  }

  @Override
  public String toString() {
    return "ScalarTerm{" + table().name() + "." + column().name() + ", queryType=" + queryType() + "}";
  }
}
