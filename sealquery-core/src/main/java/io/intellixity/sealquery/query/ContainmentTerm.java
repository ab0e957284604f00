package io.intellixity.sealquery.query;

import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;

import java.util.Objects;

/** JSON containment: the column contains ({@code @>}) or is contained by ({@code <@}) the value. */
public final class ContainmentTerm extends QueryTerm {
  public enum Direction { CONTAINS, CONTAINED_BY }

  private final Direction direction;
  private final Object value;

  public ContainmentTerm(Direction direction, Object value,
                         ColumnRef column, TableRef table, OperationKind queryType, ReturnType returnType) {
    super(column, table, queryType, returnType);
    this.direction = Objects.requireNonNull(direction, "direction");
    this.value = value;
  }

  public Direction direction() { return direction; }
  public Object value() { return value; }

  @Override
  public ContainmentTerm withQueryType(OperationKind queryType) {
    return new ContainmentTerm(direction, value, column(), table(), queryType, returnType());
  }

  @Override
  public ContainmentTerm withReturnType(ReturnType returnType) {
    return new ContainmentTerm(direction, value, column(), table(), queryType(), returnType);
  }

  @Override
  public String toString() {
    return "ContainmentTerm{" + table().name() + "." + column().name() + ", " + direction + "}";
  }
}
