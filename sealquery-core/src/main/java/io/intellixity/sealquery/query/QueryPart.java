package io.intellixity.sealquery.query;

import io.intellixity.sealquery.schema.IndexKind;

import java.util.Objects;

/**
 * One engine encryption needed for a term. Most terms need one; a path term with a value needs a
 * {@link Role#SELECTOR} and a {@link Role#TERM}.
 */
public record QueryPart(Role role, Object plaintext, IndexKind index, OperationKind operation) {
  public enum Role { VALUE, SELECTOR, TERM }

  public QueryPart {
    Objects.requireNonNull(role, "role");
    Objects.requireNonNull(index, "index");
    Objects.requireNonNull(operation, "operation");
  }

  public String queryOp() { return operation.queryOp(); }
}
