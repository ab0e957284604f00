package io.intellixity.sealquery.query;

import io.intellixity.sealquery.format.EncryptedPayload;

import java.util.List;
import java.util.Objects;

/**
 * A term after classification: the resolved operation and the engine calls it needs.
 * A passthrough term (null plaintext) has no operation and no parts.
 */
public final class ClassifiedTerm {
  private final QueryTerm term;
  private final OperationKind operation;
  private final List<QueryPart> parts;

  private ClassifiedTerm(QueryTerm term, OperationKind operation, List<QueryPart> parts) {
    this.term = term;
    this.operation = operation;
    this.parts = parts;
  }

  static ClassifiedTerm passthrough(QueryTerm term) {
    return new ClassifiedTerm(term, null, List.of());
  }

  static ClassifiedTerm of(QueryTerm term, OperationKind operation, List<QueryPart> parts) {
    Objects.requireNonNull(operation, "operation");
    if (operation.isMeta()) throw new IllegalArgumentException("Unresolved operation: " + operation);
    if (parts.isEmpty()) throw new IllegalArgumentException("Classified term needs at least one part");
    return new ClassifiedTerm(term, operation, List.copyOf(parts));
  }

  public QueryTerm term() { return term; }
  public OperationKind operation() { return operation; }
  public List<QueryPart> parts() { return parts; }
  public boolean isPassthrough() { return parts.isEmpty(); }

  /**
   * Combines the engine results for {@link #parts()} (same order) into the term's payload.
   * A selector and term pair merges into the term payload carrying the selector's {@code s}, when it has one.
   */
  public EncryptedPayload assemble(List<EncryptedPayload> results) {
    if (isPassthrough()) return null;
    if (results.size() != parts.size()) {
      throw new IllegalStateException("Expected " + parts.size() + " encrypted parts, got " + results.size());
    }
    if (parts.size() == 1) return results.get(0);

    EncryptedPayload selector = null;
    EncryptedPayload value = null;
    for (int i = 0; i < parts.size(); i++) {
      if (parts.get(i).role() == QueryPart.Role.SELECTOR) selector = results.get(i);
      else value = results.get(i);
    }
    if (selector == null || value == null) throw new IllegalStateException("Expected a selector and a term part");
    return selector.selector() == null ? value : value.with(EncryptedPayload.SELECTOR, selector.selector());
  }

  @Override
  public String toString() {
    return "ClassifiedTerm{" + term + ", operation=" + operation + ", parts=" + parts.size() + "}";
  }
}
