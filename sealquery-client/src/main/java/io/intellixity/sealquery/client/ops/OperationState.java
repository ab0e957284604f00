package io.intellixity.sealquery.client.ops;

public enum OperationState {
  /** Constructed without a lock context. */
  UNBOUND,
  /** A lock context is attached and will be resolved before the engine call. */
  BOUND,
  /** {@code execute()} has produced a result. */
  EXECUTED
}
