package io.intellixity.sealquery.result;

import java.util.Objects;
import java.util.function.Function;

/**
 * Either a value or an {@link EncryptionError}. Public entry points return this instead of throwing.
 * <p>
 * The data side may be {@code null} (a null plaintext encrypts to null).
 */
public final class Result<T> {
  private final T data;
  private final EncryptionError failure;

  private Result(T data, EncryptionError failure) {
    this.data = data;
    this.failure = failure;
  }

  public static <T> Result<T> data(T data) {
    return new Result<>(data, null);
  }

  public static <T> Result<T> failure(EncryptionError failure) {
    return new Result<>(null, Objects.requireNonNull(failure, "failure"));
  }

  public boolean isFailure() { return failure != null; }
  public EncryptionError failure() { return failure; }

  /** @throws IllegalStateException when this result is a failure */
  public T data() {
    if (failure != null) throw new IllegalStateException("Result is a failure: " + failure);
    return data;
  }

  public <R> Result<R> map(Function<? super T, ? extends R> fn) {
    if (failure != null) return failure(failure);
    return data(fn.apply(data));
  }

  @Override
  public String toString() {
    return failure != null ? "Result{failure=" + failure + "}" : "Result{data=" + data + "}";
  }
}
