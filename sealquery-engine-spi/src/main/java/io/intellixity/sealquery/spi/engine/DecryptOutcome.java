package io.intellixity.sealquery.spi.engine;

/** Result of one item in a fallible bulk decrypt: either {@code data} or an {@code error} message. */
public record DecryptOutcome(String id, Object data, String error) {
  public static DecryptOutcome success(String id, Object data) {
    return new DecryptOutcome(id, data, null);
  }

  public static DecryptOutcome failure(String id, String error) {
    if (error == null) throw new IllegalArgumentException("error must not be null");
    return new DecryptOutcome(id, null, error);
  }

  public boolean isError() { return error != null; }
}
