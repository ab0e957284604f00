package io.intellixity.sealquery.client.ops;

/** Input to {@link BulkEncryptOperation}; {@code id} is optional and echoed back. */
public record BulkEncryptItem(String id, Object plaintext) {
  public static BulkEncryptItem of(Object plaintext) {
    return new BulkEncryptItem(null, plaintext);
  }
}
