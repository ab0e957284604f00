package io.intellixity.sealquery.client.ops;

/** Either decrypted {@code data} or a per-item {@code error}; one of the two is always null. */
public record BulkDecryptedItem(String id, Object data, String error) {
  public static BulkDecryptedItem success(String id, Object data) {
    return new BulkDecryptedItem(id, data, null);
  }

  public static BulkDecryptedItem failure(String id, String error) {
    return new BulkDecryptedItem(id, null, error);
  }

  public boolean isError() { return error != null; }
}
