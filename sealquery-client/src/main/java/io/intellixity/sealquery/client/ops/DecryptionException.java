package io.intellixity.sealquery.client.ops;

/** A field or item could not be decrypted. */
public final class DecryptionException extends RuntimeException {
  public DecryptionException(String message) {
    super(message);
  }
}
