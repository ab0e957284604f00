package io.intellixity.sealquery.format;

/** A value handed over for decryption is not an encrypted payload. */
public final class MalformedPayloadException extends RuntimeException {
  public MalformedPayloadException(String message) {
    super(message);
  }

  public MalformedPayloadException(String message, Throwable cause) {
    super(message, cause);
  }
}
