package io.intellixity.sealquery.result;

import java.util.Objects;

/**
 * Failure half of a {@link Result}.
 *
 * @param code engine-provided error code, or {@code null} when the failure did not come from the engine
 */
public record EncryptionError(ErrorType type, String message, String code) {
  public EncryptionError {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(message, "message");
  }

  public static EncryptionError of(ErrorType type, String message) {
    return new EncryptionError(type, message, null);
  }

  public static EncryptionError validation(String message) {
    return of(ErrorType.VALIDATION_ERROR, message);
  }

  public static EncryptionError engine(String message, String code) {
    return new EncryptionError(ErrorType.ENGINE_ERROR, message, code);
  }

  public static EncryptionError lockContext(String message) {
    return of(ErrorType.LOCK_CONTEXT_ERROR, message);
  }

  public static EncryptionError decryption(String message) {
    return of(ErrorType.DECRYPTION_ERROR, message);
  }

  public static EncryptionError clientInit(String message) {
    return of(ErrorType.CLIENT_INIT_ERROR, message);
  }

  @Override
  public String toString() {
    return code == null ? type + ": " + message : type + "[" + code + "]: " + message;
  }
}
