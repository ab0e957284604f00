package io.intellixity.sealquery.spi.engine;

/** Failure reported by an {@link EncryptionEngine}, with the engine's stable error code when it has one. */
public final class EngineException extends RuntimeException {
  private final String code;

  public EngineException(String code, String message) {
    super(message);
    this.code = code;
  }

  public EngineException(String code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String code() { return code; }
}
