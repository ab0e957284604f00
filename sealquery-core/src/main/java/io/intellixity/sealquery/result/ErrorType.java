package io.intellixity.sealquery.result;

public enum ErrorType {
  VALIDATION_ERROR,
  ENGINE_ERROR,
  LOCK_CONTEXT_ERROR,
  DECRYPTION_ERROR,
  CLIENT_INIT_ERROR
}
