package io.intellixity.sealquery.identity;

/** Identity or session resolution failed. */
public final class LockContextException extends RuntimeException {
  public LockContextException(String message) {
    super(message);
  }

  public LockContextException(String message, Throwable cause) {
    super(message, cause);
  }
}
