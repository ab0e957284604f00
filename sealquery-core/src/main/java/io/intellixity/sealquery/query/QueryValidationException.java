package io.intellixity.sealquery.query;

/**
 * Raised when a query term or plaintext is rejected before anything reaches the encryption engine:
 * a missing index, a value whose shape does not fit the chosen operation, or an unusable path.
 */
public class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
