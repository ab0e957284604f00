package io.intellixity.sealquery.path;

import io.intellixity.sealquery.query.QueryValidationException;

/** Raised when a path cannot be turned into a nested object. */
public final class InvalidPathException extends QueryValidationException {
  public InvalidPathException(String message) {
    super(message);
  }
}
