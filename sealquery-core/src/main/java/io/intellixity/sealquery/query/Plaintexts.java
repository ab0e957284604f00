package io.intellixity.sealquery.query;

import com.fasterxml.jackson.databind.JsonNode;

/** Checks applied to every plaintext before it can reach the engine. */
public final class Plaintexts {
  private Plaintexts() {}

  public static void requireEncryptable(Object value) {
    double d;
    if (value instanceof Double v) d = v;
    else if (value instanceof Float v) d = v;
    else if (value instanceof JsonNode n && n.isFloatingPointNumber()) d = n.doubleValue();
    else return;
    if (Double.isNaN(d)) throw new QueryValidationException("Cannot encrypt NaN value");
    if (Double.isInfinite(d)) throw new QueryValidationException("Cannot encrypt Infinity value");
  }
}
