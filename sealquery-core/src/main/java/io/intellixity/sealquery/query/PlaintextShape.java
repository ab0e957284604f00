package io.intellixity.sealquery.query;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Collection;
import java.util.Map;

/** JSON-level shape of a plaintext value. */
public enum PlaintextShape {
  NULL,
  STRING,
  NUMBER,
  BOOLEAN,
  OBJECT,
  ARRAY;

  public static PlaintextShape of(Object value) {
    if (value == null) return NULL;
    if (value instanceof CharSequence || value instanceof Character) return STRING;
    if (value instanceof Number) return NUMBER;
    if (value instanceof Boolean) return BOOLEAN;
    if (value instanceof Map<?, ?>) return OBJECT;
    if (value instanceof Collection<?> || value.getClass().isArray()) return ARRAY;
    if (value instanceof JsonNode n) {
      if (n.isNull() || n.isMissingNode()) return NULL;
      if (n.isTextual()) return STRING;
      if (n.isNumber()) return NUMBER;
      if (n.isBoolean()) return BOOLEAN;
      if (n.isObject()) return OBJECT;
      if (n.isArray()) return ARRAY;
    }
    throw new QueryValidationException("Unsupported plaintext type: " + value.getClass().getName());
  }

  public boolean isContainer() {
    return this == OBJECT || this == ARRAY;
  }
}
