package io.intellixity.sealquery.format;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.sealquery.query.ReturnType;
import io.intellixity.sealquery.util.Json;

import java.util.Objects;

/**
 * Renders encrypted query terms in the form the SQL layer expects.
 * <ul>
 *   <li>{@link ReturnType#RAW}: the payload itself</li>
 *   <li>{@link ReturnType#COMPOSITE_LITERAL}: {@code (<json string of the payload json>)}</li>
 *   <li>{@link ReturnType#ESCAPED_COMPOSITE_LITERAL}: the composite literal as one more JSON string</li>
 * </ul>
 * {@code null} formats to {@code null} for every return type.
 */
public final class ResultFormatter {
  private final ObjectMapper mapper;

  public ResultFormatter() {
    this(Json.mapper());
  }

  public ResultFormatter(ObjectMapper mapper) {
    this.mapper = Objects.requireNonNull(mapper, "mapper");
  }

  public Object format(EncryptedPayload payload, ReturnType returnType) {
    if (payload == null) return null;
    return switch (returnType == null ? ReturnType.RAW : returnType) {
      case RAW -> payload;
      case COMPOSITE_LITERAL -> compositeLiteral(payload);
      case ESCAPED_COMPOSITE_LITERAL -> write(compositeLiteral(payload));
    };
  }

  public String compositeLiteral(EncryptedPayload payload) {
    return "(" + write(write(payload)) + ")";
  }

  /** Inverse of {@link #compositeLiteral(EncryptedPayload)}. */
  public EncryptedPayload parseCompositeLiteral(String literal) {
    Objects.requireNonNull(literal, "literal");
    if (literal.length() < 2 || literal.charAt(0) != '(' || literal.charAt(literal.length() - 1) != ')') {
      throw new MalformedPayloadException("Not a composite literal: " + literal);
    }
    try {
      String json = mapper.readValue(literal.substring(1, literal.length() - 1), String.class);
      return mapper.readValue(json, EncryptedPayload.class);
    } catch (JsonProcessingException e) {
      throw new MalformedPayloadException("Failed to parse composite literal", e);
    }
  }

  private String write(Object value) {
    try {
      return mapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize encrypted payload", e);
    }
  }
}
