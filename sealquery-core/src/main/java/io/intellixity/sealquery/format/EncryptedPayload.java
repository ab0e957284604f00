package io.intellixity.sealquery.format;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Opaque encrypted value produced by the engine: a JSON object with a version ({@code v}), an identifier
 * ({@code i}: table and column) and either a ciphertext ({@code c}) or a structured-encryption vector
 * ({@code sv}), plus whatever index terms the engine attached.
 * <p>
 * Field order is kept as received so serialization is stable.
 */
@JsonSerialize(using = EncryptedPayloadJsonSerializer.class)
@JsonDeserialize(using = EncryptedPayloadJsonDeserializer.class)
public final class EncryptedPayload {
  public static final String VERSION = "v";
  public static final String IDENTIFIER = "i";
  public static final String CIPHERTEXT = "c";
  public static final String STE_VEC = "sv";
  public static final String SELECTOR = "s";

  private final Map<String, Object> fields;

  private EncryptedPayload(Map<String, Object> fields) {
    this.fields = Collections.unmodifiableMap(fields);
  }

  public static EncryptedPayload of(Map<String, ?> fields) {
    Objects.requireNonNull(fields, "fields");
    return new EncryptedPayload(new LinkedHashMap<>(fields));
  }

  public Map<String, Object> fields() { return fields; }
  public Object get(String field) { return fields.get(field); }

  public Integer version() {
    return fields.get(VERSION) instanceof Number n ? n.intValue() : null;
  }

  @SuppressWarnings("unchecked")
  public Map<String, Object> identifier() {
    return fields.get(IDENTIFIER) instanceof Map<?, ?> m ? (Map<String, Object>) m : null;
  }

  public Object ciphertext() { return fields.get(CIPHERTEXT); }
  public Object steVec() { return fields.get(STE_VEC); }
  public Object selector() { return fields.get(SELECTOR); }

  /** Copy with {@code field} set (or replaced) to {@code value}. */
  public EncryptedPayload with(String field, Object value) {
    Map<String, Object> next = new LinkedHashMap<>(fields);
    next.put(field, value);
    return new EncryptedPayload(next);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    return o instanceof EncryptedPayload other && fields.equals(other.fields);
  }

  @Override
  public int hashCode() {
    return fields.hashCode();
  }

  @Override
  public String toString() {
    Map<String, Object> id = identifier();
    return "EncryptedPayload{v=" + version() + ", i=" + id + ", fields=" + fields.keySet() + "}";
  }
}
