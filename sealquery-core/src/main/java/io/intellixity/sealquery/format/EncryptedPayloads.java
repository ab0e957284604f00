package io.intellixity.sealquery.format;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Helpers for recognizing and wrapping encrypted payloads found in application data. */
public final class EncryptedPayloads {
  private EncryptedPayloads() {}

  /**
   * True when {@code value} looks like an engine payload: a numeric {@code v}, an object {@code i} and
   * either {@code c} or {@code sv}.
   */
  public static boolean isEncryptedPayload(Object value) {
    if (value instanceof EncryptedPayload p) return isEncryptedPayload(p.fields());
    if (!(value instanceof Map<?, ?> m)) return false;
    return m.get(EncryptedPayload.VERSION) instanceof Number
        && m.get(EncryptedPayload.IDENTIFIER) instanceof Map<?, ?>
        && (m.containsKey(EncryptedPayload.CIPHERTEXT) || m.containsKey(EncryptedPayload.STE_VEC));
  }

  /**
   * Coerces a payload found in a model or passed for decryption.
   *
   * @throws MalformedPayloadException when the value does not look like an engine payload
   */
  @SuppressWarnings("unchecked")
  public static EncryptedPayload require(Object value) {
    if (!isEncryptedPayload(value)) {
      throw new MalformedPayloadException("Value is not an encrypted payload"
          + (value == null ? "" : " (" + value.getClass().getSimpleName() + ")"));
    }
    if (value instanceof EncryptedPayload p) return p;
    return EncryptedPayload.of((Map<String, Object>) value);
  }

  /** Wraps a payload for an {@code eql_v2_encrypted} column written through a JSON-aware driver. */
  public static Map<String, Object> toPgComposite(EncryptedPayload payload) {
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("data", payload);
    return out;
  }

  /** Copy of {@code model} with every encrypted field wrapped by {@link #toPgComposite}. */
  public static Map<String, Object> modelToPgComposites(Map<String, ?> model) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (Map.Entry<String, ?> e : model.entrySet()) {
      Object v = e.getValue();
      out.put(e.getKey(), isEncryptedPayload(v) ? toPgComposite(require(v)) : v);
    }
    return out;
  }

  public static List<Map<String, Object>> bulkModelsToPgComposites(List<? extends Map<String, ?>> models) {
    List<Map<String, Object>> out = new ArrayList<>(models.size());
    for (Map<String, ?> m : models) {
      out.add(modelToPgComposites(m));
    }
    return out;
  }
}
