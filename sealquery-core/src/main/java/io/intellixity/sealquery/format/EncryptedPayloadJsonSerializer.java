package io.intellixity.sealquery.format;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.Map;

/** Writes an {@link EncryptedPayload} as the plain JSON object it wraps. */
public final class EncryptedPayloadJsonSerializer extends JsonSerializer<EncryptedPayload> {
  @Override
  public void serialize(EncryptedPayload payload, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (payload == null) {
      g.writeNull();
      return;
    }
    g.writeStartObject();
    for (Map.Entry<String, Object> e : payload.fields().entrySet()) {
      g.writeFieldName(e.getKey());
      serializers.defaultSerializeValue(e.getValue(), g);
    }
    g.writeEndObject();
  }
}
