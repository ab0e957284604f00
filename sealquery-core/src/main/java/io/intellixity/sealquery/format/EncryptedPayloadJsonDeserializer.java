package io.intellixity.sealquery.format;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

public final class EncryptedPayloadJsonDeserializer extends JsonDeserializer<EncryptedPayload> {
  @Override
  public EncryptedPayload deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new IllegalArgumentException("Encrypted payload JSON must be an object");

    @SuppressWarnings("unchecked")
    Map<String, Object> fields = codec.treeToValue(root, LinkedHashMap.class);
    return EncryptedPayload.of(fields);
  }
}
