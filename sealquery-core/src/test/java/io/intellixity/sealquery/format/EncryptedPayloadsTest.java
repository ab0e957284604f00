package io.intellixity.sealquery.format;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class EncryptedPayloadsTest {

  @Test
  void recognizesCiphertextAndSteVecPayloads() {
    assertTrue(EncryptedPayloads.isEncryptedPayload(Map.of("v", 2, "i", Map.of("t", "users"), "c", "x")));
    assertTrue(EncryptedPayloads.isEncryptedPayload(Map.of("v", 2, "i", Map.of(), "sv", List.of())));
    assertTrue(EncryptedPayloads.isEncryptedPayload(EncryptedPayload.of(Map.of("v", 1, "i", Map.of(), "c", "x"))));
  }

  @Test
  void rejectsLookalikes() {
    assertFalse(EncryptedPayloads.isEncryptedPayload(null));
    assertFalse(EncryptedPayloads.isEncryptedPayload("ciphertext"));
    assertFalse(EncryptedPayloads.isEncryptedPayload(Map.of("v", "2", "i", Map.of(), "c", "x")));
    assertFalse(EncryptedPayloads.isEncryptedPayload(Map.of("v", 2, "i", "users", "c", "x")));
    assertFalse(EncryptedPayloads.isEncryptedPayload(Map.of("v", 2, "i", Map.of())));
  }

  @Test
  void requireCoercesMapsAndRejectsOthers() {
    EncryptedPayload p = EncryptedPayloads.require(Map.of("v", 2, "i", Map.of(), "c", "x"));
    assertEquals(2, p.version());
    assertEquals("x", p.ciphertext());
    assertThrows(MalformedPayloadException.class, () -> EncryptedPayloads.require(Map.of("c", "x")));
  }

  @Test
  void pgCompositeWrapsUnderData() {
    EncryptedPayload p = EncryptedPayload.of(Map.of("v", 2, "i", Map.of(), "c", "x"));
    assertEquals(Map.of("data", p), EncryptedPayloads.toPgComposite(p));
  }

  @Test
  void modelHelpersWrapOnlyEncryptedFields() {
    EncryptedPayload p = EncryptedPayload.of(Map.of("v", 2, "i", Map.of(), "c", "x"));
    Map<String, Object> model = new LinkedHashMap<>();
    model.put("id", 7);
    model.put("email", p);
    model.put("note", null);

    Map<String, Object> out = EncryptedPayloads.modelToPgComposites(model);
    assertEquals(7, out.get("id"));
    assertEquals(Map.of("data", p), out.get("email"));
    assertTrue(out.containsKey("note"));
    assertEquals(1, EncryptedPayloads.bulkModelsToPgComposites(List.of(model)).size());
  }
}
