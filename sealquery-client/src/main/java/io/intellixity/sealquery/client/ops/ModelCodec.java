package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.format.EncryptedPayloads;
import io.intellixity.sealquery.query.PlaintextShape;
import io.intellixity.sealquery.query.Plaintexts;
import io.intellixity.sealquery.query.QueryValidationException;
import io.intellixity.sealquery.schema.TableRef;
import io.intellixity.sealquery.spi.engine.DecryptItem;
import io.intellixity.sealquery.spi.engine.DecryptOutcome;
import io.intellixity.sealquery.spi.engine.EncryptItem;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Encrypts and decrypts the fields of map-shaped models, all models in one engine call. */
final class ModelCodec {
  private ModelCodec() {}

  private record FieldRef(int model, String field) {}

  /** Fields named after a column of {@code table} are encrypted; null fields and other fields are copied as-is. */
  static List<Map<String, Object>> encrypt(List<? extends Map<String, ?>> models, TableRef table, EngineCall call) {
    List<Map<String, Object>> out = copies(models);
    List<FieldRef> refs = new ArrayList<>();
    List<EncryptItem> items = new ArrayList<>();
    for (int m = 0; m < out.size(); m++) {
      for (Map.Entry<String, Object> e : out.get(m).entrySet()) {
        if (!table.hasColumn(e.getKey()) || PlaintextShape.of(e.getValue()) == PlaintextShape.NULL) continue;
        Plaintexts.requireEncryptable(e.getValue());
        refs.add(new FieldRef(m, e.getKey()));
        items.add(EncryptItem.forStorage(null, e.getValue(), e.getKey(), table.name()));
      }
    }
    if (items.isEmpty()) return out;

    List<EncryptedPayload> payloads = call.encryptBulk(items);
    requireSize(payloads.size(), items.size());
    for (int i = 0; i < refs.size(); i++) {
      FieldRef r = refs.get(i);
      out.get(r.model()).put(r.field(), payloads.get(i));
    }
    return out;
  }

  /** Every field holding an encrypted payload is decrypted; any per-field failure fails the call. */
  static List<Map<String, Object>> decrypt(List<? extends Map<String, ?>> models, EngineCall call) {
    List<Map<String, Object>> out = copies(models);
    List<FieldRef> refs = new ArrayList<>();
    List<DecryptItem> items = new ArrayList<>();
    for (int m = 0; m < out.size(); m++) {
      for (Map.Entry<String, Object> e : out.get(m).entrySet()) {
        if (!EncryptedPayloads.isEncryptedPayload(e.getValue())) continue;
        refs.add(new FieldRef(m, e.getKey()));
        items.add(new DecryptItem(null, EncryptedPayloads.require(e.getValue())));
      }
    }
    if (items.isEmpty()) return out;

    List<DecryptOutcome> outcomes = call.decryptBulkFallible(items);
    requireSize(outcomes.size(), items.size());
    for (int i = 0; i < refs.size(); i++) {
      FieldRef r = refs.get(i);
      DecryptOutcome o = outcomes.get(i);
      if (o.isError()) {
        throw new DecryptionException("Failed to decrypt field \"" + r.field() + "\": " + o.error());
      }
      out.get(r.model()).put(r.field(), o.data());
    }
    return out;
  }

  private static List<Map<String, Object>> copies(List<? extends Map<String, ?>> models) {
    List<Map<String, Object>> out = new ArrayList<>(models.size());
    for (Map<String, ?> m : models) {
      if (m == null) throw new QueryValidationException("Models must not contain null");
      out.add(new LinkedHashMap<>(m));
    }
    return out;
  }

  private static void requireSize(int actual, int expected) {
    if (actual != expected) {
      throw new IllegalStateException("Engine returned " + actual + " results for " + expected + " items");
    }
  }
}
