package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.client.FakeEncryptionEngine;
import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.result.ErrorType;
import io.intellixity.sealquery.result.Result;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;
import org.junit.jupiter.api.Test;
import org.slf4j.helpers.NOPLogger;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class ModelOperationsTest {
  private static final TableRef USERS = TableRef.of("users",
      ColumnRef.of("email").equality(),
      ColumnRef.of("address"));

  private final FakeEncryptionEngine engine = new FakeEncryptionEngine();

  private static Map<String, Object> user(String id, String email, String address) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("id", id);
    m.put("email", email);
    m.put("address", address);
    m.put("createdAt", "2024-01-01");
    return m;
  }

  @Test
  void encryptModelTouchesOnlyColumnFields() {
    Map<String, Object> in = user("u1", "a@b.c", null);

    Map<String, Object> out = new EncryptModelOperation(engine, NOPLogger.NOP_LOGGER, in, USERS).execute().data();

    assertEquals("u1", out.get("id"));
    assertEquals("2024-01-01", out.get("createdAt"));
    assertTrue(out.get("email") instanceof EncryptedPayload);
    assertNull(out.get("address"));
    assertTrue(out.containsKey("address"));
    assertEquals("a@b.c", in.get("email"));
    assertEquals(1, engine.encryptBulkCalls.get(0).items().size());
  }

  @Test
  void decryptModelRestoresPlaintext() {
    Map<String, Object> encrypted = new EncryptModelOperation(engine, NOPLogger.NOP_LOGGER,
        user("u1", "a@b.c", "1 Main St"), USERS).execute().data();

    Map<String, Object> out = new DecryptModelOperation(engine, NOPLogger.NOP_LOGGER, encrypted).execute().data();
    assertEquals(user("u1", "a@b.c", "1 Main St"), out);
  }

  @Test
  void bulkModelsUseOneEngineCallEachWay() {
    List<Map<String, Object>> models = List.of(user("u1", "a@b.c", "x"), user("u2", null, "y"));

    List<Map<String, Object>> enc = new BulkEncryptModelsOperation(engine, NOPLogger.NOP_LOGGER, models, USERS).execute().data();
    assertEquals(1, engine.encryptBulkCalls.size());
    assertEquals(3, engine.encryptBulkCalls.get(0).items().size());
    assertNull(enc.get(1).get("email"));

    List<Map<String, Object>> dec = new BulkDecryptModelsOperation(engine, NOPLogger.NOP_LOGGER, enc).execute().data();
    assertEquals(1, engine.decryptBulkCalls.size());
    assertEquals(models, dec);
  }

  @Test
  void fieldDecryptFailureFailsTheModel() {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put("email", FakeEncryptionEngine.payload("users", "email", "garbage"));

    Result<Map<String, Object>> r = new DecryptModelOperation(engine, NOPLogger.NOP_LOGGER, m).execute();
    assertEquals(ErrorType.DECRYPTION_ERROR, r.failure().type());
    assertTrue(r.failure().message().contains("\"email\""));
  }
}
