package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.client.FakeEncryptionEngine;
import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.identity.SessionToken;
import io.intellixity.sealquery.result.ErrorType;
import io.intellixity.sealquery.result.Result;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;
import org.junit.jupiter.api.Test;
import org.slf4j.helpers.NOPLogger;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class BulkOperationsTest {
  private static final ColumnRef EMAIL = ColumnRef.of("email").equality();
  private static final TableRef USERS = TableRef.of("users", EMAIL);

  private final FakeEncryptionEngine engine = new FakeEncryptionEngine();

  @Test
  void bulkEncryptKeepsIdsAndNullPositions() {
    List<BulkEncryptItem> items = List.of(
        new BulkEncryptItem("1", "a@b.c"),
        new BulkEncryptItem("2", null),
        new BulkEncryptItem("3", "c@d.e"));

    Result<List<BulkEncryptedItem>> r = new BulkEncryptOperation(engine, NOPLogger.NOP_LOGGER, items, EMAIL, USERS).execute();

    List<BulkEncryptedItem> out = r.data();
    assertEquals(List.of("1", "2", "3"), out.stream().map(BulkEncryptedItem::id).toList());
    assertEquals("ct:a@b.c", out.get(0).data().ciphertext());
    assertNull(out.get(1).data());
    assertEquals("ct:c@d.e", out.get(2).data().ciphertext());

    assertEquals(1, engine.encryptBulkCalls.size());
    assertEquals(2, engine.encryptBulkCalls.get(0).items().size());
    assertEquals("3", engine.encryptBulkCalls.get(0).items().get(1).id());
  }

  @Test
  void bulkEncryptOfOnlyNullsMakesNoCall() {
    Result<List<BulkEncryptedItem>> r = new BulkEncryptOperation(engine, NOPLogger.NOP_LOGGER,
        List.of(BulkEncryptItem.of(null)), EMAIL, USERS).execute();
    assertNull(r.data().get(0).data());
    assertEquals(0, engine.totalCalls());
  }

  @Test
  void bulkDecryptMergesNullsAndPerItemErrors() {
    EncryptedPayload good = FakeEncryptionEngine.payload("users", "email", "ct:a@b.c");
    EncryptedPayload broken = FakeEncryptionEngine.payload("users", "email", "garbage");
    List<BulkDecryptItem> items = List.of(
        new BulkDecryptItem("1", good),
        new BulkDecryptItem("2", null),
        new BulkDecryptItem("3", broken.fields()));

    List<BulkDecryptedItem> out = new BulkDecryptOperation(engine, NOPLogger.NOP_LOGGER, items)
        .withLockContext(LockContext.of("ws").withSessionToken(new SessionToken("t", 1)))
        .execute()
        .data();

    assertEquals(BulkDecryptedItem.success("1", "a@b.c"), out.get(0));
    assertEquals(BulkDecryptedItem.success("2", null), out.get(1));
    assertTrue(out.get(2).isError());
    assertEquals("3", out.get(2).id());

    assertEquals(2, engine.decryptBulkCalls.get(0).items().size());
    assertNotNull(engine.decryptBulkCalls.get(0).lockContext());
  }

  @Test
  void bulkDecryptRejectsMalformedItemsBeforeTheEngine() {
    Result<List<BulkDecryptedItem>> r = new BulkDecryptOperation(engine, NOPLogger.NOP_LOGGER,
        List.of(new BulkDecryptItem("1", "not a payload"))).execute();
    assertEquals(ErrorType.DECRYPTION_ERROR, r.failure().type());
    assertEquals(0, engine.totalCalls());
  }

  @Test
  void bulkEncryptAuditAndEmptyInput() {
    Result<List<BulkEncryptedItem>> r = new BulkEncryptOperation(engine, NOPLogger.NOP_LOGGER, List.of(), EMAIL, USERS)
        .audit(Map.of("reason", "import"))
        .execute();
    assertEquals(List.of(), r.data());
    assertEquals(0, engine.totalCalls());
  }
}
