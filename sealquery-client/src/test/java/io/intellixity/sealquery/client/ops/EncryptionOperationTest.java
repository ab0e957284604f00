package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.client.FakeEncryptionEngine;
import io.intellixity.sealquery.client.query.BatchQueryBuilder;
import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.identity.SessionToken;
import io.intellixity.sealquery.query.OperationKind;
import io.intellixity.sealquery.query.QueryTerms;
import io.intellixity.sealquery.result.ErrorType;
import io.intellixity.sealquery.result.Result;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;
import io.intellixity.sealquery.spi.engine.EngineException;
import org.junit.jupiter.api.Test;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

final class EncryptionOperationTest {
  private static final Logger LOG = LoggerFactory.getLogger(EncryptionOperationTest.class);
  private static final ColumnRef EMAIL = ColumnRef.of("email").equality();
  private static final ColumnRef PROFILE = ColumnRef.of("profile").searchableJson();
  private static final TableRef USERS = TableRef.of("users", EMAIL, PROFILE);

  private final FakeEncryptionEngine engine = new FakeEncryptionEngine();

  private static LockContext identified() {
    return LockContext.of("ws-1").withSessionToken(new SessionToken("cts-token", 1_700_000_000L));
  }

  @Test
  void unboundEncryptCallsEngineWithoutLockContext() {
    EncryptOperation op = new EncryptOperation(engine, LOG, "a@b.c", EMAIL, USERS);
    assertEquals(OperationState.UNBOUND, op.state());

    Result<EncryptedPayload> r = op.execute();

    assertFalse(r.isFailure());
    assertEquals("ct:a@b.c", r.data().ciphertext());
    assertNull(engine.encryptCalls.get(0).lockContext());
    assertEquals("email", engine.encryptCalls.get(0).item().column());
    assertNull(engine.encryptCalls.get(0).item().indexType());
    assertEquals(OperationState.EXECUTED, op.state());
  }

  @Test
  void boundOperationPassesResolvedContextToEngine() {
    EncryptOperation op = new EncryptOperation(engine, LOG, "a@b.c", EMAIL, USERS)
        .withLockContext(identified());
    assertEquals(OperationState.BOUND, op.state());

    assertFalse(op.execute().isFailure());
    assertEquals("cts-token", engine.encryptCalls.get(0).lockContext().sessionToken().accessToken());
    assertEquals(List.of("sub"), engine.encryptCalls.get(0).lockContext().identityClaim());
  }

  @Test
  void unresolvableLockContextSkipsTheEngine() {
    Result<EncryptedPayload> r = new EncryptOperation(engine, LOG, "a@b.c", EMAIL, USERS)
        .withLockContext(LockContext.of("ws-1"))
        .execute();

    assertTrue(r.isFailure());
    assertEquals(ErrorType.LOCK_CONTEXT_ERROR, r.failure().type());
    assertNull(r.failure().code());
    assertEquals(0, engine.totalCalls());
  }

  @Test
  void bindingReturnsACopy() {
    EncryptOperation op = new EncryptOperation(engine, LOG, "a@b.c", EMAIL, USERS);
    EncryptOperation bound = op.withLockContext(identified());
    assertNotSame(op, bound);
    assertNull(op.lockContext());
    assertEquals(OperationState.UNBOUND, op.state());
  }

  @Test
  void engineErrorCodeIsKept() {
    engine.failWith(new EngineException("UNKNOWN_COLUMN", "unknown column: users.email"));
    Result<EncryptedPayload> r = new EncryptOperation(engine, LOG, "a@b.c", EMAIL, USERS).execute();

    assertTrue(r.isFailure());
    assertEquals(ErrorType.ENGINE_ERROR, r.failure().type());
    assertEquals("UNKNOWN_COLUMN", r.failure().code());
    assertEquals("unknown column: users.email", r.failure().message());
  }

  @Test
  void chainingKeepsTheOperationType() {
    Map<String, Object> metadata = new HashMap<>();
    metadata.put("sub", "user-1");
    metadata.put("reason", null);

    EncryptOperation op = new EncryptOperation(engine, LOG, "a@b.c", EMAIL, USERS)
        .audit(metadata)
        .withLockContext(identified());
    Result<EncryptedPayload> r = op.execute();

    assertFalse(r.isFailure(), () -> String.valueOf(r.failure()));
    Map<String, Object> forwarded = engine.encryptCalls.get(0).unverifiedContext();
    assertEquals("user-1", forwarded.get("sub"));
    assertTrue(forwarded.containsKey("reason"));
    assertNull(forwarded.get("reason"));
  }

  @Test
  void auditMetadataIsForwardedAsUnverifiedContext() {
    new EncryptOperation(engine, LOG, "a@b.c", EMAIL, USERS)
        .audit(Map.of("sub", "user-1", "action", "signup"))
        .execute();
    assertEquals(Map.of("sub", "user-1", "action", "signup"), engine.encryptCalls.get(0).unverifiedContext());
  }

  @Test
  void nullPlaintextNeedsNoEngine() {
    Result<EncryptedPayload> r = new EncryptOperation(engine, LOG, null, EMAIL, USERS).execute();
    assertFalse(r.isFailure());
    assertNull(r.data());
    assertEquals(0, engine.totalCalls());
  }

  @Test
  void nanIsAValidationError() {
    Result<EncryptedPayload> r = new EncryptOperation(engine, LOG, Double.NaN, EMAIL, USERS).execute();
    assertEquals(ErrorType.VALIDATION_ERROR, r.failure().type());
    assertEquals("Cannot encrypt NaN value", r.failure().message());
    assertEquals(0, engine.totalCalls());
  }

  @Test
  void decryptRoundTripAndMalformedInput() {
    EncryptedPayload p = new EncryptOperation(engine, LOG, "secret", EMAIL, USERS).execute().data();
    assertEquals("secret", new DecryptOperation(engine, LOG, p).execute().data());
    assertEquals("secret", new DecryptOperation(engine, LOG, p.fields()).execute().data());
    assertNull(new DecryptOperation(engine, LOG, null).execute().data());

    Result<Object> bad = new DecryptOperation(engine, LOG, Map.of("nope", 1)).execute();
    assertEquals(ErrorType.DECRYPTION_ERROR, bad.failure().type());
    assertNull(bad.failure().code());
  }

  @Test
  void queryOperationFormatsAndValidates() {
    BatchQueryBuilder builder = new BatchQueryBuilder();
    Result<Object> ok = new EncryptQueryOperation(engine, LOG, builder, QueryTerms.value("a@b.c", EMAIL, USERS)).execute();
    assertTrue(ok.data() instanceof EncryptedPayload);

    Result<Object> bad = new EncryptQueryOperation(engine, LOG, builder, QueryTerms.path("a", EMAIL, USERS)).execute();
    assertEquals(ErrorType.VALIDATION_ERROR, bad.failure().type());
  }

  @Test
  void bareScalarOnJsonColumnIsRejectedByTheEngineWithItsCode() {
    Result<Object> r = new EncryptQueryOperation(engine, LOG, new BatchQueryBuilder(),
        QueryTerms.value(42, PROFILE, USERS)).execute();
    assertEquals(ErrorType.ENGINE_ERROR, r.failure().type());
    assertEquals("INVALID_STE_VEC_TERM", r.failure().code());
  }

  @Test
  void batchFailureLeavesNoPartialData() {
    Result<List<Object>> r = new BatchEncryptQueryOperation(engine, LOG, new BatchQueryBuilder(), List.of(
        QueryTerms.value("a@b.c", EMAIL, USERS),
        QueryTerms.value("$.a", EMAIL, USERS, OperationKind.STE_VEC_SELECTOR))).execute();
    assertTrue(r.isFailure());
    assertThrows(IllegalStateException.class, r::data);
    assertEquals(0, engine.totalCalls());
  }

  @Test
  void executeAsyncCompletesNormallyOnFailure() {
    engine.failWith(new EngineException("BOOM", "engine down"));
    CompletableFuture<Result<EncryptedPayload>> f =
        new EncryptOperation(engine, LOG, "x", EMAIL, USERS).executeAsync(Runnable::run);
    Result<EncryptedPayload> r = f.join();
    assertFalse(f.isCompletedExceptionally());
    assertEquals("BOOM", r.failure().code());
  }
}
