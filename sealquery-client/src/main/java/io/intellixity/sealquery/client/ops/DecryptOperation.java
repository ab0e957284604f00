package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.format.EncryptedPayloads;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.result.ErrorType;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.Map;

/** Decrypts one payload. Accepts the payload or its map form; null decrypts to null. */
public final class DecryptOperation extends EncryptionOperation<Object, DecryptOperation> {
  private final Object ciphertext;

  public DecryptOperation(EncryptionEngine engine, Logger log, Object ciphertext) {
    this(engine, log, null, null, ciphertext);
  }

  private DecryptOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                           Object ciphertext) {
    super(engine, log, lockContext, audit);
    this.ciphertext = ciphertext;
  }

  @Override
  protected DecryptOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new DecryptOperation(engine(), log(), lockContext, auditMetadata, ciphertext);
  }

  @Override
  protected Object run(EngineCall call) {
    if (ciphertext == null) return null;
    return call.decrypt(EncryptedPayloads.require(ciphertext));
  }

  @Override protected String name() { return "decrypt"; }
  @Override protected ErrorType fallbackErrorType() { return ErrorType.DECRYPTION_ERROR; }
}
