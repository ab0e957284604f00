package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.result.ErrorType;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Decrypts every encrypted field of one model. */
public final class DecryptModelOperation extends EncryptionOperation<Map<String, Object>, DecryptModelOperation> {
  private final Map<String, ?> model;

  public DecryptModelOperation(EncryptionEngine engine, Logger log, Map<String, ?> model) {
    this(engine, log, null, null, model);
  }

  private DecryptModelOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                                Map<String, ?> model) {
    super(engine, log, lockContext, audit);
    this.model = Objects.requireNonNull(model, "model");
  }

  @Override
  protected DecryptModelOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new DecryptModelOperation(engine(), log(), lockContext, auditMetadata, model);
  }

  @Override
  protected Map<String, Object> run(EngineCall call) {
    return ModelCodec.decrypt(List.of(model), call).get(0);
  }

  @Override protected String name() { return "decryptModel"; }
  @Override protected ErrorType fallbackErrorType() { return ErrorType.DECRYPTION_ERROR; }
}
