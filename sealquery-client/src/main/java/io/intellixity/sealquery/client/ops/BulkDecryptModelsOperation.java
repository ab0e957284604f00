package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.result.ErrorType;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class BulkDecryptModelsOperation extends EncryptionOperation<List<Map<String, Object>>, BulkDecryptModelsOperation> {
  private final List<Map<String, ?>> models;

  public BulkDecryptModelsOperation(EncryptionEngine engine, Logger log, List<? extends Map<String, ?>> models) {
    this(engine, log, null, null, Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(models, "models"))));
  }

  private BulkDecryptModelsOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                                     List<Map<String, ?>> models) {
    super(engine, log, lockContext, audit);
    this.models = models;
  }

  @Override
  protected BulkDecryptModelsOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new BulkDecryptModelsOperation(engine(), log(), lockContext, auditMetadata, models);
  }

  @Override
  protected List<Map<String, Object>> run(EngineCall call) {
    return ModelCodec.decrypt(models, call);
  }

  @Override protected String name() { return "bulkDecryptModels"; }
  @Override protected String target() { return "models=" + models.size(); }
  @Override protected ErrorType fallbackErrorType() { return ErrorType.DECRYPTION_ERROR; }
}
