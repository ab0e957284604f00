package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.schema.TableRef;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class BulkEncryptModelsOperation extends EncryptionOperation<List<Map<String, Object>>, BulkEncryptModelsOperation> {
  private final List<Map<String, ?>> models;
  private final TableRef table;

  public BulkEncryptModelsOperation(EncryptionEngine engine, Logger log, List<? extends Map<String, ?>> models, TableRef table) {
    this(engine, log, null, null, Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(models, "models"))), table);
  }

  private BulkEncryptModelsOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                                     List<Map<String, ?>> models, TableRef table) {
    super(engine, log, lockContext, audit);
    this.models = models;
    this.table = Objects.requireNonNull(table, "table");
  }

  @Override
  protected BulkEncryptModelsOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new BulkEncryptModelsOperation(engine(), log(), lockContext, auditMetadata, models, table);
  }

  @Override
  protected List<Map<String, Object>> run(EngineCall call) {
    return ModelCodec.encrypt(models, table, call);
  }

  @Override protected String name() { return "bulkEncryptModels"; }
  @Override protected String target() { return "table=" + table.name() + " models=" + models.size(); }
}
