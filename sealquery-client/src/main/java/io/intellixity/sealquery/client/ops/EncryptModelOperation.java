package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.schema.TableRef;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Encrypts the column fields of one model; returns a copy, the input map is not modified. */
public final class EncryptModelOperation extends EncryptionOperation<Map<String, Object>, EncryptModelOperation> {
  private final Map<String, ?> model;
  private final TableRef table;

  public EncryptModelOperation(EncryptionEngine engine, Logger log, Map<String, ?> model, TableRef table) {
    this(engine, log, null, null, model, table);
  }

  private EncryptModelOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                                Map<String, ?> model, TableRef table) {
    super(engine, log, lockContext, audit);
    this.model = Objects.requireNonNull(model, "model");
    this.table = Objects.requireNonNull(table, "table");
  }

  @Override
  protected EncryptModelOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new EncryptModelOperation(engine(), log(), lockContext, auditMetadata, model, table);
  }

  @Override
  protected Map<String, Object> run(EngineCall call) {
    return ModelCodec.encrypt(List.of(model), table, call).get(0);
  }

  @Override protected String name() { return "encryptModel"; }
  @Override protected String target() { return "table=" + table.name(); }
}
