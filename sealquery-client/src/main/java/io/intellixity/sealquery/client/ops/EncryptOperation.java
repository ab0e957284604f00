package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.query.PlaintextShape;
import io.intellixity.sealquery.query.Plaintexts;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;
import io.intellixity.sealquery.spi.engine.EncryptItem;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Objects;

/** Encrypts one value for storage. A null plaintext yields null without calling the engine. */
public final class EncryptOperation extends EncryptionOperation<EncryptedPayload, EncryptOperation> {
  private final Object plaintext;
  private final ColumnRef column;
  private final TableRef table;

  public EncryptOperation(EncryptionEngine engine, Logger log, Object plaintext, ColumnRef column, TableRef table) {
    this(engine, log, null, null, plaintext, column, table);
  }

  private EncryptOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                           Object plaintext, ColumnRef column, TableRef table) {
    super(engine, log, lockContext, audit);
    this.plaintext = plaintext;
    this.column = Objects.requireNonNull(column, "column");
    this.table = Objects.requireNonNull(table, "table");
  }

  @Override
  protected EncryptOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new EncryptOperation(engine(), log(), lockContext, auditMetadata, plaintext, column, table);
  }

  @Override
  protected EncryptedPayload run(EngineCall call) {
    if (PlaintextShape.of(plaintext) == PlaintextShape.NULL) return null;
    Plaintexts.requireEncryptable(plaintext);
    return call.encrypt(EncryptItem.forStorage(null, plaintext, column.name(), table.name()));
  }

  @Override protected String name() { return "encrypt"; }
  @Override protected String target() { return "table=" + table.name() + " column=" + column.name(); }
}
