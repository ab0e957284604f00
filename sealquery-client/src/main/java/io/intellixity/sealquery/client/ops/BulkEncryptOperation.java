package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.client.internal.CompactedList;
import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.query.PlaintextShape;
import io.intellixity.sealquery.query.Plaintexts;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.TableRef;
import io.intellixity.sealquery.spi.engine.EncryptItem;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Encrypts many plaintexts for one column in a single engine call; null plaintexts stay null in place. */
public final class BulkEncryptOperation extends EncryptionOperation<List<BulkEncryptedItem>, BulkEncryptOperation> {
  private final List<BulkEncryptItem> items;
  private final ColumnRef column;
  private final TableRef table;

  public BulkEncryptOperation(EncryptionEngine engine, Logger log, List<BulkEncryptItem> items, ColumnRef column, TableRef table) {
    this(engine, log, null, null, items, column, table);
  }

  private BulkEncryptOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                               List<BulkEncryptItem> items, ColumnRef column, TableRef table) {
    super(engine, log, lockContext, audit);
    this.items = List.copyOf(Objects.requireNonNull(items, "items"));
    this.column = Objects.requireNonNull(column, "column");
    this.table = Objects.requireNonNull(table, "table");
  }

  @Override
  protected BulkEncryptOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new BulkEncryptOperation(engine(), log(), lockContext, auditMetadata, items, column, table);
  }

  @Override
  protected List<BulkEncryptedItem> run(EngineCall call) {
    CompactedList<BulkEncryptItem> live = CompactedList.of(items, i -> PlaintextShape.of(i.plaintext()) == PlaintextShape.NULL);

    List<EncryptedPayload> payloads = List.of();
    if (!live.isEmpty()) {
      List<EncryptItem> engineItems = new ArrayList<>(live.values().size());
      for (BulkEncryptItem i : live.values()) {
        Plaintexts.requireEncryptable(i.plaintext());
        engineItems.add(EncryptItem.forStorage(i.id(), i.plaintext(), column.name(), table.name()));
      }
      payloads = call.encryptBulk(engineItems);
    }

    List<EncryptedPayload> expanded = live.expand(payloads);
    List<BulkEncryptedItem> out = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      out.add(new BulkEncryptedItem(items.get(i).id(), expanded.get(i)));
    }
    return out;
  }

  @Override protected String name() { return "bulkEncrypt"; }
  @Override protected String target() { return "table=" + table.name() + " column=" + column.name() + " items=" + items.size(); }
}
