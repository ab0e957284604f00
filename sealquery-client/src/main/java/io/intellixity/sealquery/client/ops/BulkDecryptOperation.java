package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.client.internal.CompactedList;
import io.intellixity.sealquery.format.EncryptedPayloads;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.result.ErrorType;
import io.intellixity.sealquery.spi.engine.DecryptItem;
import io.intellixity.sealquery.spi.engine.DecryptOutcome;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Decrypts many payloads through the engine's fallible bulk call. Items the engine cannot decrypt come back
 * with an {@code error} instead of failing the whole operation; null items stay null in place.
 */
public final class BulkDecryptOperation extends EncryptionOperation<List<BulkDecryptedItem>, BulkDecryptOperation> {
  private final List<BulkDecryptItem> items;

  public BulkDecryptOperation(EncryptionEngine engine, Logger log, List<BulkDecryptItem> items) {
    this(engine, log, null, null, items);
  }

  private BulkDecryptOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                               List<BulkDecryptItem> items) {
    super(engine, log, lockContext, audit);
    this.items = List.copyOf(Objects.requireNonNull(items, "items"));
  }

  @Override
  protected BulkDecryptOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new BulkDecryptOperation(engine(), log(), lockContext, auditMetadata, items);
  }

  @Override
  protected List<BulkDecryptedItem> run(EngineCall call) {
    CompactedList<BulkDecryptItem> live = CompactedList.of(items, i -> i.data() == null);

    List<DecryptOutcome> outcomes = List.of();
    if (!live.isEmpty()) {
      List<DecryptItem> engineItems = new ArrayList<>(live.values().size());
      for (BulkDecryptItem i : live.values()) {
        engineItems.add(new DecryptItem(i.id(), EncryptedPayloads.require(i.data())));
      }
      outcomes = call.decryptBulkFallible(engineItems);
    }

    List<DecryptOutcome> expanded = live.expand(outcomes);
    List<BulkDecryptedItem> out = new ArrayList<>(items.size());
    for (int i = 0; i < items.size(); i++) {
      String id = items.get(i).id();
      DecryptOutcome o = expanded.get(i);
      if (o == null) out.add(BulkDecryptedItem.success(id, null));
      else if (o.isError()) out.add(BulkDecryptedItem.failure(id, o.error()));
      else out.add(BulkDecryptedItem.success(id, o.data()));
    }
    return out;
  }

  @Override protected String name() { return "bulkDecrypt"; }
  @Override protected String target() { return "items=" + items.size(); }
  @Override protected ErrorType fallbackErrorType() { return ErrorType.DECRYPTION_ERROR; }
}
