package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.identity.ResolvedLockContext;
import io.intellixity.sealquery.spi.engine.BulkDecryptRequest;
import io.intellixity.sealquery.spi.engine.BulkEncryptRequest;
import io.intellixity.sealquery.spi.engine.DecryptItem;
import io.intellixity.sealquery.spi.engine.DecryptOutcome;
import io.intellixity.sealquery.spi.engine.DecryptRequest;
import io.intellixity.sealquery.spi.engine.EncryptItem;
import io.intellixity.sealquery.spi.engine.EncryptRequest;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * An engine plus what every request of one execution carries: the resolved lock context (or {@code null})
 * and the audit metadata.
 */
public record EngineCall(EncryptionEngine engine, ResolvedLockContext lockContext, Map<String, Object> unverifiedContext) {
  public EngineCall {
    Objects.requireNonNull(engine, "engine");
    unverifiedContext = unverifiedContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(unverifiedContext));
  }

  public EncryptedPayload encrypt(EncryptItem item) {
    return engine.encrypt(new EncryptRequest(item, lockContext, unverifiedContext));
  }

  public List<EncryptedPayload> encryptBulk(List<EncryptItem> items) {
    return engine.encryptBulk(new BulkEncryptRequest(items, lockContext, unverifiedContext));
  }

  public Object decrypt(EncryptedPayload ciphertext) {
    return engine.decrypt(new DecryptRequest(ciphertext, lockContext, unverifiedContext));
  }

  public List<DecryptOutcome> decryptBulkFallible(List<DecryptItem> items) {
    return engine.decryptBulkFallible(new BulkDecryptRequest(items, lockContext, unverifiedContext));
  }
}
