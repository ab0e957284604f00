package io.intellixity.sealquery.spi.engine;

import io.intellixity.sealquery.format.EncryptedPayload;

import java.util.List;

/**
 * Boundary to the component that performs the actual cryptography.
 * <p>
 * Implementations throw {@link EngineException} with a stable code on failure. Bulk calls are one-to-one and
 * order-preserving; callers remove null plaintexts before calling.
 */
public interface EncryptionEngine {

  EncryptedPayload encrypt(EncryptRequest request);

  List<EncryptedPayload> encryptBulk(BulkEncryptRequest request);

  Object decrypt(DecryptRequest request);

  /** Per-item failures are reported as {@link DecryptOutcome#error()} rather than thrown. */
  List<DecryptOutcome> decryptBulkFallible(BulkDecryptRequest request);
}
