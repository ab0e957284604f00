package io.intellixity.sealquery.client;

import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.spi.engine.BulkDecryptRequest;
import io.intellixity.sealquery.spi.engine.BulkEncryptRequest;
import io.intellixity.sealquery.spi.engine.DecryptItem;
import io.intellixity.sealquery.spi.engine.DecryptOutcome;
import io.intellixity.sealquery.spi.engine.DecryptRequest;
import io.intellixity.sealquery.spi.engine.EncryptItem;
import io.intellixity.sealquery.spi.engine.EncryptRequest;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import io.intellixity.sealquery.spi.engine.EngineException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Deterministic stand-in for the crypto engine: "ciphertext" is {@code ct:<plaintext>}, selectors get
 * {@code s}, ste_vec terms get {@code sv}. Records every request.
 */
public final class FakeEncryptionEngine implements EncryptionEngine {
  public final List<EncryptRequest> encryptCalls = new ArrayList<>();
  public final List<BulkEncryptRequest> encryptBulkCalls = new ArrayList<>();
  public final List<DecryptRequest> decryptCalls = new ArrayList<>();
  public final List<BulkDecryptRequest> decryptBulkCalls = new ArrayList<>();

  private EngineException failure;

  /** Every following call throws {@code e}. */
  public FakeEncryptionEngine failWith(EngineException e) {
    this.failure = e;
    return this;
  }

  public int totalCalls() {
    return encryptCalls.size() + encryptBulkCalls.size() + decryptCalls.size() + decryptBulkCalls.size();
  }

  @Override
  public EncryptedPayload encrypt(EncryptRequest request) {
    encryptCalls.add(request);
    if (failure != null) throw failure;
    return payloadFor(request.item());
  }

  @Override
  public List<EncryptedPayload> encryptBulk(BulkEncryptRequest request) {
    encryptBulkCalls.add(request);
    if (failure != null) throw failure;
    List<EncryptedPayload> out = new ArrayList<>();
    for (EncryptItem item : request.items()) {
      out.add(payloadFor(item));
    }
    return out;
  }

  @Override
  public Object decrypt(DecryptRequest request) {
    decryptCalls.add(request);
    if (failure != null) throw failure;
    Object c = request.ciphertext().ciphertext();
    if (c instanceof String s && s.startsWith("ct:")) return s.substring(3);
    throw new EngineException("DECRYPT_FAILED", "Cannot decrypt ciphertext");
  }

  @Override
  public List<DecryptOutcome> decryptBulkFallible(BulkDecryptRequest request) {
    decryptBulkCalls.add(request);
    if (failure != null) throw failure;
    List<DecryptOutcome> out = new ArrayList<>();
    for (DecryptItem item : request.items()) {
      Object c = item.ciphertext().ciphertext();
      if (c instanceof String s && s.startsWith("ct:")) out.add(DecryptOutcome.success(item.id(), s.substring(3)));
      else out.add(DecryptOutcome.failure(item.id(), "Cannot decrypt ciphertext"));
    }
    return out;
  }

  public static EncryptedPayload payload(String table, String column, String ciphertext) {
    Map<String, Object> id = new LinkedHashMap<>();
    id.put("t", table);
    id.put("c", column);
    Map<String, Object> f = new LinkedHashMap<>();
    f.put("v", 2);
    f.put("i", id);
    f.put("c", ciphertext);
    return EncryptedPayload.of(f);
  }

  private static EncryptedPayload payloadFor(EncryptItem item) {
    if ("ste_vec_term".equals(item.queryOp()) && !(item.plaintext() instanceof Map<?, ?> || item.plaintext() instanceof List<?>)) {
      throw new EngineException("INVALID_STE_VEC_TERM", "Wrap the value in a JSON object, e.g. {\"value\": 42}");
    }
    EncryptedPayload p = payload(item.table(), item.column(), "ct:" + item.plaintext());
    if (item.indexType() != null) p = p.with("idx", item.indexType().engineName());
    if ("ste_vec_selector".equals(item.queryOp())) p = p.with("s", "sel:" + item.plaintext());
    if ("ste_vec_term".equals(item.queryOp())) p = p.with("sv", List.of("term:" + item.plaintext()));
    return p;
  }
}
