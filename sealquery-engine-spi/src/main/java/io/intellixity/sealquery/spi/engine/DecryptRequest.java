package io.intellixity.sealquery.spi.engine;

import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.identity.ResolvedLockContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record DecryptRequest(EncryptedPayload ciphertext, ResolvedLockContext lockContext, Map<String, Object> unverifiedContext) {
  public DecryptRequest {
    Objects.requireNonNull(ciphertext, "ciphertext");
    unverifiedContext = unverifiedContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(unverifiedContext));
  }
}
