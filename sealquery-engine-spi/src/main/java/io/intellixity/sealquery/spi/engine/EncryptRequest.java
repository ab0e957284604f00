package io.intellixity.sealquery.spi.engine;

import io.intellixity.sealquery.identity.ResolvedLockContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * @param lockContext       identity binding, or {@code null} for an unscoped call
 * @param unverifiedContext caller-supplied audit metadata passed through to the engine as-is
 */
public record EncryptRequest(EncryptItem item, ResolvedLockContext lockContext, Map<String, Object> unverifiedContext) {
  public EncryptRequest {
    Objects.requireNonNull(item, "item");
    unverifiedContext = unverifiedContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(unverifiedContext));
  }
}
