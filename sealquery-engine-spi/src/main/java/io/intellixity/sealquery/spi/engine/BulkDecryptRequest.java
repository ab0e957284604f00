package io.intellixity.sealquery.spi.engine;

import io.intellixity.sealquery.identity.ResolvedLockContext;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record BulkDecryptRequest(List<DecryptItem> items, ResolvedLockContext lockContext, Map<String, Object> unverifiedContext) {
  public BulkDecryptRequest {
    items = List.copyOf(items);
    unverifiedContext = unverifiedContext == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(unverifiedContext));
  }
}
