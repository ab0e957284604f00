package io.intellixity.sealquery.identity;

import java.util.List;
import java.util.Objects;

/** What the engine receives for an identity-scoped call: the session token and the claims keys are bound to. */
public record ResolvedLockContext(SessionToken sessionToken, List<String> identityClaim) {
  public ResolvedLockContext {
    Objects.requireNonNull(sessionToken, "sessionToken");
    identityClaim = List.copyOf(identityClaim);
  }
}
