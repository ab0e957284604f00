package io.intellixity.sealquery.identity;

/** Exchanges a user's identity token (JWT) for a {@link SessionToken}. */
public interface TokenAuthorizer {

  /** @throws LockContextException when the token service rejects the JWT or cannot be reached */
  SessionToken authorize(String workspaceId, String jwt);
}
