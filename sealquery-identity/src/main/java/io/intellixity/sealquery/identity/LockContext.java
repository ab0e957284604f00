package io.intellixity.sealquery.identity;

import io.intellixity.sealquery.result.EncryptionError;
import io.intellixity.sealquery.result.Result;

import java.util.List;
import java.util.Objects;

/**
 * Binds encryption and decryption to an end user's identity.
 * <p>
 * A context starts without a session; {@link #identify(String, TokenAuthorizer)} exchanges the user's JWT for
 * one. Contexts are immutable, so identifying returns a new instance.
 * <pre>
 * Result&lt;LockContext&gt; ctx = LockContext.of(config.workspaceId()).identify(jwt, authorizer);
 * client.encrypt(value, column, table).withLockContext(ctx.data()).execute();
 * </pre>
 */
public final class LockContext {
  public static final List<String> DEFAULT_IDENTITY_CLAIM = List.of("sub");

  private final String workspaceId;
  private final List<String> identityClaim;
  private final SessionToken sessionToken;

  private LockContext(String workspaceId, List<String> identityClaim, SessionToken sessionToken) {
    this.workspaceId = workspaceId;
    this.identityClaim = List.copyOf(identityClaim);
    this.sessionToken = sessionToken;
  }

  public static LockContext of(String workspaceId) {
    return of(workspaceId, DEFAULT_IDENTITY_CLAIM);
  }

  public static LockContext of(String workspaceId, List<String> identityClaim) {
    if (workspaceId == null || workspaceId.isBlank()) {
      throw new LockContextException("A workspace id is required to create a lock context");
    }
    Objects.requireNonNull(identityClaim, "identityClaim");
    if (identityClaim.isEmpty()) throw new LockContextException("identityClaim must name at least one claim");
    return new LockContext(workspaceId, identityClaim, null);
  }

  public String workspaceId() { return workspaceId; }
  public List<String> identityClaim() { return identityClaim; }

  /** Session token, or {@code null} before {@link #identify} or {@link #withSessionToken}. */
  public SessionToken sessionToken() { return sessionToken; }

  /** Context bound to an already issued session token. */
  public LockContext withSessionToken(SessionToken token) {
    return new LockContext(workspaceId, identityClaim, Objects.requireNonNull(token, "token"));
  }

  public Result<LockContext> identify(String jwt, TokenAuthorizer authorizer) {
    Objects.requireNonNull(authorizer, "authorizer");
    if (jwt == null || jwt.isBlank()) return Result.failure(EncryptionError.lockContext("A JWT is required to identify a user"));
    try {
      SessionToken token = authorizer.authorize(workspaceId, jwt);
      if (token == null || token.accessToken().isEmpty()) {
        return Result.failure(EncryptionError.lockContext("The token service response did not contain an access token"));
      }
      return Result.data(withSessionToken(token));
    } catch (LockContextException e) {
      return Result.failure(EncryptionError.lockContext(e.getMessage()));
    }
  }

  /** Resolves the context for an engine call; fails when no session token has been set. */
  public Result<ResolvedLockContext> resolve() {
    if (sessionToken == null) {
      return Result.failure(EncryptionError.lockContext(
          "The session token is not set. Call identify() with the user's JWT or supply a token with withSessionToken()."));
    }
    return Result.data(new ResolvedLockContext(sessionToken, identityClaim));
  }

  @Override
  public String toString() {
    return "LockContext{workspace=" + workspaceId + ", identityClaim=" + identityClaim + ", identified=" + (sessionToken != null) + "}";
  }
}
