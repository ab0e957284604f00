package io.intellixity.sealquery.identity;

import java.util.Objects;

/**
 * Short-lived token issued by the token service for one identified user.
 *
 * @param expiry expiry as epoch seconds
 */
public record SessionToken(String accessToken, long expiry) {
  public SessionToken {
    Objects.requireNonNull(accessToken, "accessToken");
  }

  @Override
  public String toString() {
    return "SessionToken{expiry=" + expiry + "}";
  }
}
