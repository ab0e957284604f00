package io.intellixity.sealquery.spi.engine;

import io.intellixity.sealquery.format.EncryptedPayload;

import java.util.Objects;

public record DecryptItem(String id, EncryptedPayload ciphertext) {
  public DecryptItem {
    Objects.requireNonNull(ciphertext, "ciphertext");
  }
}
