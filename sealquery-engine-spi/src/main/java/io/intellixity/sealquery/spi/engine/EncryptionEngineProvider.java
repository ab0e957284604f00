package io.intellixity.sealquery.spi.engine;

import io.intellixity.sealquery.schema.EncryptConfig;

/**
 * Creates engines at client startup. Implementations are listed in {@code META-INF/sealquery.factories}
 * under this interface's name and need a public no-arg constructor.
 */
public interface EncryptionEngineProvider {

  /** Identifier matched against {@link ClientConfig#getEngine()} when several providers are present. */
  String id();

  EncryptionEngine create(ClientConfig config, EncryptConfig encryptConfig);
}
