package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.format.EncryptedPayload;

/** {@code data} is {@code null} when the input plaintext was null. */
public record BulkEncryptedItem(String id, EncryptedPayload data) {}
