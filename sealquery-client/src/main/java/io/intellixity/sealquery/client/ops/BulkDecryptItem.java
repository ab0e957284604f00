package io.intellixity.sealquery.client.ops;

/**
 * Input to {@link BulkDecryptOperation}.
 *
 * @param data an {@link io.intellixity.sealquery.format.EncryptedPayload}, its map form, or {@code null}
 */
public record BulkDecryptItem(String id, Object data) {}
