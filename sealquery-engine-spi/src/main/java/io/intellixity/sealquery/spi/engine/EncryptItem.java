package io.intellixity.sealquery.spi.engine;

import io.intellixity.sealquery.schema.IndexKind;

import java.util.Objects;

/**
 * One plaintext for an engine encryption call.
 *
 * @param indexType index to produce a query term for, or {@code null} to encrypt for storage
 * @param queryOp   ste_vec query operation ({@code ste_vec_selector} / {@code ste_vec_term}), or {@code null}
 */
public record EncryptItem(String id, Object plaintext, String column, String table, IndexKind indexType, String queryOp) {
  public EncryptItem {
    Objects.requireNonNull(plaintext, "plaintext");
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(table, "table");
  }

  public static EncryptItem forStorage(String id, Object plaintext, String column, String table) {
    return new EncryptItem(id, plaintext, column, table, null, null);
  }
}
