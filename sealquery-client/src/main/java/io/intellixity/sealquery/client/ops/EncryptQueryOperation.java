package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.client.query.BatchQueryBuilder;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.query.QueryTerm;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.Map;
import java.util.Objects;

/**
 * Encrypts one query term. The result is an {@link io.intellixity.sealquery.format.EncryptedPayload},
 * a composite-literal string, or {@code null}, depending on the term's return type and plaintext.
 */
public final class EncryptQueryOperation extends EncryptionOperation<Object, EncryptQueryOperation> {
  private final QueryTerm term;
  private final BatchQueryBuilder builder;

  public EncryptQueryOperation(EncryptionEngine engine, Logger log, BatchQueryBuilder builder, QueryTerm term) {
    this(engine, log, null, null, builder, term);
  }

  private EncryptQueryOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                                BatchQueryBuilder builder, QueryTerm term) {
    super(engine, log, lockContext, audit);
    this.builder = Objects.requireNonNull(builder, "builder");
    this.term = Objects.requireNonNull(term, "term");
  }

  @Override
  protected EncryptQueryOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new EncryptQueryOperation(engine(), log(), lockContext, auditMetadata, builder, term);
  }

  @Override
  protected Object run(EngineCall call) {
    return builder.single(term, call);
  }

  @Override protected String name() { return "encryptQuery"; }
  @Override protected String target() { return "table=" + term.table().name() + " column=" + term.column().name(); }
}
