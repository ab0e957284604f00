package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.client.query.BatchQueryBuilder;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.query.QueryTerm;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import org.slf4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** Encrypts a list of query terms in one engine call; see {@link BatchQueryBuilder}. */
public final class BatchEncryptQueryOperation extends EncryptionOperation<List<Object>, BatchEncryptQueryOperation> {
  private final List<QueryTerm> terms;
  private final BatchQueryBuilder builder;

  public BatchEncryptQueryOperation(EncryptionEngine engine, Logger log, BatchQueryBuilder builder,
                                    List<? extends QueryTerm> terms) {
    this(engine, log, null, null, builder, Collections.unmodifiableList(new ArrayList<>(Objects.requireNonNull(terms, "terms"))));
  }

  private BatchEncryptQueryOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> audit,
                                     BatchQueryBuilder builder, List<QueryTerm> terms) {
    super(engine, log, lockContext, audit);
    this.builder = Objects.requireNonNull(builder, "builder");
    this.terms = terms;
  }

  @Override
  protected BatchEncryptQueryOperation copy(LockContext lockContext, Map<String, Object> auditMetadata) {
    return new BatchEncryptQueryOperation(engine(), log(), lockContext, auditMetadata, builder, terms);
  }

  @Override
  protected List<Object> run(EngineCall call) {
    return builder.build(terms, call);
  }

  @Override protected String name() { return "encryptQueryBatch"; }
  @Override protected String target() { return "terms=" + terms.size(); }
}
