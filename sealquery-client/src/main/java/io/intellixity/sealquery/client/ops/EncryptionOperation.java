package io.intellixity.sealquery.client.ops;

import io.intellixity.sealquery.format.MalformedPayloadException;
import io.intellixity.sealquery.identity.LockContext;
import io.intellixity.sealquery.identity.LockContextException;
import io.intellixity.sealquery.identity.ResolvedLockContext;
import io.intellixity.sealquery.query.QueryValidationException;
import io.intellixity.sealquery.result.EncryptionError;
import io.intellixity.sealquery.result.ErrorType;
import io.intellixity.sealquery.result.Result;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import io.intellixity.sealquery.spi.engine.EngineException;
import org.slf4j.Logger;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * A deferred call to the encryption engine.
 * <p>
 * Nothing happens until {@link #execute()}. {@link #withLockContext(LockContext)} and {@link #audit(Map)}
 * return copies, so an operation can be shared and its variants executed independently. When bound, the
 * lock context is resolved before the engine is called and a resolution failure skips the engine call.
 * <p>
 * {@code execute()} never throws: validation, lock-context and engine failures come back as
 * {@link Result#failure(EncryptionError)} with the engine's error code kept.
 */
public abstract class EncryptionOperation<T, O extends EncryptionOperation<T, O>> {
  private final EncryptionEngine engine;
  private final Logger log;
  private final LockContext lockContext;
  private final Map<String, Object> auditMetadata;
  private volatile boolean executed;

  protected EncryptionOperation(EncryptionEngine engine, Logger log, LockContext lockContext, Map<String, Object> auditMetadata) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.log = Objects.requireNonNull(log, "log");
    this.lockContext = lockContext;
    this.auditMetadata = auditMetadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(auditMetadata));
  }

  protected EncryptionEngine engine() { return engine; }
  protected Logger log() { return log; }
  public LockContext lockContext() { return lockContext; }
  public Map<String, Object> auditMetadata() { return auditMetadata; }

  public OperationState state() {
    if (executed) return OperationState.EXECUTED;
    return lockContext == null ? OperationState.UNBOUND : OperationState.BOUND;
  }

  public O withLockContext(LockContext ctx) {
    return copy(Objects.requireNonNull(ctx, "ctx"), auditMetadata);
  }

  /** Attaches metadata that the engine records alongside the call; {@code null} values are kept. */
  public O audit(Map<String, ?> metadata) {
    return copy(lockContext, new LinkedHashMap<>(Objects.requireNonNull(metadata, "metadata")));
  }

  protected abstract O copy(LockContext lockContext, Map<String, Object> auditMetadata);

  /** Does the work; may throw the exceptions {@link #execute()} maps into failures. */
  protected abstract T run(EngineCall call);

  /** Short name used in log lines. */
  protected abstract String name();

  /** Table/column description for log lines. */
  protected String target() {
    return "";
  }

  /** Type for failures that are neither validation, lock-context nor engine errors. */
  protected ErrorType fallbackErrorType() {
    return ErrorType.ENGINE_ERROR;
  }

  public final Result<T> execute() {
    try {
      ResolvedLockContext resolved = null;
      if (lockContext != null) {
        Result<ResolvedLockContext> r = lockContext.resolve();
        if (r.isFailure()) return failed(r.failure());
        resolved = r.data();
      }
      T out = run(new EngineCall(engine, resolved, auditMetadata));
      if (log.isDebugEnabled()) {
        log.debug("op={} {} lockContext={} ok", name(), target(), resolved != null);
      }
      return Result.data(out);
    } catch (QueryValidationException e) {
      return failed(EncryptionError.validation(e.getMessage()));
    } catch (LockContextException e) {
      return failed(EncryptionError.lockContext(e.getMessage()));
    } catch (EngineException e) {
      return failed(EncryptionError.engine(e.getMessage(), e.code()));
    } catch (MalformedPayloadException | DecryptionException e) {
      return failed(EncryptionError.decryption(e.getMessage()));
    } catch (RuntimeException e) {
      log.warn("op={} {} failed unexpectedly", name(), target(), e);
      return failed(EncryptionError.of(fallbackErrorType(), String.valueOf(e.getMessage())));
    } finally {
      executed = true;
    }
  }

  /** Runs {@link #execute()} on {@code executor}; the future always completes normally. */
  public final CompletableFuture<Result<T>> executeAsync(Executor executor) {
    Objects.requireNonNull(executor, "executor");
    return CompletableFuture.supplyAsync(this::execute, executor);
  }

  private Result<T> failed(EncryptionError error) {
    log.debug("op={} {} failed type={} code={}: {}", name(), target(), error.type(), error.code(), error.message());
    return Result.failure(error);
  }
}
