package io.intellixity.sealquery.client;

import io.intellixity.sealquery.client.ops.BatchEncryptQueryOperation;
import io.intellixity.sealquery.client.ops.BulkDecryptItem;
import io.intellixity.sealquery.client.ops.BulkDecryptModelsOperation;
import io.intellixity.sealquery.client.ops.BulkDecryptOperation;
import io.intellixity.sealquery.client.ops.BulkEncryptItem;
import io.intellixity.sealquery.client.ops.BulkEncryptModelsOperation;
import io.intellixity.sealquery.client.ops.BulkEncryptOperation;
import io.intellixity.sealquery.client.ops.DecryptModelOperation;
import io.intellixity.sealquery.client.ops.DecryptOperation;
import io.intellixity.sealquery.client.ops.EncryptModelOperation;
import io.intellixity.sealquery.client.ops.EncryptOperation;
import io.intellixity.sealquery.client.ops.EncryptQueryOperation;
import io.intellixity.sealquery.client.query.BatchQueryBuilder;
import io.intellixity.sealquery.query.OperationKind;
import io.intellixity.sealquery.query.QueryTerm;
import io.intellixity.sealquery.query.QueryTerms;
import io.intellixity.sealquery.result.EncryptionError;
import io.intellixity.sealquery.result.Result;
import io.intellixity.sealquery.schema.ColumnRef;
import io.intellixity.sealquery.schema.EncryptConfig;
import io.intellixity.sealquery.schema.TableRef;
import io.intellixity.sealquery.spi.engine.ClientConfig;
import io.intellixity.sealquery.spi.engine.EncryptionEngine;
import io.intellixity.sealquery.spi.engine.EncryptionEngineProvider;
import io.intellixity.sealquery.util.SealqueryFactoriesLoader;
import org.slf4j.Logger;
import org.slf4j.helpers.NOPLogger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Entry point: creates deferred operations bound to one engine and schema.
 * <pre>
 * EncryptionClient client = EncryptionClient.builder()
 *     .tables(users)
 *     .config(ClientConfig.load())
 *     .build()
 *     .data();
 * Result&lt;EncryptedPayload&gt; r = client.encrypt("a@b.c", email, users).execute();
 * </pre>
 * Without an explicit engine, the builder discovers an {@link EncryptionEngineProvider} via
 * {@code META-INF/sealquery.factories}.
 */
public final class EncryptionClient {
  private final EncryptionEngine engine;
  private final EncryptConfig encryptConfig;
  private final Logger log;
  private final BatchQueryBuilder batchQueryBuilder = new BatchQueryBuilder();

  private EncryptionClient(EncryptionEngine engine, EncryptConfig encryptConfig, Logger log) {
    this.engine = engine;
    this.encryptConfig = encryptConfig;
    this.log = log;
  }

  public static Builder builder() {
    return new Builder();
  }

  public EncryptConfig encryptConfig() { return encryptConfig; }

  public EncryptOperation encrypt(Object plaintext, ColumnRef column, TableRef table) {
    return new EncryptOperation(engine, log, plaintext, column, table);
  }

  public DecryptOperation decrypt(Object ciphertext) {
    return new DecryptOperation(engine, log, ciphertext);
  }

  /** Query term for a plain value; the operation is inferred from the column's index. */
  public EncryptQueryOperation encryptQuery(Object plaintext, ColumnRef column, TableRef table) {
    return encryptQuery(QueryTerms.value(plaintext, column, table));
  }

  public EncryptQueryOperation encryptQuery(Object plaintext, ColumnRef column, TableRef table, OperationKind queryType) {
    return encryptQuery(QueryTerms.value(plaintext, column, table, queryType));
  }

  public EncryptQueryOperation encryptQuery(QueryTerm term) {
    return new EncryptQueryOperation(engine, log, batchQueryBuilder, term);
  }

  public BatchEncryptQueryOperation encryptQuery(List<? extends QueryTerm> terms) {
    return new BatchEncryptQueryOperation(engine, log, batchQueryBuilder, terms);
  }

  public BulkEncryptOperation bulkEncrypt(List<BulkEncryptItem> items, ColumnRef column, TableRef table) {
    return new BulkEncryptOperation(engine, log, items, column, table);
  }

  public BulkDecryptOperation bulkDecrypt(List<BulkDecryptItem> items) {
    return new BulkDecryptOperation(engine, log, items);
  }

  public EncryptModelOperation encryptModel(Map<String, ?> model, TableRef table) {
    return new EncryptModelOperation(engine, log, model, table);
  }

  public DecryptModelOperation decryptModel(Map<String, ?> model) {
    return new DecryptModelOperation(engine, log, model);
  }

  public BulkEncryptModelsOperation bulkEncryptModels(List<? extends Map<String, ?>> models, TableRef table) {
    return new BulkEncryptModelsOperation(engine, log, models, table);
  }

  public BulkDecryptModelsOperation bulkDecryptModels(List<? extends Map<String, ?>> models) {
    return new BulkDecryptModelsOperation(engine, log, models);
  }

  public static final class Builder {
    private final List<TableRef> tables = new ArrayList<>();
    private EncryptionEngine engine;
    private ClientConfig config;
    private Logger logger = NOPLogger.NOP_LOGGER;
    private ClassLoader classLoader;

    private Builder() {}

    public Builder tables(TableRef... tables) {
      this.tables.addAll(Arrays.asList(tables));
      return this;
    }

    /** Uses this engine instead of discovering a provider. */
    public Builder engine(EncryptionEngine engine) {
      this.engine = engine;
      return this;
    }

    public Builder config(ClientConfig config) {
      this.config = config;
      return this;
    }

    public Builder logger(Logger logger) {
      this.logger = Objects.requireNonNull(logger, "logger");
      return this;
    }

    public Builder classLoader(ClassLoader classLoader) {
      this.classLoader = classLoader;
      return this;
    }

    /** Fails with {@code CLIENT_INIT_ERROR} on a missing schema, bad config or no usable engine. */
    public Result<EncryptionClient> build() {
      try {
        EncryptConfig encryptConfig = EncryptConfig.of(tables);
        EncryptionEngine e = engine != null ? engine : discover(encryptConfig);
        logger.debug("Initialized encryption client: tables={} engine={}", tables.size(), e.getClass().getSimpleName());
        return Result.data(new EncryptionClient(e, encryptConfig, logger));
      } catch (RuntimeException e) {
        logger.debug("Encryption client initialization failed: {}", e.getMessage());
        return Result.failure(EncryptionError.clientInit(String.valueOf(e.getMessage())));
      }
    }

    private EncryptionEngine discover(EncryptConfig encryptConfig) {
      ClientConfig cfg = config != null ? config : ClientConfig.load();
      cfg.validate();

      List<EncryptionEngineProvider> providers = classLoader == null
          ? SealqueryFactoriesLoader.load(EncryptionEngineProvider.class)
          : SealqueryFactoriesLoader.load(EncryptionEngineProvider.class, classLoader);
      if (providers.isEmpty()) {
        throw new IllegalStateException("No EncryptionEngineProvider registered in " + SealqueryFactoriesLoader.RESOURCE);
      }

      EncryptionEngineProvider chosen = null;
      if (cfg.getEngine() == null) {
        if (providers.size() > 1) {
          throw new IllegalStateException("Several engine providers found " + ids(providers) + "; set sealquery.engine");
        }
        chosen = providers.get(0);
      } else {
        for (EncryptionEngineProvider p : providers) {
          if (cfg.getEngine().equals(p.id())) chosen = p;
        }
        if (chosen == null) {
          throw new IllegalStateException("No engine provider with id '" + cfg.getEngine() + "'; found " + ids(providers));
        }
      }
      return Objects.requireNonNull(chosen.create(cfg, encryptConfig), "Engine provider '" + chosen.id() + "' returned null");
    }

    private static List<String> ids(List<EncryptionEngineProvider> providers) {
      return providers.stream().map(EncryptionEngineProvider::id).toList();
    }
  }
}
