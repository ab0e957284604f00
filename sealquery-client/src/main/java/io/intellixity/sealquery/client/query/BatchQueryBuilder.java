package io.intellixity.sealquery.client.query;

import io.intellixity.sealquery.client.internal.CompactedList;
import io.intellixity.sealquery.client.ops.EngineCall;
import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.format.ResultFormatter;
import io.intellixity.sealquery.query.ClassifiedTerm;
import io.intellixity.sealquery.query.QueryPart;
import io.intellixity.sealquery.query.QueryTerm;
import io.intellixity.sealquery.query.QueryTermClassifier;
import io.intellixity.sealquery.spi.engine.EncryptItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Encrypts query terms, many at a time, in a single engine round trip.
 * <ul>
 *   <li>every term is classified first; one invalid term fails the whole batch before the engine is called</li>
 *   <li>null terms and null plaintexts skip the engine and come back as {@code null} in place</li>
 *   <li>an empty batch, or one made only of nulls, makes no engine call</li>
 *   <li>output {@code i} belongs to input {@code i}, formatted per the term's return type</li>
 * </ul>
 */
public final class BatchQueryBuilder {
  private final QueryTermClassifier classifier;
  private final ResultFormatter formatter;

  public BatchQueryBuilder() {
    this(new QueryTermClassifier(), new ResultFormatter());
  }

  public BatchQueryBuilder(QueryTermClassifier classifier, ResultFormatter formatter) {
    this.classifier = Objects.requireNonNull(classifier, "classifier");
    this.formatter = Objects.requireNonNull(formatter, "formatter");
  }

  public List<Object> build(List<? extends QueryTerm> terms, EngineCall call) {
    Objects.requireNonNull(terms, "terms");
    if (terms.isEmpty()) return List.of();

    List<ClassifiedTerm> classified = new ArrayList<>(terms.size());
    for (QueryTerm t : terms) {
      classified.add(t == null ? null : classifier.resolve(t));
    }

    CompactedList<ClassifiedTerm> live = CompactedList.of(classified, c -> c == null || c.isPassthrough());
    if (live.isEmpty()) return live.expand(List.of());

    List<EncryptItem> items = new ArrayList<>();
    for (ClassifiedTerm c : live.values()) {
      for (QueryPart p : c.parts()) {
        items.add(toItem(c.term(), p));
      }
    }
    List<EncryptedPayload> results = call.encryptBulk(items);
    if (results.size() != items.size()) {
      throw new IllegalStateException("Engine returned " + results.size() + " results for " + items.size() + " items");
    }

    List<Object> formatted = new ArrayList<>(live.values().size());
    int offset = 0;
    for (ClassifiedTerm c : live.values()) {
      int n = c.parts().size();
      EncryptedPayload payload = c.assemble(results.subList(offset, offset + n));
      offset += n;
      formatted.add(formatter.format(payload, c.term().returnType()));
    }
    return live.expand(formatted);
  }

  /** Single-term form: one engine call, or none for a null plaintext. */
  public Object single(QueryTerm term, EngineCall call) {
    ClassifiedTerm c = classifier.resolve(Objects.requireNonNull(term, "term"));
    if (c.isPassthrough()) return null;

    EncryptedPayload payload;
    if (c.parts().size() == 1) {
      payload = call.encrypt(toItem(term, c.parts().get(0)));
    } else {
      List<EncryptItem> items = new ArrayList<>(c.parts().size());
      for (QueryPart p : c.parts()) {
        items.add(toItem(term, p));
      }
      payload = c.assemble(call.encryptBulk(items));
    }
    return formatter.format(payload, term.returnType());
  }

  private static EncryptItem toItem(QueryTerm term, QueryPart part) {
    return new EncryptItem(null, part.plaintext(), term.column().name(), term.table().name(), part.index(), part.queryOp());
  }
}
