package io.intellixity.sealquery.query;

import io.intellixity.sealquery.schema.IndexKind;

/**
 * Query operation a term is encrypted for.
 * <p>
 * {@link #SEARCHABLE_JSON} is a meta kind: it resolves to {@link #STE_VEC_SELECTOR} or {@link #STE_VEC_TERM}
 * from the plaintext shape and never reaches the engine itself.
 */
public enum OperationKind {
  EQUALITY("equality", IndexKind.EQUALITY, null),
  ORDER_AND_RANGE("orderAndRange", IndexKind.ORDER_AND_RANGE, null),
  FREE_TEXT_SEARCH("freeTextSearch", IndexKind.FREE_TEXT_SEARCH, null),
  STE_VEC_SELECTOR("steVecSelector", IndexKind.STE_VEC, "ste_vec_selector"),
  STE_VEC_TERM("steVecTerm", IndexKind.STE_VEC, "ste_vec_term"),
  SEARCHABLE_JSON("searchableJson", IndexKind.STE_VEC, null);

  private final String wireName;
  private final IndexKind index;
  private final String queryOp;

  OperationKind(String wireName, IndexKind index, String queryOp) {
    this.wireName = wireName;
    this.index = index;
    this.queryOp = queryOp;
  }

  public String wireName() { return wireName; }
  public IndexKind index() { return index; }

  /** Engine query operation, or {@code null} when the index alone determines it. */
  public String queryOp() { return queryOp; }

  public boolean isMeta() { return this == SEARCHABLE_JSON; }

  public static OperationKind fromWireName(String name) {
    for (OperationKind k : values()) {
      if (k.wireName.equals(name)) return k;
    }
    throw new QueryValidationException("Unknown queryType: " + name);
  }

  /** Default operation for a single configured index; ste_vec resolves to the meta kind. */
  public static OperationKind forIndex(IndexKind index) {
    return switch (index) {
      case EQUALITY -> EQUALITY;
      case ORDER_AND_RANGE -> ORDER_AND_RANGE;
      case FREE_TEXT_SEARCH -> FREE_TEXT_SEARCH;
      case STE_VEC -> SEARCHABLE_JSON;
    };
  }
}
