package io.intellixity.sealquery.query;

/** Output form of an encrypted query term. */
public enum ReturnType {
  /** The payload object itself. */
  RAW("eql"),
  /** Postgres composite literal, e.g. for raw SQL parameters. */
  COMPOSITE_LITERAL("composite-literal"),
  /** The composite literal encoded once more as a JSON string, for embedding inside another string. */
  ESCAPED_COMPOSITE_LITERAL("escaped-composite-literal");

  private final String wireName;

  ReturnType(String wireName) {
    this.wireName = wireName;
  }

  public String wireName() { return wireName; }

  public static ReturnType fromWireName(String name) {
    for (ReturnType r : values()) {
      if (r.wireName.equals(name)) return r;
    }
    throw new QueryValidationException("Unknown returnType: " + name);
  }
}
