package io.intellixity.sealquery.schema;

/** Searchable index types a column can carry, with the name the engine knows them by. */
public enum IndexKind {
  EQUALITY("unique"),
  FREE_TEXT_SEARCH("match"),
  ORDER_AND_RANGE("ore"),
  STE_VEC("ste_vec");

  private final String engineName;

  IndexKind(String engineName) {
    this.engineName = engineName;
  }

  public String engineName() { return engineName; }

  public static IndexKind fromEngineName(String name) {
    for (IndexKind k : values()) {
      if (k.engineName.equals(name)) return k;
    }
    throw new IllegalArgumentException("Unknown index type: " + name);
  }
}
