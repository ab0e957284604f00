package io.intellixity.sealquery.schema;

/** Plaintext type the engine casts decrypted values to. */
public enum CastAs {
  STRING("string"),
  NUMBER("number"),
  BIGINT("bigint"),
  BOOLEAN("boolean"),
  DATE("date"),
  JSON("json");

  private final String configName;

  CastAs(String configName) {
    this.configName = configName;
  }

  public String configName() { return configName; }

  public static CastAs fromConfigName(String name) {
    for (CastAs c : values()) {
      if (c.configName.equalsIgnoreCase(name)) return c;
    }
    throw new IllegalArgumentException("Unknown cast type: " + name);
  }
}
