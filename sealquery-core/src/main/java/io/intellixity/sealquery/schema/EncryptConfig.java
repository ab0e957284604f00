package io.intellixity.sealquery.schema;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.intellixity.sealquery.util.Json;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Engine-facing encryption config derived from declared tables:
 * <pre>
 * {"v": 2, "tables": {"users": {"email": {"cast_as": "string", "indexes": {"unique": {...}}}}}}
 * </pre>
 */
public final class EncryptConfig {
  public static final int VERSION = 2;

  private final List<TableRef> tables;

  private EncryptConfig(List<TableRef> tables) {
    this.tables = List.copyOf(tables);
  }

  public static EncryptConfig of(Collection<TableRef> tables) {
    Objects.requireNonNull(tables, "tables");
    if (tables.isEmpty()) throw new IllegalArgumentException("At least one table must be declared");
    Map<String, TableRef> byName = new LinkedHashMap<>();
    for (TableRef t : tables) {
      if (byName.putIfAbsent(t.name(), t) != null) {
        throw new IllegalArgumentException("Duplicate table '" + t.name() + "'");
      }
    }
    return new EncryptConfig(new ArrayList<>(byName.values()));
  }

  public List<TableRef> tables() { return tables; }

  public TableRef table(String name) {
    for (TableRef t : tables) {
      if (t.name().equals(name)) return t;
    }
    return null;
  }

  public Map<String, Object> toMap() {
    Map<String, Object> tablesOut = new LinkedHashMap<>();
    for (TableRef t : tables) {
      Map<String, Object> cols = new LinkedHashMap<>();
      for (ColumnRef c : t.columns()) {
        Map<String, Object> col = new LinkedHashMap<>();
        col.put("cast_as", c.castAs().configName());
        col.put("indexes", indexOptions(t, c));
        cols.put(c.name(), col);
      }
      tablesOut.put(t.name(), cols);
    }
    Map<String, Object> out = new LinkedHashMap<>();
    out.put("v", VERSION);
    out.put("tables", tablesOut);
    return out;
  }

  public String toJson() {
    try {
      return Json.mapper().writeValueAsString(toMap());
    } catch (JsonProcessingException e) {
      throw new IllegalStateException("Failed to serialize encrypt config", e);
    }
  }

  private static Map<String, Object> indexOptions(TableRef table, ColumnRef column) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (IndexKind k : column.indexes()) {
      switch (k) {
        case EQUALITY -> out.put(k.engineName(), Map.of("token_filters", List.of()));
        case FREE_TEXT_SEARCH -> {
          Map<String, Object> match = new LinkedHashMap<>();
          match.put("tokenizer", Map.of("kind", "ngram", "token_length", 3));
          match.put("token_filters", List.of(Map.of("kind", "downcase")));
          match.put("k", 6);
          match.put("m", 2048);
          match.put("include_original", true);
          out.put(k.engineName(), match);
        }
        case ORDER_AND_RANGE -> out.put(k.engineName(), Map.of());
        case STE_VEC -> out.put(k.engineName(), Map.of("prefix", table.name() + "/" + column.name()));
      }
    }
    return out;
  }
}
