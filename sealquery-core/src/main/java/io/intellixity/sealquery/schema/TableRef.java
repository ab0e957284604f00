package io.intellixity.sealquery.schema;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/** An encrypted table: its name and columns in declaration order. */
public final class TableRef {
  private final String name;
  private final Map<String, ColumnRef> columns;

  private TableRef(String name, Map<String, ColumnRef> columns) {
    this.name = name;
    this.columns = Collections.unmodifiableMap(columns);
  }

  public static TableRef of(String name, ColumnRef... columns) {
    Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("Table name must not be blank");
    Map<String, ColumnRef> byName = new LinkedHashMap<>();
    for (ColumnRef c : columns) {
      Objects.requireNonNull(c, "column");
      if (byName.putIfAbsent(c.name(), c) != null) {
        throw new IllegalArgumentException("Duplicate column '" + c.name() + "' in table '" + name + "'");
      }
    }
    return new TableRef(name, byName);
  }

  public String name() { return name; }
  public Collection<ColumnRef> columns() { return columns.values(); }

  /** Returns the column or {@code null} when the table has no column of that name. */
  public ColumnRef column(String columnName) {
    return columns.get(columnName);
  }

  public boolean hasColumn(String columnName) {
    return columns.containsKey(columnName);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof TableRef other)) return false;
    return name.equals(other.name) && columns.equals(other.columns);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, columns);
  }

  @Override
  public String toString() {
    return "TableRef{" + name + ", columns=" + columns.keySet() + "}";
  }
}
