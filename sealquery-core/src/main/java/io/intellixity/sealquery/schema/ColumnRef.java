package io.intellixity.sealquery.schema;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * An encrypted column and the indexes configured on it.
 * <pre>
 * ColumnRef email = ColumnRef.of("email").equality().freeTextSearch();
 * ColumnRef profile = ColumnRef.of("profile").searchableJson();
 * </pre>
 * Instances are immutable; every builder method returns a new column.
 */
public final class ColumnRef {
  private final String name;
  private final CastAs castAs;
  private final Set<IndexKind> indexes;

  private ColumnRef(String name, CastAs castAs, Set<IndexKind> indexes) {
    this.name = Objects.requireNonNull(name, "name");
    if (name.isBlank()) throw new IllegalArgumentException("Column name must not be blank");
    this.castAs = Objects.requireNonNull(castAs, "castAs");
    this.indexes = Collections.unmodifiableSet(indexes);
  }

  public static ColumnRef of(String name) {
    return new ColumnRef(name, CastAs.STRING, EnumSet.noneOf(IndexKind.class));
  }

  public String name() { return name; }
  public CastAs castAs() { return castAs; }
  public Set<IndexKind> indexes() { return indexes; }

  public boolean hasIndex(IndexKind kind) {
    return indexes.contains(kind);
  }

  public ColumnRef dataType(CastAs castAs) {
    return new ColumnRef(name, castAs, withAll());
  }

  public ColumnRef equality() { return withIndex(IndexKind.EQUALITY, castAs); }
  public ColumnRef freeTextSearch() { return withIndex(IndexKind.FREE_TEXT_SEARCH, castAs); }
  public ColumnRef orderAndRange() { return withIndex(IndexKind.ORDER_AND_RANGE, castAs); }

  /** Adds the structured-encryption index and switches the cast type to json. */
  public ColumnRef searchableJson() { return withIndex(IndexKind.STE_VEC, CastAs.JSON); }

  private ColumnRef withIndex(IndexKind kind, CastAs cast) {
    EnumSet<IndexKind> next = withAll();
    next.add(kind);
    return new ColumnRef(name, cast, next);
  }

  private EnumSet<IndexKind> withAll() {
    EnumSet<IndexKind> out = EnumSet.noneOf(IndexKind.class);
    out.addAll(indexes);
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof ColumnRef other)) return false;
    return name.equals(other.name) && castAs == other.castAs && indexes.equals(other.indexes);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, castAs, indexes);
  }

  @Override
  public String toString() {
    return "ColumnRef{" + name + ", castAs=" + castAs.configName() + ", indexes=" + indexes + "}";
  }
}
