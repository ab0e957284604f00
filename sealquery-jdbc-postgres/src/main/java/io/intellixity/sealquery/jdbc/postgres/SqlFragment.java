package io.intellixity.sealquery.jdbc.postgres;

import java.util.List;
import java.util.Objects;

/** A piece of SQL with {@code ?} placeholders and the values to bind to them, in order. */
public record SqlFragment(String sql, List<Object> binds) {
  public SqlFragment {
    Objects.requireNonNull(sql, "sql");
    binds = List.copyOf(binds);
  }
}
