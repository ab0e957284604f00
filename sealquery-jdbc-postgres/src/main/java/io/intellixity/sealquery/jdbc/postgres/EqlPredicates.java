package io.intellixity.sealquery.jdbc.postgres;

import io.intellixity.sealquery.format.EncryptedPayload;
import io.intellixity.sealquery.query.ClassifiedTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Renders WHERE-clause predicates over encrypted columns, using the EQL functions and operators installed
 * in Postgres.
 * <pre>
 * SqlFragment f = EqlPredicates.predicate("email", EqlOperator.EQ, payload);
 * // eql_v2.eq("email", ?)   binds: [payload]
 * </pre>
 */
public final class EqlPredicates {
  private EqlPredicates() {}

  public static SqlFragment predicate(String column, EqlOperator op, EncryptedPayload encrypted) {
    Objects.requireNonNull(op, "op");
    String col = quoteIdent(column);
    if (encrypted == null) return new SqlFragment(col + " IS NULL", List.of());
    return new SqlFragment(op.render(col, "?"), List.of(encrypted));
  }

  public static SqlFragment not(SqlFragment f) {
    return new SqlFragment("NOT (" + f.sql() + ")", f.binds());
  }

  /** Predicate for a classified term and its encrypted payload, using the operation's default operator. */
  public static SqlFragment forTerm(ClassifiedTerm term, EncryptedPayload encrypted) {
    String column = term.term().column().name();
    if (term.isPassthrough() || encrypted == null) return new SqlFragment(quoteIdent(column) + " IS NULL", List.of());
    return predicate(column, EqlOperator.defaultFor(term.term(), term.operation()), encrypted);
  }

  /** Value at a JSON path selector, as an expression usable in SELECT lists or further comparisons. */
  public static SqlFragment pathQueryFirst(String column, EncryptedPayload selector) {
    Objects.requireNonNull(selector, "selector");
    return new SqlFragment("eql_v2.jsonb_path_query_first(" + quoteIdent(column) + ", ?)", List.of(selector));
  }

  public static SqlFragment and(SqlFragment... parts) {
    return join(" AND ", parts);
  }

  public static SqlFragment or(SqlFragment... parts) {
    return join(" OR ", parts);
  }

  static String quoteIdent(String ident) {
    Objects.requireNonNull(ident, "ident");
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  private static SqlFragment join(String op, SqlFragment... parts) {
    if (parts.length == 0) throw new IllegalArgumentException("Nothing to combine");
    if (parts.length == 1) return parts[0];
    StringBuilder sql = new StringBuilder("(");
    List<Object> binds = new ArrayList<>();
    for (int i = 0; i < parts.length; i++) {
      if (i > 0) sql.append(op);
      sql.append(parts[i].sql());
      binds.addAll(parts[i].binds());
    }
    return new SqlFragment(sql.append(')').toString(), binds);
  }
}
