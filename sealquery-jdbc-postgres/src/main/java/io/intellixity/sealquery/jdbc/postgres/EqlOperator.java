package io.intellixity.sealquery.jdbc.postgres;

import io.intellixity.sealquery.query.ContainmentTerm;
import io.intellixity.sealquery.query.JsonPathTerm;
import io.intellixity.sealquery.query.OperationKind;
import io.intellixity.sealquery.query.QueryTerm;
import io.intellixity.sealquery.query.QueryValidationException;

/** Comparisons available on {@code eql_v2_encrypted} columns. */
public enum EqlOperator {
  EQ("eql_v2.eq(%s, %s)"),
  GT("eql_v2.gt(%s, %s)"),
  GTE("eql_v2.gte(%s, %s)"),
  LT("eql_v2.lt(%s, %s)"),
  LTE("eql_v2.lte(%s, %s)"),
  ILIKE("eql_v2.ilike(%s, %s)"),
  CONTAINS("%s @> %s"),
  CONTAINED_BY("%s <@ %s"),
  PATH_EXISTS("eql_v2.jsonb_path_exists(%s, %s)");

  private final String template;

  EqlOperator(String template) {
    this.template = template;
  }

  String render(String column, String param) {
    return String.format(template, column, param);
  }

  /**
   * Operator implied by a term's resolved operation. A path with a value matches by containment of the
   * nested term; a bare path tests existence. Range queries have no default and need an explicit
   * comparison.
   */
  public static EqlOperator defaultFor(QueryTerm term, OperationKind operation) {
    return switch (operation) {
      case EQUALITY -> EQ;
      case FREE_TEXT_SEARCH -> ILIKE;
      case STE_VEC_SELECTOR -> term instanceof JsonPathTerm p && p.hasValue() ? CONTAINS : PATH_EXISTS;
      case STE_VEC_TERM -> term instanceof ContainmentTerm c && c.direction() == ContainmentTerm.Direction.CONTAINED_BY
          ? CONTAINED_BY
          : CONTAINS;
      case ORDER_AND_RANGE -> throw new QueryValidationException(
          "orderAndRange on column \"" + term.column().name() + "\" needs an explicit comparison operator");
      case SEARCHABLE_JSON -> throw new IllegalArgumentException("Unresolved operation: " + operation);
    };
  }
}
