package io.intellixity.sheetquery.query;

import io.intellixity.sheetquery.value.Value;
import io.intellixity.sheetquery.value.Values;

import java.util.Objects;

/**
 * Predicate over one column of one aliased sheet.\n
 *
 * The operator is kept as raw text so an unsupported operator surfaces as a validation error
 * when the preview runs rather than when the request is built.
 */
public record Filter(String alias, String column, String operator, Value value) {
  public Filter {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(operator, "operator");
    value = value == null ? Value.NULL : value;
  }

  public static Filter of(String alias, String column, String operator, Object value) {
    return new Filter(alias, column, operator, Values.of(value));
  }

  public static Filter eq(String alias, String column, Object value) { return of(alias, column, "eq", value); }
  public static Filter ne(String alias, String column, Object value) { return of(alias, column, "ne", value); }
  public static Filter contains(String alias, String column, Object value) { return of(alias, column, "contains", value); }
  public static Filter gt(String alias, String column, Object value) { return of(alias, column, "gt", value); }
  public static Filter lt(String alias, String column, Object value) { return of(alias, column, "lt", value); }
}
