package io.intellixity.sheetquery.engine.expr;

import io.intellixity.sheetquery.query.QueryValidationException;

/**
 * Tiny projection DSL parser.\n
 *
 * <pre>
 *   expr      := aggregate | columnRef
 *   aggregate := ("sum" | "avg" | "count") "(" (columnRef | "*") ")"
 *   columnRef := [alias "."] column
 * </pre>
 *
 * A column without alias belongs to the primary sheet. Whether alias and column exist is checked
 * when the expression is evaluated, not here.
 */
public final class ExpressionParser {
  private ExpressionParser() {}

  public static ProjectionExpression parse(String expression, String primaryAlias) {
    if (expression == null || expression.isBlank()) {
      throw new QueryValidationException("projection expression is empty");
    }
    String s = expression.trim();

    int open = s.indexOf('(');
    if (open >= 0 && s.endsWith(")")) {
      AggregateFunction fn = AggregateFunction.tryParse(s.substring(0, open));
      if (fn != null) return parseAggregate(fn, s.substring(open + 1, s.length() - 1).trim(), expression, primaryAlias);
    }

    String[] ref = splitRef(s, primaryAlias);
    if (ref[1].isEmpty()) throw new QueryValidationException("column missing in projection '" + expression + "'");
    return new ColumnRef(ref[0], ref[1]);
  }

  private static ProjectionExpression parseAggregate(AggregateFunction fn,
                                                     String inner,
                                                     String expression,
                                                     String primaryAlias) {
    if (inner.isEmpty()) {
      throw new QueryValidationException("aggregate expression '" + expression + "' is empty");
    }
    if (inner.equals("*")) {
      if (fn == AggregateFunction.COUNT) return new CountStar();
      throw new QueryValidationException("'*' is only supported by count in '" + expression + "'");
    }
    String[] ref = splitRef(inner, primaryAlias);
    if (ref[1].isEmpty()) throw new QueryValidationException("column missing in aggregate '" + expression + "'");
    return new AggregateRef(fn, ref[0], ref[1]);
  }

  // Splits at the first dot: "a.b.c" is column "b.c" of alias "a".
  private static String[] splitRef(String s, String primaryAlias) {
    int dot = s.indexOf('.');
    if (dot < 0) return new String[] {primaryAlias, s.trim()};
    String alias = s.substring(0, dot).trim();
    String column = s.substring(dot + 1).trim();
    return new String[] {alias.isEmpty() ? primaryAlias : alias, column};
  }
}
