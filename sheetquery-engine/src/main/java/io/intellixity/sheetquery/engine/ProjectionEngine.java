package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.engine.expr.AggregateFunction;
import io.intellixity.sheetquery.engine.expr.AggregateRef;
import io.intellixity.sheetquery.engine.expr.ColumnRef;
import io.intellixity.sheetquery.engine.expr.CountStar;
import io.intellixity.sheetquery.engine.expr.ExpressionParser;
import io.intellixity.sheetquery.engine.expr.ProjectionExpression;
import io.intellixity.sheetquery.query.Projection;
import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.value.Value;
import io.intellixity.sheetquery.value.Values;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Turns filtered combined rows into output cells.\n
 *
 * Detail mode emits one row per combined row; aggregate mode emits exactly one row computed over
 * all of them. A request is entirely one or the other.
 */
public final class ProjectionEngine {
  private final List<ProjectionExpression> expressions;
  private final boolean aggregate;

  private ProjectionEngine(List<ProjectionExpression> expressions, boolean aggregate) {
    this.expressions = expressions;
    this.aggregate = aggregate;
  }

  public static ProjectionEngine plan(List<Projection> projections, String primaryAlias) {
    List<ProjectionExpression> parsed = new ArrayList<>(projections.size());
    boolean anyAggregate = false;
    boolean anyScalar = false;
    for (Projection p : projections) {
      ProjectionExpression e = ExpressionParser.parse(p.expression(), primaryAlias);
      if (e.aggregate()) anyAggregate = true;
      else anyScalar = true;
      parsed.add(e);
    }
    if (anyAggregate && anyScalar) {
      throw new QueryValidationException("cannot mix aggregate and scalar projections");
    }
    return new ProjectionEngine(List.copyOf(parsed), anyAggregate);
  }

  public boolean aggregate() {
    return aggregate;
  }

  /**
   * @param aliases every alias of the request; an aggregate over any other alias is rejected
   */
  public List<List<String>> project(List<CombinedRow> rows, Set<String> aliases) {
    if (aggregate) return List.of(aggregateRow(rows, aliases));

    List<List<String>> out = new ArrayList<>(rows.size());
    for (CombinedRow r : rows) {
      List<String> cells = new ArrayList<>(expressions.size());
      for (ProjectionExpression e : expressions) {
        ColumnRef ref = (ColumnRef) e;
        cells.add(Values.display(r.get(ref.alias(), ref.column())));
      }
      out.add(cells);
    }
    return out;
  }

  private List<String> aggregateRow(List<CombinedRow> rows, Set<String> aliases) {
    List<String> cells = new ArrayList<>(expressions.size());
    for (ProjectionExpression e : expressions) {
      if (e instanceof CountStar) {
        cells.add(Values.display(Value.number(rows.size())));
      } else if (e instanceof AggregateRef a) {
        requireAlias(a, rows, aliases);
        cells.add(Values.display(compute(a, rows)));
      } else {
        throw new IllegalStateException("Unexpected projection in aggregate mode: " + e);
      }
    }
    return cells;
  }

  private static void requireAlias(AggregateRef a, List<CombinedRow> rows, Set<String> aliases) {
    boolean present = rows.isEmpty() ? aliases.contains(a.alias()) : rows.stream().anyMatch(r -> r.has(a.alias()));
    if (!present) {
      throw new QueryValidationException(
          "unknown sheet alias '" + a.alias() + "' in aggregate '" + a.function().functionName() + "'");
    }
  }

  private static Value compute(AggregateRef a, List<CombinedRow> rows) {
    if (a.function() == AggregateFunction.COUNT) {
      long n = 0;
      for (CombinedRow r : rows) {
        if (r.has(a.alias()) && !r.get(a.alias(), a.column()).isNull()) n++;
      }
      return Value.number(n);
    }

    NumericSum sum = new NumericSum();
    for (CombinedRow r : rows) {
      if (!r.has(a.alias())) continue;
      OptionalDouble d = Values.toNumber(r.get(a.alias(), a.column()));
      if (d.isPresent()) sum.add(d.getAsDouble());
    }
    if (a.function() == AggregateFunction.SUM) return Value.number(sum.total());
    return Value.number(sum.count() == 0 ? 0.0 : sum.total() / sum.count());
  }

  /**
   * Exact summation: finite terms are added as BigDecimal so the result does not depend on row order.
   */
  static final class NumericSum {
    private BigDecimal finite = BigDecimal.ZERO;
    private double nonFinite = 0.0;
    private boolean sawNonFinite;
    private long count;

    void add(double d) {
      count++;
      if (Double.isFinite(d)) {
        finite = finite.add(new BigDecimal(d));
      } else {
        nonFinite += d;
        sawNonFinite = true;
      }
    }

    long count() { return count; }

    double total() {
      return sawNonFinite ? nonFinite + finite.doubleValue() : finite.doubleValue();
    }
  }
}
