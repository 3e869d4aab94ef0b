package io.intellixity.sheetquery.engine.expr;

/**
 * Parsed projection: {@link ColumnRef}, {@link AggregateRef} or {@link CountStar}.
 */
public interface ProjectionExpression {
  boolean aggregate();
}
