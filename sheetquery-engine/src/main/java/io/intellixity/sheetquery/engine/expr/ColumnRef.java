package io.intellixity.sheetquery.engine.expr;

/** Scalar {@code alias.column}; resolved per combined row. */
public record ColumnRef(String alias, String column) implements ProjectionExpression {
  @Override
  public boolean aggregate() { return false; }
}
