package io.intellixity.sheetquery.engine.expr;

/** {@code count(*)}: number of surviving combined rows. */
public record CountStar() implements ProjectionExpression {
  @Override
  public boolean aggregate() { return true; }
}
