package io.intellixity.sheetquery.engine.expr;

import java.util.Objects;

/** {@code sum|avg|count(alias.column)} over the whole filtered row set. */
public record AggregateRef(AggregateFunction function, String alias, String column) implements ProjectionExpression {
  public AggregateRef {
    Objects.requireNonNull(function, "function");
  }

  @Override
  public boolean aggregate() { return true; }
}
