package io.intellixity.sheetquery.query;

/**
 * Output column of a preview.
 *
 * @param expression {@code alias.column}, {@code column}, {@code sum|avg|count(alias.column)} or {@code count(*)}
 * @param label header emitted for this column
 */
public record Projection(String expression, String label) {
  public Projection {
    if (expression == null) throw new IllegalArgumentException("expression is required");
    if (label == null) throw new IllegalArgumentException("label is required");
  }

  public static Projection of(String expression, String label) {
    return new Projection(expression, label);
  }
}
