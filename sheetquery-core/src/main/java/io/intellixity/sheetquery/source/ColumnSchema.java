package io.intellixity.sheetquery.source;

/**
 * @param name column header
 * @param inferredType type detected at ingestion time (e.g. "string", "number"); may be null
 */
public record ColumnSchema(String name, String inferredType) {
  public ColumnSchema {
    if (name == null) throw new IllegalArgumentException("name is required");
  }

  public static ColumnSchema of(String name, String inferredType) {
    return new ColumnSchema(name, inferredType);
  }
}
