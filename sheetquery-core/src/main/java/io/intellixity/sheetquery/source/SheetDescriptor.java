package io.intellixity.sheetquery.source;

import java.util.List;

/**
 * Catalog view of one sheet source.
 *
 * @param schema columns in sheet order
 */
public record SheetDescriptor(String sheetId, String displayLabel, SheetStatus status, List<ColumnSchema> schema) {
  public SheetDescriptor {
    if (sheetId == null || sheetId.isBlank()) throw new IllegalArgumentException("sheetId is required");
    displayLabel = displayLabel == null ? sheetId : displayLabel;
    status = status == null ? SheetStatus.ACTIVE : status;
    schema = List.copyOf(schema == null ? List.of() : schema);
  }

  public boolean active() {
    return status == SheetStatus.ACTIVE;
  }
}
