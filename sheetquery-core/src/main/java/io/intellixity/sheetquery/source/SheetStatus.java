package io.intellixity.sheetquery.source;

import java.util.Locale;

public enum SheetStatus {
  ACTIVE,
  INACTIVE,
  DEPRECATED;

  /** Lower-case name used in warnings and configuration. */
  public String label() {
    return name().toLowerCase(Locale.ROOT);
  }
}
