package io.intellixity.sheetquery.query;

public enum SheetRole {
  PRIMARY("primary"),
  JOIN("join"),

  // Accepted by the model, rejected at execution.
  UNION("union");

  private final String wireName;

  SheetRole(String wireName) {
    this.wireName = wireName;
  }

  public static SheetRole fromWireName(String raw) {
    if (raw == null) throw new QueryValidationException("role must be a string when provided");
    for (SheetRole r : values()) {
      if (r.wireName.equals(raw)) return r;
    }
    throw new QueryValidationException("unsupported role '" + raw + "'");
  }
}
