package io.intellixity.sheetquery.files;

import java.util.Locale;

public enum FileType {
  CSV,
  EXCEL;

  /** Accepts {@code csv}, {@code excel} and {@code xlsx}, case-insensitively. */
  public static FileType fromName(String name) {
    if (name == null || name.isBlank()) throw new IllegalArgumentException("file type is required");
    return switch (name.trim().toLowerCase(Locale.ROOT)) {
      case "csv" -> CSV;
      case "excel", "xlsx" -> EXCEL;
      default -> throw new IllegalArgumentException("unsupported file type '" + name + "'");
    };
  }
}
