package io.intellixity.sheetquery.files;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Backing file of one sheet.
 *
 * @param delimiter CSV field separator, {@code ','} when not set
 * @param sheetName Excel worksheet; the first worksheet when null
 */
public record SheetFile(Path path, FileType fileType, char delimiter, String sheetName) {
  public SheetFile {
    Objects.requireNonNull(path, "path");
    Objects.requireNonNull(fileType, "fileType");
    if (delimiter == '\0') delimiter = ',';
    if (sheetName != null && sheetName.isBlank()) sheetName = null;
  }

  public static SheetFile csv(Path path) {
    return new SheetFile(path, FileType.CSV, ',', null);
  }

  public static SheetFile csv(Path path, char delimiter) {
    return new SheetFile(path, FileType.CSV, delimiter, null);
  }

  public static SheetFile excel(Path path, String sheetName) {
    return new SheetFile(path, FileType.EXCEL, ',', sheetName);
  }
}
