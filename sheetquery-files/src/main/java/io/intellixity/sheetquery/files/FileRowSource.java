package io.intellixity.sheetquery.files;

import io.intellixity.sheetquery.source.RowSource;
import io.intellixity.sheetquery.source.SourceUnavailableException;
import io.intellixity.sheetquery.value.Value;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link RowSource} reading CSV and Excel files on every call.\n
 *
 * Nothing is cached; concurrent loads of the same sheet read the file independently.
 */
public final class FileRowSource implements RowSource {
  private static final Logger log = LoggerFactory.getLogger(FileRowSource.class);

  private final SheetFileLocator locator;

  public FileRowSource(SheetFileLocator locator) {
    this.locator = Objects.requireNonNull(locator, "locator");
  }

  @Override
  public List<Map<String, Value>> load(String sheetId) {
    SheetFile file = locator.locate(sheetId)
        .orElseThrow(() -> new SourceUnavailableException(sheetId,
            "Backing data file for sheet '" + sheetId + "' not found."));
    if (!Files.isRegularFile(file.path())) {
      throw new SourceUnavailableException(sheetId, "Sheet data file missing on disk: " + file.path());
    }

    long start = System.nanoTime();
    List<Map<String, Value>> rows;
    try {
      rows = switch (file.fileType()) {
        case CSV -> CsvSheetReader.read(file);
        case EXCEL -> ExcelSheetReader.read(file);
      };
    } catch (IOException | RuntimeException e) {
      throw new SourceUnavailableException(sheetId,
          "Failed to read sheet '" + sheetId + "' from " + file.path() + ": " + e.getMessage(), e);
    }

    if (log.isDebugEnabled()) {
      log.debug("sheetquery.file_load sheetId={} type={} rows={} durationMs={}",
          sheetId, file.fileType(), rows.size(), (System.nanoTime() - start) / 1_000_000.0);
    }
    return rows;
  }
}
