package io.intellixity.sheetquery.files;

import java.util.Optional;

/** Maps a sheet id to its backing file. */
@FunctionalInterface
public interface SheetFileLocator {
  Optional<SheetFile> locate(String sheetId);
}
