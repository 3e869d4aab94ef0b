package io.intellixity.sheetquery.source;

import java.util.Optional;

/**
 * Read-only lookup of sheet metadata. Implementations must tolerate concurrent callers.
 */
public interface SheetCatalog {
  Optional<SheetDescriptor> resolve(String sheetId);
}
