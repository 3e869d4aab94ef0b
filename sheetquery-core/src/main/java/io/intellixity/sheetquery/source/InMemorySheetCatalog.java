package io.intellixity.sheetquery.source;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Simple in-memory {@link SheetCatalog}.\n
 *
 * Immutable after construction. Useful for tests, demos and configuration-driven setups.\n
 */
public final class InMemorySheetCatalog implements SheetCatalog {
  private final Map<String, SheetDescriptor> sheets;

  public InMemorySheetCatalog(List<SheetDescriptor> descriptors) {
    Map<String, SheetDescriptor> m = new LinkedHashMap<>();
    for (SheetDescriptor d : descriptors) {
      if (m.putIfAbsent(d.sheetId(), d) != null) {
        throw new IllegalArgumentException("Duplicate sheet id: " + d.sheetId());
      }
    }
    this.sheets = Map.copyOf(m);
  }

  public static InMemorySheetCatalog of(SheetDescriptor... descriptors) {
    return new InMemorySheetCatalog(List.of(descriptors));
  }

  @Override
  public Optional<SheetDescriptor> resolve(String sheetId) {
    return Optional.ofNullable(sheets.get(sheetId));
  }
}
