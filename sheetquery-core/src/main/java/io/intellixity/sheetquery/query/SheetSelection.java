package io.intellixity.sheetquery.query;

import java.util.List;

/**
 * One sheet taking part in a preview.
 *
 * @param sheetId catalog identifier of the sheet
 * @param alias request-local name used by projections and filters
 * @param role primary, join or union; defaults to primary
 * @param joinKeys columns matched against the primary sheet, in tuple order
 */
public record SheetSelection(String sheetId, String alias, SheetRole role, List<String> joinKeys) {
  public SheetSelection {
    if (sheetId == null || sheetId.isBlank()) throw new IllegalArgumentException("sheetId is required");
    if (alias == null || alias.isBlank()) throw new IllegalArgumentException("alias is required");
    role = role == null ? SheetRole.PRIMARY : role;
    joinKeys = List.copyOf(joinKeys == null ? List.of() : joinKeys);
  }

  public static SheetSelection primary(String sheetId, String alias) {
    return new SheetSelection(sheetId, alias, SheetRole.PRIMARY, List.of());
  }

  public static SheetSelection join(String sheetId, String alias, String... joinKeys) {
    return new SheetSelection(sheetId, alias, SheetRole.JOIN, List.of(joinKeys));
  }

  public static SheetSelection union(String sheetId, String alias) {
    return new SheetSelection(sheetId, alias, SheetRole.UNION, List.of());
  }
}
