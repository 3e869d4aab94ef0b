package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.value.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One row of the in-progress join result: alias to that sheet's row.\n
 *
 * Immutable; joining produces a new instance that shares the sheet rows of its parent.
 */
public final class CombinedRow {
  private final Map<String, Map<String, Value>> sheets;

  private CombinedRow(Map<String, Map<String, Value>> sheets) {
    this.sheets = sheets;
  }

  public static CombinedRow seed(String alias, Map<String, Value> row) {
    Map<String, Map<String, Value>> m = new LinkedHashMap<>();
    m.put(alias, row);
    return new CombinedRow(Collections.unmodifiableMap(m));
  }

  public CombinedRow with(String alias, Map<String, Value> row) {
    Map<String, Map<String, Value>> m = new LinkedHashMap<>(sheets);
    m.put(alias, row);
    return new CombinedRow(Collections.unmodifiableMap(m));
  }

  public boolean has(String alias) {
    return sheets.containsKey(alias);
  }

  /** Sheet row for the alias, or null when the alias is not part of this row. */
  public Map<String, Value> sheet(String alias) {
    return sheets.get(alias);
  }

  /** Cell value; {@link Value#NULL} when the alias or column is absent. */
  public Value get(String alias, String column) {
    Map<String, Value> row = sheets.get(alias);
    if (row == null) return Value.NULL;
    Value v = row.get(column);
    return v == null ? Value.NULL : v;
  }

  @Override
  public String toString() {
    return "CombinedRow" + sheets.keySet();
  }
}
