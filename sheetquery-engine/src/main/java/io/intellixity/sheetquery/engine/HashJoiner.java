package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.value.Value;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Inner equi-join of the combined rows against one more sheet.\n
 *
 * The join sheet is indexed by its key tuple; each combined row probes the index with the tuple
 * taken from the <b>primary</b> sheet's row, never from a previously joined sheet. Duplicate keys
 * fan out, unmatched rows are dropped. Output keeps the order of the combined rows, then of the
 * join sheet's rows within one key.
 */
public final class HashJoiner {
  private HashJoiner() {}

  public static List<CombinedRow> join(List<CombinedRow> combined,
                                       String primaryAlias,
                                       String joinAlias,
                                       List<Map<String, Value>> joinRows,
                                       List<String> joinKeys) {
    if (combined.isEmpty()) return List.of();

    Map<List<Value>, List<Map<String, Value>>> index = new HashMap<>();
    for (Map<String, Value> row : joinRows) {
      index.computeIfAbsent(keyOf(row, joinKeys), k -> new ArrayList<>()).add(row);
    }

    List<CombinedRow> out = new ArrayList<>();
    for (CombinedRow merged : combined) {
      Map<String, Value> primary = merged.sheet(primaryAlias);
      if (primary == null) {
        throw new IllegalStateException("Primary alias '" + primaryAlias + "' missing in join context");
      }
      List<Map<String, Value>> matches = index.get(keyOf(primary, joinKeys));
      if (matches == null) continue;
      for (Map<String, Value> match : matches) out.add(merged.with(joinAlias, match));
    }
    return out;
  }

  static List<Value> keyOf(Map<String, Value> row, List<String> joinKeys) {
    List<Value> key = new ArrayList<>(joinKeys.size());
    for (String k : joinKeys) {
      Value v = row.get(k);
      key.add(v == null ? Value.NULL : v);
    }
    return key;
  }
}
