package io.intellixity.sheetquery.source;

import io.intellixity.sheetquery.value.Value;
import io.intellixity.sheetquery.value.Values;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * {@link RowSource} over rows held in memory. Sheets that were never registered are unavailable.\n
 *
 * Immutable: {@link #with} returns a new source and leaves this one untouched.
 */
public final class InMemoryRowSource implements RowSource {
  private final Map<String, List<Map<String, Value>>> rows;

  public InMemoryRowSource() {
    this(Map.of());
  }

  private InMemoryRowSource(Map<String, List<Map<String, Value>>> rows) {
    this.rows = rows;
  }

  /** Copy of this source with {@code sheetId} registered; cell objects are lifted with {@link Values#of(Object)}. */
  public InMemoryRowSource with(String sheetId, List<? extends Map<String, ?>> raw) {
    List<Map<String, Value>> out = new ArrayList<>(raw.size());
    for (Map<String, ?> r : raw) {
      Map<String, Value> row = new LinkedHashMap<>();
      for (var e : r.entrySet()) row.put(e.getKey(), Values.of(e.getValue()));
      out.add(Collections.unmodifiableMap(row));
    }
    Map<String, List<Map<String, Value>>> next = new HashMap<>(rows);
    next.put(sheetId, Collections.unmodifiableList(out));
    return new InMemoryRowSource(Map.copyOf(next));
  }

  @Override
  public List<Map<String, Value>> load(String sheetId) {
    List<Map<String, Value>> r = rows.get(sheetId);
    if (r == null) throw new SourceUnavailableException(sheetId, "No rows registered for sheet '" + sheetId + "'");
    return r;
  }
}
