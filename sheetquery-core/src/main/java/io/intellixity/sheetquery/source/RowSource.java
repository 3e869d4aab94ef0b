package io.intellixity.sheetquery.source;

import io.intellixity.sheetquery.value.Value;

import java.util.List;
import java.util.Map;

/**
 * Materializes the rows of one sheet.\n
 *
 * Rows keep sheet order; each row maps column name to cell value. Implementations must tolerate
 * concurrent callers and throw {@link SourceUnavailableException} when the data cannot be read.
 */
public interface RowSource {
  List<Map<String, Value>> load(String sheetId);
}
