package io.intellixity.sheetquery.query;

import com.fasterxml.jackson.databind.annotation.JsonSerialize;

import java.util.ArrayList;
import java.util.List;

/**
 * Tabular preview output. Every row holds one cell per header.
 *
 * @param executionMs wall-clock pipeline time in milliseconds
 * @param rowCount number of rows after the limit was applied
 */
@JsonSerialize(using = PreviewResultJsonSerializer.class)
public record PreviewResult(List<String> headers,
                            List<List<String>> rows,
                            List<String> warnings,
                            double executionMs,
                            int rowCount) {
  public PreviewResult {
    headers = List.copyOf(headers);
    List<List<String>> copied = new ArrayList<>(rows.size());
    for (List<String> r : rows) {
      if (r.size() != headers.size()) {
        throw new IllegalArgumentException("row width " + r.size() + " does not match " + headers.size() + " headers");
      }
      copied.add(List.copyOf(r));
    }
    rows = List.copyOf(copied);
    warnings = List.copyOf(warnings);
  }
}
