package io.intellixity.sheetquery.files;

import io.intellixity.sheetquery.value.Value;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.apache.commons.csv.DuplicateHeaderMode;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited UTF-8 file whose first record is the header.\n
 *
 * Every present field is text, empty fields included; fields missing from a short record are null.
 * Repeated header names keep the last column.
 */
final class CsvSheetReader {
  private CsvSheetReader() {}

  static List<Map<String, Value>> read(SheetFile file) throws IOException {
    CSVFormat format = CSVFormat.DEFAULT.builder()
        .setDelimiter(file.delimiter())
        .setHeader()
        .setSkipHeaderRecord(true)
        .setAllowMissingColumnNames(true)
        .setDuplicateHeaderMode(DuplicateHeaderMode.ALLOW_ALL)
        .build();

    try (BufferedReader reader = Files.newBufferedReader(file.path(), StandardCharsets.UTF_8);
         CSVParser parser = format.parse(reader)) {
      Map<String, Integer> columns = columns(parser.getHeaderMap());
      List<Map<String, Value>> rows = new ArrayList<>();
      for (CSVRecord record : parser) {
        Map<String, Value> row = new LinkedHashMap<>();
        for (var c : columns.entrySet()) {
          int i = c.getValue();
          row.put(c.getKey(), record.isSet(i) ? Value.text(record.get(i)) : Value.NULL);
        }
        rows.add(Collections.unmodifiableMap(row));
      }
      return rows;
    }
  }

  private static Map<String, Integer> columns(Map<String, Integer> headerMap) {
    Map<String, Integer> out = new LinkedHashMap<>();
    if (headerMap == null) return out;
    for (var e : headerMap.entrySet()) {
      if (e.getKey() != null && !e.getKey().isEmpty()) out.put(e.getKey(), e.getValue());
    }
    return out;
  }
}
