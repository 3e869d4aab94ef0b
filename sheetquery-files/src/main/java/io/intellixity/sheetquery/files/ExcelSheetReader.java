package io.intellixity.sheetquery.files;

import io.intellixity.sheetquery.value.Value;
import io.intellixity.sheetquery.value.Values;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.DateUtil;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads one worksheet of a workbook; its first row is the header.\n
 *
 * Numeric cells become numbers, date-formatted cells ISO-8601 text, formulas their cached result.
 * Columns with a blank header are dropped.
 */
final class ExcelSheetReader {
  private ExcelSheetReader() {}

  static List<Map<String, Value>> read(SheetFile file) throws IOException {
    try (Workbook workbook = WorkbookFactory.create(file.path().toFile(), null, true)) {
      Sheet sheet = sheet(workbook, file.sheetName());
      if (sheet.getPhysicalNumberOfRows() == 0) return List.of();

      int first = sheet.getFirstRowNum();
      List<String> headers = headers(sheet.getRow(first));
      List<Map<String, Value>> rows = new ArrayList<>();
      for (int r = first + 1; r <= sheet.getLastRowNum(); r++) {
        Row row = sheet.getRow(r);
        Map<String, Value> out = new LinkedHashMap<>();
        for (int c = 0; c < headers.size(); c++) {
          String header = headers.get(c);
          if (header.isEmpty()) continue;
          out.put(header, row == null ? Value.NULL : cellValue(row.getCell(c)));
        }
        rows.add(Collections.unmodifiableMap(out));
      }
      return rows;
    }
  }

  private static Sheet sheet(Workbook workbook, String sheetName) throws IOException {
    if (sheetName == null) {
      if (workbook.getNumberOfSheets() == 0) throw new IOException("workbook has no worksheets");
      return workbook.getSheetAt(0);
    }
    Sheet sheet = workbook.getSheet(sheetName);
    if (sheet == null) throw new IOException("worksheet '" + sheetName + "' not found in workbook");
    return sheet;
  }

  private static List<String> headers(Row row) {
    List<String> out = new ArrayList<>();
    if (row == null) return out;
    for (int c = 0; c < row.getLastCellNum(); c++) {
      out.add(Values.display(cellValue(row.getCell(c))).trim());
    }
    return out;
  }

  static Value cellValue(Cell cell) {
    if (cell == null) return Value.NULL;
    CellType type = cell.getCellType();
    if (type == CellType.FORMULA) type = cell.getCachedFormulaResultType();
    return switch (type) {
      case NUMERIC -> DateUtil.isCellDateFormatted(cell)
          ? Value.text(isoDate(cell.getLocalDateTimeCellValue()))
          : Value.number(cell.getNumericCellValue());
      case STRING -> Value.text(cell.getStringCellValue());
      case BOOLEAN -> Value.text(String.valueOf(cell.getBooleanCellValue()));
      default -> Value.NULL;
    };
  }

  // Date-only values drop the midnight time part.
  private static String isoDate(LocalDateTime dt) {
    if (dt == null) return null;
    return dt.toLocalTime().equals(LocalTime.MIDNIGHT) ? dt.toLocalDate().toString() : dt.toString();
  }
}
