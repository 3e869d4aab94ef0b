package io.intellixity.sheetquery.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "sheetquery")
public class SheetsProperties {
  /** Directory relative sheet paths resolve against. */
  private String baseDir = ".";
  private final Map<String, SheetSource> sheets = new LinkedHashMap<>();

  public String getBaseDir() { return baseDir; }
  public void setBaseDir(String baseDir) { this.baseDir = baseDir; }
  public Map<String, SheetSource> getSheets() { return sheets; }

  public static class SheetSource {
    private String label;
    private String status = "active";
    private String path;
    private String fileType = "csv";
    private String delimiter = ",";

    /** Excel worksheet; the first one when absent. */
    private String sheetName;
    private final List<Column> columns = new ArrayList<>();

    public String getLabel() { return label; }
    public void setLabel(String label) { this.label = label; }
    public String getStatus() { return status; }
    public void setStatus(String status) { this.status = status; }
    public String getPath() { return path; }
    public void setPath(String path) { this.path = path; }
    public String getFileType() { return fileType; }
    public void setFileType(String fileType) { this.fileType = fileType; }
    public String getDelimiter() { return delimiter; }
    public void setDelimiter(String delimiter) { this.delimiter = delimiter; }
    public String getSheetName() { return sheetName; }
    public void setSheetName(String sheetName) { this.sheetName = sheetName; }
    public List<Column> getColumns() { return columns; }
  }

  public static class Column {
    private String name;
    private String inferredType;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getInferredType() { return inferredType; }
    public void setInferredType(String inferredType) { this.inferredType = inferredType; }
  }
}
