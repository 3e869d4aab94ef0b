package io.intellixity.sheetquery.examples.config;

import io.intellixity.sheetquery.engine.QueryBuilderService;
import io.intellixity.sheetquery.files.FileRowSource;
import io.intellixity.sheetquery.files.FileType;
import io.intellixity.sheetquery.files.SheetFile;
import io.intellixity.sheetquery.files.SheetFileLocator;
import io.intellixity.sheetquery.source.ColumnSchema;
import io.intellixity.sheetquery.source.InMemorySheetCatalog;
import io.intellixity.sheetquery.source.SheetDescriptor;
import io.intellixity.sheetquery.source.SheetStatus;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

@Configuration
@EnableConfigurationProperties(SheetsProperties.class)
public class SheetQueryExampleConfig {

  @Bean
  public InMemorySheetCatalog sheetCatalog(SheetsProperties props) {
    return catalog(props);
  }

  @Bean
  public FileRowSource fileRowSource(SheetsProperties props) {
    return new FileRowSource(locator(props));
  }

  @Bean
  public QueryBuilderService queryBuilderService(InMemorySheetCatalog catalog, FileRowSource rows) {
    return new QueryBuilderService(catalog, rows);
  }

  static InMemorySheetCatalog catalog(SheetsProperties props) {
    List<SheetDescriptor> out = new ArrayList<>();
    for (Map.Entry<String, SheetsProperties.SheetSource> e : props.getSheets().entrySet()) {
      SheetsProperties.SheetSource s = e.getValue();
      List<ColumnSchema> columns = new ArrayList<>();
      for (SheetsProperties.Column c : s.getColumns()) columns.add(ColumnSchema.of(c.getName(), c.getInferredType()));
      out.add(new SheetDescriptor(e.getKey(), s.getLabel(), status(e.getKey(), s.getStatus()), columns));
    }
    return new InMemorySheetCatalog(out);
  }

  // Resolved once at startup; lookups are read-only afterwards.
  static SheetFileLocator locator(SheetsProperties props) {
    Path base = Path.of(props.getBaseDir());
    Map<String, SheetFile> files = new HashMap<>();
    props.getSheets().forEach((id, s) -> {
      if (s.getPath() == null || s.getPath().isBlank()) return;
      FileType type = FileType.fromName(s.getFileType());
      files.put(id, new SheetFile(base.resolve(s.getPath()).normalize(), type, delimiter(id, s.getDelimiter()), s.getSheetName()));
    });
    Map<String, SheetFile> frozen = Map.copyOf(files);
    return id -> Optional.ofNullable(frozen.get(id));
  }

  private static SheetStatus status(String sheetId, String status) {
    if (status == null || status.isBlank()) return SheetStatus.ACTIVE;
    try {
      return SheetStatus.valueOf(status.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new IllegalArgumentException("Unknown status '" + status + "' for sheet " + sheetId, e);
    }
  }

  private static char delimiter(String sheetId, String delimiter) {
    if (delimiter == null || delimiter.isEmpty()) return ',';
    if (delimiter.equals("\\t")) return '\t';
    if (delimiter.length() != 1) {
      throw new IllegalArgumentException("Delimiter for sheet " + sheetId + " must be a single character");
    }
    return delimiter.charAt(0);
  }
}
