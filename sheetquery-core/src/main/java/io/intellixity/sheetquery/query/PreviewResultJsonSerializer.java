package io.intellixity.sheetquery.query;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;

import java.io.IOException;
import java.util.List;

/** Canonical JSON serializer for {@link PreviewResult}. */
public final class PreviewResultJsonSerializer extends JsonSerializer<PreviewResult> {
  @Override
  public void serialize(PreviewResult r, JsonGenerator g, SerializerProvider serializers) throws IOException {
    if (r == null) {
      g.writeNull();
      return;
    }

    g.writeStartObject();
    writeStrings(g, "headers", r.headers());

    g.writeArrayFieldStart("rows");
    for (List<String> row : r.rows()) {
      g.writeStartArray();
      for (String cell : row) g.writeString(cell);
      g.writeEndArray();
    }
    g.writeEndArray();

    writeStrings(g, "warnings", r.warnings());

    g.writeObjectFieldStart("executionMetrics");
    g.writeNumberField("executionMs", r.executionMs());
    g.writeNumberField("rowCount", r.rowCount());
    g.writeEndObject();

    g.writeEndObject();
  }

  private static void writeStrings(JsonGenerator g, String field, List<String> values) throws IOException {
    g.writeArrayFieldStart(field);
    for (String v : values) g.writeString(v);
    g.writeEndArray();
  }
}
