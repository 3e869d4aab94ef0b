package io.intellixity.sheetquery.query;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonNode;
import io.intellixity.sheetquery.value.Value;
import io.intellixity.sheetquery.value.Values;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Canonical JSON deserializer for {@link PreviewRequest}.\n
 *
 * Shape problems are reported as {@link QueryValidationException} so callers can map them to the
 * same client error as engine-side validation.
 */
public final class PreviewRequestJsonDeserializer extends JsonDeserializer<PreviewRequest> {
  @Override
  public PreviewRequest deserialize(JsonParser p, DeserializationContext ctxt) throws IOException {
    ObjectCodec codec = p.getCodec();
    JsonNode root = codec.readTree(p);
    if (root == null || root.isNull()) return null;
    if (!root.isObject()) throw new QueryValidationException("preview request must be an object");

    List<SheetSelection> sheets = parseSheets(root.get("sheets"));
    List<Projection> projections = parseProjections(root.get("projections"));
    List<Filter> filters = parseFilters(root.get("filters"), codec);
    Integer limit = parseLimit(root.get("limit"));
    return new PreviewRequest(sheets, projections, filters, limit);
  }

  private static List<SheetSelection> parseSheets(JsonNode arr) {
    if (arr == null || !arr.isArray() || arr.isEmpty()) {
      throw new QueryValidationException("'sheets' must be a non-empty array");
    }
    List<SheetSelection> out = new ArrayList<>();
    int index = 0;
    for (JsonNode s : arr) {
      index++;
      if (!s.isObject()) throw new QueryValidationException("each sheet entry must be an object");

      String sheetId = nonBlankText(s.get("sheetId"));
      if (sheetId == null) throw new QueryValidationException("sheetId is required for each sheet");

      String alias = nonBlankText(s.get("alias"));
      alias = alias == null ? "sheet_" + index : alias.trim();

      JsonNode roleNode = s.get("role");
      SheetRole role = SheetRole.PRIMARY;
      if (roleNode != null && !roleNode.isNull()) {
        if (!roleNode.isTextual()) throw new QueryValidationException("role must be a string when provided");
        role = SheetRole.fromWireName(roleNode.asText());
      }

      out.add(new SheetSelection(sheetId.trim(), alias, role, parseJoinKeys(s.get("joinKeys"))));
    }
    return out;
  }

  private static List<String> parseJoinKeys(JsonNode keys) {
    if (keys == null || keys.isNull()) return List.of();
    if (!keys.isArray()) throw new QueryValidationException("joinKeys must be an array of strings");
    List<String> out = new ArrayList<>();
    for (JsonNode k : keys) {
      String key;
      if (k.isTextual()) key = k.asText().trim();
      else if (k.isNumber()) key = k.asText();
      else throw new QueryValidationException("joinKeys must contain only strings or numbers");
      if (key.isEmpty()) throw new QueryValidationException("joinKeys entries must be non-empty strings");
      out.add(key);
    }
    return out;
  }

  private static List<Projection> parseProjections(JsonNode arr) {
    if (arr == null || !arr.isArray() || arr.isEmpty()) {
      throw new QueryValidationException("'projections' must be a non-empty array");
    }
    List<Projection> out = new ArrayList<>();
    for (JsonNode x : arr) {
      if (!x.isObject()) throw new QueryValidationException("each projection must be an object");
      String expression = nonBlankText(x.get("expression"));
      String label = nonBlankText(x.get("label"));
      if (expression == null) throw new QueryValidationException("projection expression must be a non-empty string");
      if (label == null) throw new QueryValidationException("projection label must be a non-empty string");
      out.add(new Projection(expression, label));
    }
    return out;
  }

  private static List<Filter> parseFilters(JsonNode arr, ObjectCodec codec) throws IOException {
    if (arr == null || arr.isNull()) return List.of();
    if (!arr.isArray()) throw new QueryValidationException("'filters' must be an array when provided");
    List<Filter> out = new ArrayList<>();
    for (JsonNode f : arr) {
      if (!f.isObject()) throw new QueryValidationException("each filter must be an object");
      String alias = nonBlankText(f.get("sheetAlias"));
      String column = nonBlankText(f.get("column"));
      String operator = nonBlankText(f.get("operator"));
      if (alias == null) throw new QueryValidationException("filter sheetAlias must be a non-empty string");
      if (column == null) throw new QueryValidationException("filter column must be a non-empty string");
      if (operator == null) throw new QueryValidationException("filter operator must be a non-empty string");
      out.add(new Filter(alias, column, operator, decodeValue(f.get("value"), codec)));
    }
    return out;
  }

  private static Integer parseLimit(JsonNode n) {
    if (n == null || n.isNull()) return null;
    if (!n.isIntegralNumber() || !n.canConvertToInt()) {
      throw new QueryValidationException("limit must be an integer when provided");
    }
    int limit = n.intValue();
    if (limit <= 0) throw new QueryValidationException("limit must be greater than zero");
    return limit;
  }

  private static Value decodeValue(JsonNode v, ObjectCodec codec) throws IOException {
    if (v == null || v.isNull()) return Value.NULL;
    if (v.isNumber()) return Value.number(v.doubleValue());
    if (v.isTextual()) return Value.text(v.asText());
    return Values.of(codec.treeToValue(v, Object.class));
  }

  // Returned as sent; callers trim where the value is an identifier.
  private static String nonBlankText(JsonNode n) {
    if (n == null || !n.isTextual()) return null;
    String s = n.asText();
    return s.isBlank() ? null : s;
  }
}
