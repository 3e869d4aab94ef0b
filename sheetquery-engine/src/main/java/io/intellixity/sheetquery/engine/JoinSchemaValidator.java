package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.source.ColumnSchema;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Checks join keys against the declared column schemas of both sides.\n
 *
 * A key missing on either side fails the preview. Differing declared types only produce a warning:
 * the join still runs with raw value equality.
 */
public final class JoinSchemaValidator {
  private JoinSchemaValidator() {}

  public static List<String> validate(List<ColumnSchema> primarySchema,
                                      List<ColumnSchema> joinSchema,
                                      List<String> joinKeys,
                                      String primaryAlias,
                                      String joinAlias) {
    if (joinKeys == null || joinKeys.isEmpty()) {
      throw new QueryValidationException("join keys required for alias " + joinAlias);
    }
    Map<String, ColumnSchema> primary = byName(primarySchema);
    Map<String, ColumnSchema> join = byName(joinSchema);

    List<String> warnings = new ArrayList<>();
    for (String key : joinKeys) {
      ColumnSchema p = primary.get(key);
      if (p == null) {
        throw new QueryValidationException("join column '" + key + "' missing on sheet alias '" + primaryAlias + "'");
      }
      ColumnSchema j = join.get(key);
      if (j == null) {
        throw new QueryValidationException("join column '" + key + "' missing on sheet alias '" + joinAlias + "'");
      }

      String pt = normalizedType(p);
      String jt = normalizedType(j);
      if (!pt.isEmpty() && !jt.isEmpty() && !pt.equals(jt)) {
        warnings.add("Join column '" + key + "' uses incompatible types between '"
            + primaryAlias + "' (" + pt + ") and '" + joinAlias + "' (" + jt + ").");
      }
    }
    return warnings;
  }

  private static Map<String, ColumnSchema> byName(List<ColumnSchema> schema) {
    Map<String, ColumnSchema> m = new LinkedHashMap<>();
    if (schema == null) return m;
    for (ColumnSchema c : schema) m.put(c.name(), c);
    return m;
  }

  private static String normalizedType(ColumnSchema c) {
    return c.inferredType() == null ? "" : c.inferredType().trim().toLowerCase(Locale.ROOT);
  }
}
