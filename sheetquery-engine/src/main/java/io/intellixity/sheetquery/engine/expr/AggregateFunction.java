package io.intellixity.sheetquery.engine.expr;

import java.util.Locale;

public enum AggregateFunction {
  SUM,
  AVG,
  COUNT;

  public String functionName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /** Case-insensitive lookup; null when the name is not an aggregate. */
  static AggregateFunction tryParse(String name) {
    if (name == null) return null;
    String n = name.trim().toLowerCase(Locale.ROOT);
    for (AggregateFunction f : values()) {
      if (f.functionName().equals(n)) return f;
    }
    return null;
  }
}
