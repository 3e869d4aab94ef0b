package io.intellixity.sheetquery.engine;

import io.intellixity.sheetquery.query.QueryValidationException;
import io.intellixity.sheetquery.value.Value;
import io.intellixity.sheetquery.value.Values;

import java.util.Locale;
import java.util.OptionalDouble;

public enum FilterOperator {
  EQ {
    @Override boolean test(Value actual, Value expected) { return actual.equals(expected); }
  },
  NE {
    @Override boolean test(Value actual, Value expected) { return !actual.equals(expected); }
  },
  // Text only; any other operand type simply does not match.
  CONTAINS {
    @Override boolean test(Value actual, Value expected) {
      if (!(actual instanceof Value.Text a) || !(expected instanceof Value.Text e)) return false;
      return a.value().toLowerCase(Locale.ROOT).contains(e.value().toLowerCase(Locale.ROOT));
    }
  },
  GT {
    @Override boolean test(Value actual, Value expected) { return compare(actual, expected) > 0; }
  },
  LT {
    @Override boolean test(Value actual, Value expected) { return compare(actual, expected) < 0; }
  };

  abstract boolean test(Value actual, Value expected);

  public static FilterOperator parse(String raw) {
    String op = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
    for (FilterOperator o : values()) {
      if (o.name().toLowerCase(Locale.ROOT).equals(op)) return o;
    }
    throw new QueryValidationException("unsupported filter operator '" + op + "'");
  }

  // 0 when either side is not numeric, so both gt and lt reject the row.
  private static int compare(Value actual, Value expected) {
    OptionalDouble l = Values.toNumber(actual);
    OptionalDouble r = Values.toNumber(expected);
    if (l.isEmpty() || r.isEmpty()) return 0;
    double a = l.getAsDouble();
    double b = r.getAsDouble();
    if (a > b) return 1;
    if (a < b) return -1;
    return 0;
  }
}
